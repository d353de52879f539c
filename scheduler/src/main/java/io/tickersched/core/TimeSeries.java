package io.tickersched.core;

import java.util.List;

/**
 * Bars returned by one fetch, oldest first.
 */
public record TimeSeries(String entity, String interval, List<Bar> bars) {
    public TimeSeries {
        bars = bars == null ? List.of() : List.copyOf(bars);
    }

    public static TimeSeries empty(String entity, String interval) {
        return new TimeSeries(entity, interval, List.of());
    }

    public int size() { return bars.size(); }
    public boolean isEmpty() { return bars.isEmpty(); }
}
