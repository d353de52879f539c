package io.tickersched.core;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed ticker list shared by all intervals, with optional per-interval overrides.
 */
public class StaticTickerUniverse implements TickerUniverse {
    private final List<String> tickers;
    private final Map<String, List<String>> overrides = new HashMap<>();

    public StaticTickerUniverse(List<String> tickers) {
        this.tickers = List.copyOf(tickers);
    }

    public StaticTickerUniverse override(String interval, List<String> intervalTickers) {
        overrides.put(interval, List.copyOf(intervalTickers));
        return this;
    }

    @Override
    public List<String> entities(String interval) {
        return overrides.getOrDefault(interval, tickers);
    }
}
