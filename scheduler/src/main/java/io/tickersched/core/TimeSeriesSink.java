package io.tickersched.core;

import java.io.IOException;

/**
 * Receives successfully fetched series. Storage format is the implementation's business.
 */
@FunctionalInterface
public interface TimeSeriesSink {
    TimeSeriesSink NO_OP = (item, series) -> {};

    void accept(WorkItem item, TimeSeries series) throws IOException;
}
