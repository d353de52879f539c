package io.tickersched.core;

import io.tickersched.error.FetchFailure;

import java.time.Instant;

/**
 * Fetches bars for one entity and interval from the upstream provider.
 * Implementations must bound each call; the executor additionally enforces its own timeout.
 */
@FunctionalInterface
public interface TimeSeriesFetcher {
    /**
     * @param since last successful update for this entity and interval, or null when never fetched
     */
    TimeSeries fetch(String entity, String interval, Instant since) throws FetchFailure;
}
