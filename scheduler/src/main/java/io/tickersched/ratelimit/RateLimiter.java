package io.tickersched.ratelimit;

import java.time.Duration;
import java.util.Map;

/**
 * Computes the spacing required between consecutive fetches of an interval class. Implementations never block;
 * the caller sleeps.
 */
public interface RateLimiter {
    Duration delayFor(String interval);

    /** Feeds back one throttling-relevant fetch outcome. */
    void recordOutcome(String interval, boolean success);

    RateLimiterState state(String interval);

    Map<String, RateLimiterState> snapshot();

    void restore(Map<String, RateLimiterState> states);
}
