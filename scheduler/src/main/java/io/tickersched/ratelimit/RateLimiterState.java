package io.tickersched.ratelimit;

import java.time.Duration;

/**
 * Current pacing for one interval class.
 */
public record RateLimiterState(Duration currentDelay, int recentErrorStreak) {}
