package io.tickersched.runtime;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait used for rate-limit pacing and retry backoff. Swapped for a clock-advancing fake in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> {
        if (!d.isNegative() && !d.isZero()) TimeUnit.NANOSECONDS.sleep(d.toNanos());
    };

    void sleep(Duration duration) throws InterruptedException;
}
