package io.tickersched.strategy;

import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.runtime.PassRunnerFactory;

import java.util.List;
import java.util.Locale;

public final class Strategies {
    public static final List<String> NAMES = List.of(ResumeStrategy.NAME, CrossIntervalStrategy.NAME,
            QuotaStrategy.NAME, ParallelStrategy.NAME);

    private Strategies() {}

    /**
     * @param limiter shared limiter; sequential strategies pace with it directly, parallel workers start from
     *                and report back into it
     */
    public static ExecutionStrategy create(String name, PassRunnerFactory runners, RateLimiter limiter) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case ResumeStrategy.NAME:
                return new ResumeStrategy(runners.config(), runners.create(limiter));
            case CrossIntervalStrategy.NAME:
                return new CrossIntervalStrategy(runners.config(), runners.create(limiter));
            case QuotaStrategy.NAME:
                return new QuotaStrategy(runners.config(), runners.create(limiter));
            case ParallelStrategy.NAME:
                return new ParallelStrategy(runners.config(), runners, limiter);
            default:
                throw new IllegalArgumentException("unknown strategy '" + name + "', expected one of " + NAMES);
        }
    }
}
