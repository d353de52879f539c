package io.tickersched.runtime;

import com.codahale.metrics.MetricRegistry;
import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.TickerUniverse;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.TimeSeriesSink;
import io.tickersched.error.FetchDiagnostics;
import io.tickersched.metadata.EntityMetadataStore;
import io.tickersched.priority.PriorityScorer;
import io.tickersched.progress.ProgressStateStore;
import io.tickersched.ratelimit.AdaptiveRateLimiter;
import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.retry.ExponentialBackoffRetryPolicy;

import java.time.Clock;

/**
 * Builds pass runners over the shared stores. Each runner gets its own executor; the rate limiter is chosen
 * by the caller so parallel workers can pace independently.
 */
public class PassRunnerFactory {
    private final SchedulerConfig config;
    private final TickerUniverse universe;
    private final TimeSeriesFetcher fetcher;
    private final TimeSeriesSink sink;
    private final EntityMetadataStore metadata;
    private final ProgressStateStore progress;
    private final PriorityScorer scorer;
    private final FetchDiagnostics diagnostics;
    private final MetricRegistry registry;
    private final Clock clock;
    private final Sleeper sleeper;

    public PassRunnerFactory(SchedulerConfig config,
                             TickerUniverse universe,
                             TimeSeriesFetcher fetcher,
                             TimeSeriesSink sink,
                             EntityMetadataStore metadata,
                             ProgressStateStore progress,
                             PriorityScorer scorer,
                             FetchDiagnostics diagnostics,
                             MetricRegistry registry,
                             Clock clock,
                             Sleeper sleeper) {
        this.config = config;
        this.universe = universe;
        this.fetcher = fetcher;
        this.sink = sink;
        this.metadata = metadata;
        this.progress = progress;
        this.scorer = scorer;
        this.diagnostics = diagnostics;
        this.registry = registry;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public SchedulerConfig config() { return config; }

    public RateLimiter newRateLimiter() {
        return new AdaptiveRateLimiter(config.minDelay(), config.maxDelay(), config.delayIncreaseFactor(),
                config.delayIncreaseStep(), config.delayDecayFactor());
    }

    public PassRunner create(RateLimiter limiter) {
        BatchExecutor executor = new BatchExecutorBuilder()
                .fetcher(fetcher)
                .sink(sink)
                .metadata(metadata)
                .progress(progress)
                .rateLimiter(limiter)
                .retry(new ExponentialBackoffRetryPolicy(config.maxAttemptsPerItem(), config.retryBaseMillis(), config.retryMaxMillis()))
                .diagnostics(diagnostics)
                .metrics(registry)
                .clock(clock)
                .sleeper(sleeper)
                .fetchTimeout(config.fetchTimeout())
                .build();
        return new PassRunner(universe, scorer, progress, executor, clock);
    }
}
