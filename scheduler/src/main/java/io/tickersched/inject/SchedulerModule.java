package io.tickersched.inject;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.TickerUniverse;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.TimeSeriesSink;
import io.tickersched.error.FetchDiagnostics;
import io.tickersched.error.FileFetchDiagnostics;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.metadata.EntityMetadataStore;
import io.tickersched.metadata.JsonFileEntityMetadataStore;
import io.tickersched.priority.PriorityScorer;
import io.tickersched.progress.JsonFileProgressStateStore;
import io.tickersched.progress.ProgressStateStore;
import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.runtime.PassRunnerFactory;
import io.tickersched.runtime.Sleeper;

import java.io.IOException;
import java.time.Clock;

/**
 * Wires the scheduler engine over the file-backed stores under {@link SchedulerConfig#stateDir()}.
 * The fetcher, sink and universe come from a companion module.
 */
public class SchedulerModule extends AbstractModule {
    private final SchedulerConfig config;

    public SchedulerModule(SchedulerConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(SchedulerConfig.class).toInstance(config);
    }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton Sleeper sleeper() { return Sleeper.SYSTEM; }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton EntityMetadataStore metadataStore() throws PersistenceFailure {
        return new JsonFileEntityMetadataStore(config.metadataFile(), config.maxConsecutiveErrors(),
                config.errorCooldown(), config.metadataWriteThrough());
    }

    @Provides @Singleton ProgressStateStore progressStore(Clock clock) throws PersistenceFailure {
        return new JsonFileProgressStateStore(config.progressDir(), clock);
    }

    @Provides @Singleton FetchDiagnostics diagnostics(Clock clock) throws IOException {
        return new FileFetchDiagnostics(config.diagnosticsFile(), clock);
    }

    @Provides @Singleton PriorityScorer priorityScorer(EntityMetadataStore metadata) {
        return new PriorityScorer(metadata);
    }

    @Provides @Singleton PassRunnerFactory passRunnerFactory(TickerUniverse universe,
                                                            TimeSeriesFetcher fetcher,
                                                            TimeSeriesSink sink,
                                                            EntityMetadataStore metadata,
                                                            ProgressStateStore progress,
                                                            PriorityScorer scorer,
                                                            FetchDiagnostics diagnostics,
                                                            MetricRegistry registry,
                                                            Clock clock,
                                                            Sleeper sleeper) {
        return new PassRunnerFactory(config, universe, fetcher, sink, metadata, progress, scorer, diagnostics,
                registry, clock, sleeper);
    }

    @Provides @Singleton RateLimiter rateLimiter(PassRunnerFactory runners) {
        return runners.newRateLimiter();
    }
}
