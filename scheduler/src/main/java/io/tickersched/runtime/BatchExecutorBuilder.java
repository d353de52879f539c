package io.tickersched.runtime;

import com.codahale.metrics.MetricRegistry;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.TimeSeriesSink;
import io.tickersched.error.FetchDiagnostics;
import io.tickersched.metadata.EntityMetadataStore;
import io.tickersched.metrics.SchedulerMetrics;
import io.tickersched.progress.ProgressStateStore;
import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.retry.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class BatchExecutorBuilder {
    private TimeSeriesFetcher fetcher;
    private TimeSeriesSink sink = TimeSeriesSink.NO_OP;
    private EntityMetadataStore metadata;
    private ProgressStateStore progress;
    private RateLimiter rateLimiter;
    private RetryPolicy retryPolicy = RetryPolicy.NEVER;
    private FetchDiagnostics diagnostics = FetchDiagnostics.NONE;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.SYSTEM;
    private Duration fetchTimeout = Duration.ofSeconds(30);

    public BatchExecutorBuilder fetcher(TimeSeriesFetcher f) { this.fetcher = f; return this; }
    public BatchExecutorBuilder sink(TimeSeriesSink s) { this.sink = s; return this; }
    public BatchExecutorBuilder metadata(EntityMetadataStore m) { this.metadata = m; return this; }
    public BatchExecutorBuilder progress(ProgressStateStore p) { this.progress = p; return this; }
    public BatchExecutorBuilder rateLimiter(RateLimiter r) { this.rateLimiter = r; return this; }
    public BatchExecutorBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public BatchExecutorBuilder diagnostics(FetchDiagnostics d) { this.diagnostics = d; return this; }
    public BatchExecutorBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public BatchExecutorBuilder clock(Clock c) { this.clock = c; return this; }
    public BatchExecutorBuilder sleeper(Sleeper s) { this.sleeper = s; return this; }
    public BatchExecutorBuilder fetchTimeout(Duration d) { this.fetchTimeout = d; return this; }

    public BatchExecutor build() {
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(progress, "progress");
        Objects.requireNonNull(rateLimiter, "rateLimiter");
        return new BatchExecutor(fetcher, sink, metadata, progress, rateLimiter, retryPolicy, diagnostics,
                new SchedulerMetrics(metricRegistry), clock, sleeper, fetchTimeout);
    }
}
