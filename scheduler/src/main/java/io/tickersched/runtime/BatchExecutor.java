package io.tickersched.runtime;

import com.codahale.metrics.Timer;
import io.tickersched.core.EntityState;
import io.tickersched.core.TimeSeries;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.TimeSeriesSink;
import io.tickersched.core.WorkItem;
import io.tickersched.error.FetchDiagnostics;
import io.tickersched.error.FetchError;
import io.tickersched.error.FetchFailure;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.metadata.EntityMetadataStore;
import io.tickersched.metrics.SchedulerMetrics;
import io.tickersched.progress.ProgressCursor;
import io.tickersched.progress.ProgressStateStore;
import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one batch of a pass: paces each fetch by the rate limiter, bounds it by the fetch timeout, records the
 * outcome in the metadata store and advances the persisted cursor. Item failures never abort the batch;
 * {@link PersistenceFailure} does.
 *
 * <p>Not thread-safe. The parallel strategy gives each worker its own executor.</p>
 */
public class BatchExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final TimeSeriesFetcher fetcher;
    private final TimeSeriesSink sink;
    private final EntityMetadataStore metadata;
    private final ProgressStateStore progress;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final FetchDiagnostics diagnostics;
    private final SchedulerMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration fetchTimeout;
    private final ExecutorService fetchPool;
    private final Timer fetchTimer;

    // last attempt per interval class
    private final Map<String, Instant> lastAttempt = new HashMap<>();

    BatchExecutor(TimeSeriesFetcher fetcher,
                  TimeSeriesSink sink,
                  EntityMetadataStore metadata,
                  ProgressStateStore progress,
                  RateLimiter rateLimiter,
                  RetryPolicy retryPolicy,
                  FetchDiagnostics diagnostics,
                  SchedulerMetrics metrics,
                  Clock clock,
                  Sleeper sleeper,
                  Duration fetchTimeout) {
        this.fetcher = Objects.requireNonNull(fetcher);
        this.sink = Objects.requireNonNull(sink);
        this.metadata = Objects.requireNonNull(metadata);
        this.progress = Objects.requireNonNull(progress);
        this.rateLimiter = Objects.requireNonNull(rateLimiter);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.diagnostics = Objects.requireNonNull(diagnostics);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout);
        int poolId = POOL_SEQ.incrementAndGet();
        this.fetchPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "scheduler-fetch-" + poolId);
            t.setDaemon(true);
            return t;
        });
        this.fetchTimer = metrics.timer(SchedulerMetrics.FETCH_TIME);
    }

    public BatchResult runBatch(ProgressCursor cursor, int batchSize) throws PersistenceFailure {
        List<WorkItem> batch = cursor.nextBatch(batchSize);
        int ok = 0, retryable = 0, permanent = 0, cooldowns = 0;
        boolean interrupted = false;
        ProgressCursor current = cursor;
        try {
            for (WorkItem item : batch) {
                if (Thread.currentThread().isInterrupted()) {
                    interrupted = true;
                    break;
                }
                Outcome outcome;
                try {
                    outcome = fetchWithRetry(item);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    break;
                }
                Instant now = clock.instant();
                if (outcome.series != null) {
                    try {
                        sink.accept(item, outcome.series);
                    } catch (IOException e) {
                        throw new PersistenceFailure("sink rejected " + item, e);
                    }
                    metadata.recordSuccess(item.entity(), item.interval(), now);
                    metrics.counter(SchedulerMetrics.FETCH_SUCCESS).inc();
                    metrics.intervalSuccess(item.interval()).inc();
                    log.debug("Fetched {} ({} bars)", item, outcome.series.size());
                    ok++;
                } else {
                    FetchFailure failure = outcome.failure;
                    boolean wasCooling = metadata.get(item.entity(), item.interval())
                            .map(s -> s.inCooldown(now)).orElse(false);
                    EntityState after = metadata.recordFailure(item.entity(), item.interval(), now);
                    metrics.intervalFailure(item.interval()).inc();
                    if (failure.isRetryable()) {
                        metrics.counter(SchedulerMetrics.FETCH_FAILURE_RETRYABLE).inc();
                        log.debug("Retryable failure for {}: {} {}", item, failure.error(), failure.getMessage());
                        retryable++;
                    } else {
                        metrics.counter(SchedulerMetrics.FETCH_FAILURE_PERMANENT).inc();
                        log.warn("Permanent failure for {}: {} {}", item, failure.error(), failure.getMessage());
                        diagnostics.report(item, failure);
                        permanent++;
                    }
                    if (!wasCooling && after.inCooldown(now)) {
                        metrics.counter(SchedulerMetrics.COOLDOWN_ENTERED).inc();
                        log.warn("{} entered cooldown until {} after {} consecutive errors",
                                item, after.inCooldownUntil(), after.consecutiveErrors());
                        cooldowns++;
                    }
                }
                metrics.meter(SchedulerMetrics.ITEMS_RATE).mark();
                current = progress.markAttempted(current, item);
            }
        } finally {
            metadata.flush();
        }
        return new BatchResult(ok, retryable, permanent, cooldowns, current, interrupted);
    }

    /**
     * Attempts the item until it succeeds or the retry policy gives up. Every attempt is paced and fed to the
     * rate limiter, except permanent failures, which say nothing about throttling.
     */
    private Outcome fetchWithRetry(WorkItem item) throws InterruptedException {
        Instant since = metadata.get(item.entity(), item.interval()).map(EntityState::lastSuccessAt).orElse(null);
        int attempt = 0;
        while (true) {
            attempt++;
            awaitSlot(item.interval());
            try {
                TimeSeries series = fetchOnce(item, since);
                rateLimiter.recordOutcome(item.interval(), true);
                return new Outcome(series, null);
            } catch (FetchFailure f) {
                if (f.isRetryable()) rateLimiter.recordOutcome(item.interval(), false);
                if (!retryPolicy.shouldRetry(attempt, f)) return new Outcome(null, f);
                long backoff = retryPolicy.backoffMillis(attempt);
                log.debug("Retrying {} in {}ms after attempt {} ({})", item, backoff, attempt, f.error());
                sleeper.sleep(Duration.ofMillis(backoff));
            }
        }
    }

    private void awaitSlot(String interval) throws InterruptedException {
        Instant last = lastAttempt.get(interval);
        if (last != null) {
            Instant due = last.plus(rateLimiter.delayFor(interval));
            Duration wait = Duration.between(clock.instant(), due);
            if (!wait.isNegative() && !wait.isZero()) {
                metrics.histogram(SchedulerMetrics.RATELIMIT_WAIT).update(wait.toMillis());
                sleeper.sleep(wait);
            }
        }
        lastAttempt.put(interval, clock.instant());
    }

    private TimeSeries fetchOnce(WorkItem item, Instant since) throws FetchFailure, InterruptedException {
        Future<TimeSeries> future = fetchPool.submit(() -> fetcher.fetch(item.entity(), item.interval(), since));
        try (Timer.Context ignored = fetchTimer.time()) {
            TimeSeries series = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return series != null ? series : TimeSeries.empty(item.entity(), item.interval());
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.counter(SchedulerMetrics.FETCH_TIMEOUT).inc();
            log.warn("Fetch of {} timed out after {}ms", item, fetchTimeout.toMillis());
            throw FetchFailure.of(FetchError.TRANSIENT, "timed out after " + fetchTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchFailure f) throw f;
            throw FetchFailure.of(FetchError.TRANSIENT, String.valueOf(cause), cause);
        }
    }

    @Override
    public void close() {
        fetchPool.shutdownNow();
    }

    private record Outcome(TimeSeries series, FetchFailure failure) {}
}
