package io.tickersched.strategy;

import io.tickersched.config.SchedulerConfig;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.ratelimit.RateLimiterState;
import io.tickersched.runtime.IntervalStats;
import io.tickersched.runtime.PassRunner;
import io.tickersched.runtime.PassRunnerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One worker per interval on a fixed pool. Each worker owns its executor and rate limiter; the metadata and
 * progress stores are shared. Worker limiter states are folded back into the shared limiter when they finish.
 */
public class ParallelStrategy implements ExecutionStrategy {
    public static final String NAME = "parallel";
    private static final Logger log = LoggerFactory.getLogger(ParallelStrategy.class);

    private final SchedulerConfig config;
    private final PassRunnerFactory runners;
    private final RateLimiter shared;
    private volatile RunState state = RunState.STARTING;

    public ParallelStrategy(SchedulerConfig config, PassRunnerFactory runners, RateLimiter shared) {
        this.config = config;
        this.runners = runners;
        this.shared = shared;
    }

    @Override public String name() { return NAME; }

    @Override public RunState state() { return state; }

    @Override
    public RunSummary run() throws PersistenceFailure {
        state = RunState.STARTING;
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.effectiveParallelism(),
                r -> new Thread(r, "scheduler-worker-" + seq.incrementAndGet()));
        Map<String, Future<IntervalStats>> futures = new LinkedHashMap<>();
        state = RunState.RUNNING;
        try {
            for (String interval : config.intervals()) {
                futures.put(interval, pool.submit(() -> work(interval)));
            }
        } finally {
            pool.shutdown();
        }

        Map<String, IntervalStats> stats = new LinkedHashMap<>();
        PersistenceFailure persistence = null;
        RuntimeException unexpected = null;
        boolean interrupted = false;
        for (var e : futures.entrySet()) {
            try {
                IntervalStats s = e.getValue().get();
                stats.put(e.getKey(), s);
                if (s.interrupted()) interrupted = true;
            } catch (InterruptedException ie) {
                interrupted = true;
                pool.shutdownNow();
                awaitQuietly(pool);
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                log.error("Worker for {} failed", e.getKey(), cause);
                if (cause instanceof PersistenceFailure pf) {
                    if (persistence == null) persistence = pf;
                } else if (unexpected == null) {
                    unexpected = cause instanceof RuntimeException re ? re : new IllegalStateException(cause);
                }
            }
        }
        if (persistence != null) throw persistence;
        if (unexpected != null) throw unexpected;
        state = interrupted ? RunState.INTERRUPTED : RunState.DONE;
        RunSummary summary = new RunSummary(NAME, state, stats);
        log.info("Parallel run finished {}: {} batches, {} items", state, summary.totalBatches(), summary.totalAttempted());
        return summary;
    }

    private IntervalStats work(String interval) throws PersistenceFailure {
        RateLimiter limiter = runners.newRateLimiter();
        limiter.restore(Map.of(interval, shared.state(interval)));
        try (PassRunner runner = runners.create(limiter)) {
            return runner.drain(NAME, interval, config.batchSizeFor(interval), 0);
        } finally {
            RateLimiterState last = limiter.state(interval);
            shared.restore(Map.of(interval, last));
        }
    }

    private static void awaitQuietly(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) log.warn("Workers did not stop within 30s");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
