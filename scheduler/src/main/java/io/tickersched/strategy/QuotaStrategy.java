package io.tickersched.strategy;

import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.TickerUniverse;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.runtime.IntervalStats;
import io.tickersched.runtime.PassRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits {@code maxBatchesPerRun} across intervals in proportion to their entity counts (at least one batch
 * each), then drains each interval in order up to its quota.
 */
public class QuotaStrategy implements ExecutionStrategy {
    public static final String NAME = "quota";
    private static final Logger log = LoggerFactory.getLogger(QuotaStrategy.class);

    private final SchedulerConfig config;
    private final PassRunner runner;
    private volatile RunState state = RunState.STARTING;

    public QuotaStrategy(SchedulerConfig config, PassRunner runner) {
        this.config = config;
        this.runner = runner;
    }

    @Override public String name() { return NAME; }

    @Override public RunState state() { return state; }

    @Override
    public RunSummary run() throws PersistenceFailure {
        state = RunState.STARTING;
        Map<String, Integer> quotas = quotas(config, runner.universe());
        log.info("Batch quotas: {}", quotas);
        state = RunState.RUNNING;
        Map<String, IntervalStats> stats = new LinkedHashMap<>();
        for (String interval : config.intervals()) {
            if (Thread.currentThread().isInterrupted()) {
                state = RunState.INTERRUPTED;
                break;
            }
            IntervalStats s = runner.drain(NAME, interval, config.batchSizeFor(interval), quotas.get(interval));
            stats.put(interval, s);
            if (s.interrupted()) {
                state = RunState.INTERRUPTED;
                break;
            }
        }
        if (state == RunState.RUNNING) state = RunState.DONE;
        return new RunSummary(NAME, state, stats);
    }

    /**
     * {@code max(1, floor(maxBatchesPerRun * count / total))} per interval, where count is the configured
     * entity count or else the universe size.
     */
    public static Map<String, Integer> quotas(SchedulerConfig config, TickerUniverse universe) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        long total = 0;
        for (String interval : config.intervals()) {
            Integer configured = config.entityCounts().get(interval);
            int count = configured != null ? configured : universe.entities(interval).size();
            counts.put(interval, count);
            total += count;
        }
        Map<String, Integer> quotas = new LinkedHashMap<>();
        for (var e : counts.entrySet()) {
            long share = total == 0 ? 0 : (long) config.maxBatchesPerRun() * e.getValue() / total;
            quotas.put(e.getKey(), (int) Math.max(1, share));
        }
        return quotas;
    }

    @Override
    public void close() {
        runner.close();
    }
}
