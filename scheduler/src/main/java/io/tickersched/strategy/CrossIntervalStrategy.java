package io.tickersched.strategy;

import io.tickersched.config.SchedulerConfig;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.progress.ProgressCursor;
import io.tickersched.runtime.BatchResult;
import io.tickersched.runtime.IntervalStats;
import io.tickersched.runtime.PassRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Round-robins one batch per interval per round, for at most {@code maxBatchesPerRun} rounds, so no interval
 * starves while another is large. Unfinished passes stay on disk for the next run.
 */
public class CrossIntervalStrategy implements ExecutionStrategy {
    public static final String NAME = "cross";
    private static final Logger log = LoggerFactory.getLogger(CrossIntervalStrategy.class);

    private final SchedulerConfig config;
    private final PassRunner runner;
    private volatile RunState state = RunState.STARTING;

    public CrossIntervalStrategy(SchedulerConfig config, PassRunner runner) {
        this.config = config;
        this.runner = runner;
    }

    @Override public String name() { return NAME; }

    @Override public RunState state() { return state; }

    @Override
    public RunSummary run() throws PersistenceFailure {
        state = RunState.STARTING;
        Map<String, IntervalStats> stats = new LinkedHashMap<>();
        Map<String, ProgressCursor> open = new LinkedHashMap<>();
        for (String interval : config.intervals()) {
            ProgressCursor c = runner.open(NAME, interval);
            if (runner.completeIfDrained(c)) {
                stats.put(interval, IntervalStats.EMPTY.markCompleted());
            } else {
                stats.put(interval, IntervalStats.EMPTY);
                open.put(interval, c);
            }
        }
        state = RunState.RUNNING;
        int rounds = 0;
        outer:
        while (!open.isEmpty() && rounds < config.maxBatchesPerRun()) {
            rounds++;
            for (String interval : new ArrayList<>(open.keySet())) {
                BatchResult r = runner.runBatch(open.get(interval), config.batchSizeFor(interval));
                IntervalStats s = stats.get(interval).plus(r);
                if (r.interrupted()) {
                    stats.put(interval, s);
                    open.put(interval, r.cursor());
                    state = RunState.INTERRUPTED;
                    break outer;
                }
                if (runner.completeIfDrained(r.cursor())) {
                    s = s.markCompleted();
                    open.remove(interval);
                } else {
                    open.put(interval, r.cursor());
                }
                stats.put(interval, s);
            }
        }
        if (state == RunState.RUNNING) state = RunState.DONE;
        log.info("Cross-interval run finished {} after {} rounds; {} passes left open", state, rounds, open.size());
        return new RunSummary(NAME, state, stats);
    }

    @Override
    public void close() {
        runner.close();
    }
}
