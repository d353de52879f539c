package io.tickersched.strategy;

import io.tickersched.config.SchedulerConfig;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.runtime.IntervalStats;
import io.tickersched.runtime.PassRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks the intervals in order, draining each pass before moving to the next. After an interruption the run
 * picks up at the first interval that still has a cursor on disk.
 */
public class ResumeStrategy implements ExecutionStrategy {
    public static final String NAME = "resume";
    private static final Logger log = LoggerFactory.getLogger(ResumeStrategy.class);

    private final SchedulerConfig config;
    private final PassRunner runner;
    private volatile RunState state = RunState.STARTING;

    public ResumeStrategy(SchedulerConfig config, PassRunner runner) {
        this.config = config;
        this.runner = runner;
    }

    @Override public String name() { return NAME; }

    @Override public RunState state() { return state; }

    @Override
    public RunSummary run() throws PersistenceFailure {
        state = RunState.STARTING;
        List<String> intervals = config.intervals();
        int start = startIndex(intervals, runner.activePassIds());
        if (start > 0) log.info("Resuming at interval {}", intervals.get(start));
        state = RunState.RUNNING;
        Map<String, IntervalStats> stats = new LinkedHashMap<>();
        for (int i = start; i < intervals.size(); i++) {
            String interval = intervals.get(i);
            if (Thread.currentThread().isInterrupted()) {
                state = RunState.INTERRUPTED;
                break;
            }
            IntervalStats s = runner.drain(NAME, interval, config.batchSizeFor(interval), 0);
            stats.put(interval, s);
            if (s.interrupted()) {
                state = RunState.INTERRUPTED;
                break;
            }
        }
        if (state == RunState.RUNNING) state = RunState.DONE;
        RunSummary summary = new RunSummary(NAME, state, stats);
        log.info("Resume run finished {}: {} batches, {} items", state, summary.totalBatches(), summary.totalAttempted());
        return summary;
    }

    static int startIndex(List<String> intervals, Set<String> activePassIds) {
        for (int i = 0; i < intervals.size(); i++) {
            if (activePassIds.contains(PassRunner.passId(NAME, intervals.get(i)))) return i;
        }
        return 0;
    }

    @Override
    public void close() {
        runner.close();
    }
}
