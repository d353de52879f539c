package io.tickersched.runtime;

import io.tickersched.core.TickerUniverse;
import io.tickersched.core.WorkItem;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.priority.PriorityScorer;
import io.tickersched.progress.ProgressCursor;
import io.tickersched.progress.ProgressStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pass lifecycle shared by every execution strategy: open (resume the persisted cursor or score a new pass),
 * run batches, archive the cursor once drained.
 */
public class PassRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PassRunner.class);

    private final TickerUniverse universe;
    private final PriorityScorer scorer;
    private final ProgressStateStore progress;
    private final BatchExecutor executor;
    private final Clock clock;

    public PassRunner(TickerUniverse universe, PriorityScorer scorer, ProgressStateStore progress,
                      BatchExecutor executor, Clock clock) {
        this.universe = universe;
        this.scorer = scorer;
        this.progress = progress;
        this.executor = executor;
        this.clock = clock;
    }

    public static String passId(String strategy, String interval) {
        return strategy + "-" + interval;
    }

    public TickerUniverse universe() { return universe; }

    public Set<String> activePassIds() throws PersistenceFailure {
        return progress.activePassIds();
    }

    public ProgressCursor open(String strategy, String interval) throws PersistenceFailure {
        String passId = passId(strategy, interval);
        Optional<ProgressCursor> existing = progress.resumePass(passId);
        if (existing.isPresent()) return existing.get();
        List<WorkItem> items = scorer.score(universe.entities(interval), interval, clock.instant());
        return progress.startPass(passId, interval, items);
    }

    public BatchResult runBatch(ProgressCursor cursor, int batchSize) throws PersistenceFailure {
        return executor.runBatch(cursor, batchSize);
    }

    public boolean completeIfDrained(ProgressCursor cursor) throws PersistenceFailure {
        if (!cursor.isDrained()) return false;
        progress.completePass(cursor);
        return true;
    }

    /**
     * Runs batches of one interval's pass until it drains, {@code maxBatches} is used up, or the thread is
     * interrupted. A non-positive {@code maxBatches} means no limit.
     */
    public IntervalStats drain(String strategy, String interval, int batchSize, int maxBatches) throws PersistenceFailure {
        ProgressCursor cursor = open(strategy, interval);
        IntervalStats stats = IntervalStats.EMPTY;
        while (!cursor.isDrained() && (maxBatches <= 0 || stats.batches() < maxBatches)) {
            BatchResult r = runBatch(cursor, batchSize);
            stats = stats.plus(r);
            cursor = r.cursor();
            if (r.interrupted()) {
                log.info("Pass {} interrupted with {} items pending", cursor.passId(), cursor.pending().size());
                return stats;
            }
        }
        return completeIfDrained(cursor) ? stats.markCompleted() : stats;
    }

    @Override
    public void close() {
        executor.close();
    }
}
