package io.tickersched.strategy;

import io.tickersched.core.WorkItem;
import io.tickersched.runtime.PassRunnerFactory;
import io.tickersched.support.TestHarness;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CrossIntervalStrategyTest {
    @Test
    void roundRobinsOneBatchPerIntervalUpToBudget() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig().intervals(List.of("1m", "1d")).maxBatchesPerRun(2),
                List.of("A", "B", "C", "D", "E"));
        PassRunnerFactory runners = h.runners();

        RunSummary first = new CrossIntervalStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertEquals(RunState.DONE, first.state());
        assertEquals(4, first.totalBatches());
        assertFalse(first.allCompleted());
        assertEquals(List.of(
                new WorkItem("A", "1m"), new WorkItem("B", "1m"),
                new WorkItem("A", "1d"), new WorkItem("B", "1d"),
                new WorkItem("C", "1m"), new WorkItem("D", "1m"),
                new WorkItem("C", "1d"), new WorkItem("D", "1d")), h.fetcher.calls());
        assertEquals(Set.of("cross-1m", "cross-1d"), h.progress.activePassIds());

        RunSummary second = new CrossIntervalStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertTrue(second.allCompleted());
        assertEquals(1, second.interval("1m").batches());
        assertEquals(List.of("A", "B", "C", "D", "E"), h.fetcher.entitiesCalled("1d"));
        assertTrue(h.progress.activePassIds().isEmpty());
    }

    @Test
    void drainedIntervalsDropOut() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig().intervals(List.of("1m", "1d")).maxBatchesPerRun(10), List.of("A", "B", "C"));
        h.universe.override("1m", List.of("A"));
        PassRunnerFactory runners = h.runners();

        RunSummary s = new CrossIntervalStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertTrue(s.allCompleted());
        assertEquals(1, s.interval("1m").batches());
        assertEquals(2, s.interval("1d").batches());
    }

    @Test
    void emptyIntervalCompletesImmediately() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig().intervals(List.of("1m", "1d")), List.of("A"));
        h.universe.override("1m", List.of());
        PassRunnerFactory runners = h.runners();

        RunSummary s = new CrossIntervalStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertTrue(s.interval("1m").completed());
        assertEquals(0, s.interval("1m").batches());
        assertTrue(h.progress.activePassIds().isEmpty());
    }
}
