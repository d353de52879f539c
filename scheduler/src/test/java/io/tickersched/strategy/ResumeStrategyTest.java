package io.tickersched.strategy;

import io.tickersched.core.TimeSeriesSink;
import io.tickersched.core.WorkItem;
import io.tickersched.progress.ProgressCursor;
import io.tickersched.runtime.PassRunnerFactory;
import io.tickersched.support.TestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResumeStrategyTest {
    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void drainsIntervalsInOrder() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig().intervals(List.of("1h", "1d")), List.of("A", "B", "C"));
        PassRunnerFactory runners = h.runners();

        RunSummary summary;
        try (ResumeStrategy s = new ResumeStrategy(h.config, runners.create(runners.newRateLimiter()))) {
            assertEquals(RunState.STARTING, s.state());
            summary = s.run();
            assertEquals(RunState.DONE, s.state());
        }

        assertEquals(RunState.DONE, summary.state());
        assertTrue(summary.allCompleted());
        assertEquals(2, summary.interval("1h").batches());
        assertEquals(6, summary.totalSuccesses());
        assertEquals(List.of("A", "B", "C"), h.fetcher.entitiesCalled("1h"));
        assertEquals(new WorkItem("C", "1h"), h.fetcher.calls().get(2));
        assertEquals(new WorkItem("A", "1d"), h.fetcher.calls().get(3));
        assertTrue(h.progress.activePassIds().isEmpty());
    }

    @Test
    void resumesStoredCursorWithoutRefetchingAttemptedItems() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig().intervals(List.of("1h", "1d")), List.of("A", "B", "C"));
        // state left behind by a run that died after A in the 1d pass
        ProgressCursor c = h.progress.startPass("resume-1d", "1d",
                List.of(new WorkItem("A", "1d"), new WorkItem("B", "1d"), new WorkItem("C", "1d")));
        h.progress.markAttempted(c, new WorkItem("A", "1d"));
        PassRunnerFactory runners = h.runners();

        RunSummary summary = new ResumeStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertEquals(RunState.DONE, summary.state());
        assertEquals(List.of("B", "C"), h.fetcher.entitiesCalled("1d"));
        assertTrue(h.fetcher.entitiesCalled("1h").isEmpty());
        assertFalse(summary.intervals().containsKey("1h"));
    }

    @Test
    void interruptedRunLeavesCursorAndNextRunFinishesIt() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig(), List.of("A", "B", "C"));
        AtomicInteger accepted = new AtomicInteger();
        TimeSeriesSink interrupting = (item, series) -> {
            if (accepted.incrementAndGet() == 1) Thread.currentThread().interrupt();
        };
        PassRunnerFactory runners = h.runners(interrupting);

        RunSummary first = new ResumeStrategy(h.config, runners.create(runners.newRateLimiter())).run();
        assertTrue(Thread.interrupted());

        assertEquals(RunState.INTERRUPTED, first.state());
        assertEquals(Set.of("resume-1d"), h.progress.activePassIds());
        ProgressCursor left = h.progress.resumePass("resume-1d").orElseThrow();
        assertEquals(List.of(new WorkItem("A", "1d")), left.attempted());

        RunSummary second = new ResumeStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertEquals(RunState.DONE, second.state());
        assertEquals(List.of("A", "B", "C"), h.fetcher.entitiesCalled("1d"));
        assertTrue(h.progress.activePassIds().isEmpty());
    }

    @Test
    void startsAtFirstIntervalWithCursor() {
        List<String> intervals = List.of("1m", "5m", "1d");
        assertEquals(0, ResumeStrategy.startIndex(intervals, Set.of()));
        assertEquals(1, ResumeStrategy.startIndex(intervals, Set.of("resume-5m", "resume-1d", "cross-1m")));
    }

    @Test
    void cooldownEntitiesLeftOutOfNewPass() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig().maxConsecutiveErrors(1), List.of("A", "B"));
        h.metadata.recordFailure("A", "1d", h.clock.instant());
        PassRunnerFactory runners = h.runners();

        new ResumeStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertEquals(List.of("B"), h.fetcher.entitiesCalled("1d"));
    }
}
