package io.tickersched.strategy;

import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.StaticTickerUniverse;
import io.tickersched.runtime.PassRunnerFactory;
import io.tickersched.support.TestHarness;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QuotaStrategyTest {
    private static SchedulerConfig config(int maxBatches, Map<String, Integer> counts) {
        return SchedulerConfig.builder().intervals(List.of("1m", "1d")).maxBatchesPerRun(maxBatches).entityCounts(counts).build();
    }

    @Test
    void quotasProportionalWithFloorOfOne() {
        var universe = new StaticTickerUniverse(List.of());
        assertEquals(Map.of("1m", 7, "1d", 2), QuotaStrategy.quotas(config(10, Map.of("1m", 300, "1d", 100)), universe));
        assertEquals(Map.of("1m", 9, "1d", 1), QuotaStrategy.quotas(config(10, Map.of("1m", 1000, "1d", 1)), universe));
        assertEquals(Map.of("1m", 1, "1d", 1), QuotaStrategy.quotas(config(10, Map.of()), universe));
    }

    @Test
    void universeSizeUsedWhenCountMissing() {
        var universe = new StaticTickerUniverse(List.of("A", "B", "C")).override("1m", List.of("A"));
        assertEquals(Map.of("1m", 2, "1d", 7), QuotaStrategy.quotas(config(10, Map.of()), universe));
    }

    @Test
    void stopsEachIntervalAtItsQuota() throws Exception {
        TestHarness h = new TestHarness(TestHarness.smallConfig()
                .intervals(List.of("1m", "1d")).batchSize(1).maxBatchesPerRun(4).entityCounts(Map.of("1m", 3, "1d", 1)),
                List.of("A", "B", "C", "D", "E", "F"));
        PassRunnerFactory runners = h.runners();

        RunSummary s = new QuotaStrategy(h.config, runners.create(runners.newRateLimiter())).run();

        assertEquals(RunState.DONE, s.state());
        assertEquals(3, s.interval("1m").batches());
        assertEquals(1, s.interval("1d").batches());
        assertEquals(List.of("A", "B", "C"), h.fetcher.entitiesCalled("1m"));
        assertEquals(List.of("A"), h.fetcher.entitiesCalled("1d"));
        assertEquals(Set.of("quota-1m", "quota-1d"), h.progress.activePassIds());
    }
}
