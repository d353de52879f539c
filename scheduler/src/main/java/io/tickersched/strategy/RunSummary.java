package io.tickersched.strategy;

import io.tickersched.runtime.IntervalStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RunSummary(String strategy, RunState state, Map<String, IntervalStats> intervals) {
    public RunSummary {
        intervals = Collections.unmodifiableMap(new LinkedHashMap<>(intervals));
    }

    public int totalBatches() {
        return intervals.values().stream().mapToInt(IntervalStats::batches).sum();
    }

    public int totalAttempted() {
        return intervals.values().stream().mapToInt(IntervalStats::attempted).sum();
    }

    public int totalSuccesses() {
        return intervals.values().stream().mapToInt(IntervalStats::successes).sum();
    }

    public boolean allCompleted() {
        return intervals.values().stream().allMatch(IntervalStats::completed);
    }

    public IntervalStats interval(String interval) {
        return intervals.getOrDefault(interval, IntervalStats.EMPTY);
    }
}
