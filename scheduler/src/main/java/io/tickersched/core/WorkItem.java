package io.tickersched.core;

import java.util.Objects;

/**
 * One (entity, interval) pair eligible for a fetch attempt within a pass.
 */
public record WorkItem(String entity, String interval) {
    public WorkItem {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(interval, "interval");
    }

    /** Stable key used by the persisted stores, e.g. {@code AAPL|1d}. */
    public String key() { return entity + "|" + interval; }

    @Override
    public String toString() { return key(); }
}
