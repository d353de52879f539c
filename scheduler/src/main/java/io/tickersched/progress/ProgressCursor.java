package io.tickersched.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.tickersched.core.WorkItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Position within one pass: items still pending (in priority order) and items already attempted.
 * Immutable; {@link ProgressStateStore#markAttempted} hands back the advanced cursor.
 */
public record ProgressCursor(String passId, String interval, Instant startedAt,
                             List<WorkItem> pending, List<WorkItem> attempted) {
    public ProgressCursor {
        Objects.requireNonNull(passId, "passId");
        pending = List.copyOf(pending);
        attempted = List.copyOf(attempted);
        Set<WorkItem> seen = new LinkedHashSet<>(attempted);
        if (seen.size() != attempted.size()) throw new IllegalArgumentException("duplicate attempted items in " + passId);
        for (WorkItem w : pending) {
            if (!seen.add(w)) throw new IllegalArgumentException("item " + w + " appears twice in " + passId);
        }
    }

    public static ProgressCursor start(String passId, String interval, Instant startedAt, List<WorkItem> items) {
        return new ProgressCursor(passId, interval, startedAt, items, List.of());
    }

    @JsonIgnore
    public boolean isDrained() { return pending.isEmpty(); }

    public int total() { return pending.size() + attempted.size(); }

    /** Up to {@code n} items from the head of the pending list. */
    public List<WorkItem> nextBatch(int n) {
        return pending.subList(0, Math.min(Math.max(0, n), pending.size()));
    }

    ProgressCursor withAttempted(WorkItem item) {
        int idx = pending.indexOf(item);
        if (idx < 0) throw new IllegalArgumentException(item + " is not pending in " + passId);
        List<WorkItem> nextPending = new ArrayList<>(pending);
        nextPending.remove(idx);
        List<WorkItem> nextAttempted = new ArrayList<>(attempted.size() + 1);
        nextAttempted.addAll(attempted);
        nextAttempted.add(item);
        return new ProgressCursor(passId, interval, startedAt, nextPending, nextAttempted);
    }

    /** Moves every item of {@code items} that is still pending to attempted, in the given order. */
    ProgressCursor withAllAttempted(List<WorkItem> items) {
        if (items.isEmpty()) return this;
        Set<WorkItem> moved = new LinkedHashSet<>(items);
        moved.retainAll(new HashSet<>(pending));
        if (moved.isEmpty()) return this;
        List<WorkItem> nextPending = new ArrayList<>(pending.size());
        for (WorkItem w : pending) {
            if (!moved.contains(w)) nextPending.add(w);
        }
        List<WorkItem> nextAttempted = new ArrayList<>(attempted.size() + moved.size());
        nextAttempted.addAll(attempted);
        nextAttempted.addAll(moved);
        return new ProgressCursor(passId, interval, startedAt, nextPending, nextAttempted);
    }
}
