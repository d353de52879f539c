package io.tickersched.progress;

import io.tickersched.core.WorkItem;
import io.tickersched.error.ActivePassException;
import io.tickersched.error.PersistenceFailure;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable cursors, one per pass id. Every advance is persisted before it is returned to the caller, which is
 * what makes resumption exact.
 */
public interface ProgressStateStore {
    /**
     * @throws ActivePassException if an incomplete cursor for {@code passId} exists
     */
    ProgressCursor startPass(String passId, String interval, List<WorkItem> items) throws PersistenceFailure;

    /** The persisted cursor for {@code passId}, exactly as last written. */
    Optional<ProgressCursor> resumePass(String passId) throws PersistenceFailure;

    ProgressCursor markAttempted(ProgressCursor cursor, WorkItem item) throws PersistenceFailure;

    /** Archives the cursor. Only valid once pending is empty. */
    void completePass(ProgressCursor cursor) throws PersistenceFailure;

    Set<String> activePassIds() throws PersistenceFailure;
}
