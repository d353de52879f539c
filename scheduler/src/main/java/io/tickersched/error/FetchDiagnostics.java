package io.tickersched.error;

import io.tickersched.core.WorkItem;

/**
 * Operator-facing record of permanent fetch failures (unknown tickers, unparsable responses).
 */
public interface FetchDiagnostics extends AutoCloseable {
    FetchDiagnostics NONE = (item, failure) -> {};

    void report(WorkItem item, FetchFailure failure);

    @Override default void close() {}
}
