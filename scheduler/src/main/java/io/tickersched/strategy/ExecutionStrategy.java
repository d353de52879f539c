package io.tickersched.strategy;

import io.tickersched.error.PersistenceFailure;

/**
 * A policy for walking the configured intervals with the shared pass primitive.
 */
public interface ExecutionStrategy extends AutoCloseable {
    String name();

    RunState state();

    /**
     * Runs until the strategy's work for this invocation is done or the thread is interrupted.
     *
     * @throws PersistenceFailure when scheduler state cannot be persisted; the run stops and the cursors on
     *                            disk stay valid for a later resume
     */
    RunSummary run() throws PersistenceFailure;

    @Override
    default void close() {}
}
