package io.tickersched.strategy;

/**
 * Lifecycle of one strategy run. Only held in memory; resumption works from the persisted cursors.
 */
public enum RunState {
    STARTING,
    RUNNING,
    INTERRUPTED,
    DONE
}
