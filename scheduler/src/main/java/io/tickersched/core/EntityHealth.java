package io.tickersched.core;

/**
 * Derived health of an entity for one interval.
 * HEALTHY -> DEGRADED on a failure, DEGRADED -> COOLDOWN at the error threshold,
 * any state -> HEALTHY on a success.
 */
public enum EntityHealth {
    HEALTHY,
    DEGRADED,
    COOLDOWN
}
