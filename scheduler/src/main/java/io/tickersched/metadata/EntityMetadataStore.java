package io.tickersched.metadata;

import io.tickersched.core.EntityState;
import io.tickersched.error.PersistenceFailure;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persisted mapping of (entity, interval) to {@link EntityState}. The only way to mutate entity state.
 */
public interface EntityMetadataStore {
    /** Sets lastSuccessAt, resets the error count and clears any cooldown. */
    EntityState recordSuccess(String entity, String interval, Instant at) throws PersistenceFailure;

    /** Increments the error count; arms the cooldown once the configured threshold is reached. */
    EntityState recordFailure(String entity, String interval, Instant at) throws PersistenceFailure;

    /** Operator override. Returns true if a cooldown was actually cleared. */
    boolean clearCooldown(String entity, String interval) throws PersistenceFailure;

    Optional<EntityState> get(String entity, String interval);

    /** Immutable copy of all entity states for one interval. */
    Map<String, EntityState> snapshot(String interval);

    Set<String> intervals();

    /** Durably writes the full mapping. */
    void flush() throws PersistenceFailure;
}
