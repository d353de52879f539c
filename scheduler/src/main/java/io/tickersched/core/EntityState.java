package io.tickersched.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Per entity, per interval fetch bookkeeping. Instances are immutable; the transition methods return
 * the next state and are only called by the metadata store.
 */
public record EntityState(
        Instant lastSuccessAt,
        int consecutiveErrors,
        Instant lastErrorAt,
        Instant inCooldownUntil
) {
    public static final EntityState INITIAL = new EntityState(null, 0, null, null);

    public EntityState {
        if (consecutiveErrors < 0) throw new IllegalArgumentException("consecutiveErrors must be >= 0");
    }

    public EntityState afterSuccess(Instant at) {
        return new EntityState(at, 0, lastErrorAt, null);
    }

    /**
     * Counts one more consecutive failure. The cooldown is (re)armed whenever the new count is at or above
     * {@code maxConsecutiveErrors}; below it an expired cooldown is dropped.
     */
    public EntityState afterFailure(Instant at, int maxConsecutiveErrors, Duration cooldown) {
        int errors = consecutiveErrors + 1;
        Instant until;
        if (errors >= maxConsecutiveErrors) {
            until = at.plus(cooldown);
        } else if (inCooldownUntil != null && inCooldownUntil.isAfter(at)) {
            until = inCooldownUntil;
        } else {
            until = null;
        }
        return new EntityState(lastSuccessAt, errors, at, until);
    }

    public EntityState withoutCooldown() {
        return new EntityState(lastSuccessAt, consecutiveErrors, lastErrorAt, null);
    }

    /** True while {@code inCooldownUntil} is strictly after {@code now}. */
    public boolean inCooldown(Instant now) {
        return inCooldownUntil != null && inCooldownUntil.isAfter(now);
    }

    public EntityHealth health(Instant now) {
        if (inCooldown(now)) return EntityHealth.COOLDOWN;
        return consecutiveErrors == 0 ? EntityHealth.HEALTHY : EntityHealth.DEGRADED;
    }
}
