package io.tickersched.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Asymmetric adaptive delay per interval class: a failure multiplies the delay by {@code increaseFactor}
 * (growing by at least {@code increaseStep}), a success multiplies it by {@code decayFactor}.
 * The delay always stays within [minDelay, maxDelay].
 */
public class AdaptiveRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);
    private static final long SNAP_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final long minNanos;
    private final long maxNanos;
    private final double increaseFactor;
    private final long increaseStepNanos;
    private final double decayFactor;
    private final Map<String, Slot> slots = new HashMap<>();

    public AdaptiveRateLimiter(Duration minDelay, Duration maxDelay, double increaseFactor, Duration increaseStep, double decayFactor) {
        if (minDelay.isNegative()) throw new IllegalArgumentException("minDelay must be >= 0");
        if (maxDelay.compareTo(minDelay) < 0) throw new IllegalArgumentException("maxDelay must be >= minDelay");
        if (increaseFactor < 1.0) throw new IllegalArgumentException("increaseFactor must be >= 1");
        if (decayFactor <= 0.0 || decayFactor >= 1.0) throw new IllegalArgumentException("decayFactor must be in (0, 1)");
        if (increaseStep.isNegative() || increaseStep.isZero()) throw new IllegalArgumentException("increaseStep must be > 0");
        this.minNanos = minDelay.toNanos();
        this.maxNanos = maxDelay.toNanos();
        this.increaseFactor = increaseFactor;
        this.increaseStepNanos = increaseStep.toNanos();
        this.decayFactor = decayFactor;
    }

    @Override
    public synchronized Duration delayFor(String interval) {
        return Duration.ofNanos(slot(interval).delayNanos);
    }

    @Override
    public synchronized void recordOutcome(String interval, boolean success) {
        Slot s = slot(interval);
        if (success) {
            s.errorStreak = 0;
            long next = Math.max(minNanos, (long) (s.delayNanos * decayFactor));
            if (next - minNanos < SNAP_NANOS) next = minNanos;
            s.delayNanos = next;
        } else {
            s.errorStreak++;
            long before = s.delayNanos;
            long grown = (long) Math.min((double) maxNanos, Math.max(before * increaseFactor, (double) before + increaseStepNanos));
            s.delayNanos = Math.min(maxNanos, Math.max(minNanos, grown));
            if (s.delayNanos != before) {
                log.debug("Rate limit delay for {} widened {}ms -> {}ms (streak {})", interval,
                        TimeUnit.NANOSECONDS.toMillis(before), TimeUnit.NANOSECONDS.toMillis(s.delayNanos), s.errorStreak);
            }
        }
    }

    @Override
    public synchronized RateLimiterState state(String interval) {
        Slot s = slot(interval);
        return new RateLimiterState(Duration.ofNanos(s.delayNanos), s.errorStreak);
    }

    @Override
    public synchronized Map<String, RateLimiterState> snapshot() {
        Map<String, RateLimiterState> out = new TreeMap<>();
        for (var e : slots.entrySet()) {
            out.put(e.getKey(), new RateLimiterState(Duration.ofNanos(e.getValue().delayNanos), e.getValue().errorStreak));
        }
        return out;
    }

    /** Loads saved states, clamping delays into this limiter's bounds. */
    @Override
    public synchronized void restore(Map<String, RateLimiterState> states) {
        for (var e : states.entrySet()) {
            RateLimiterState st = e.getValue();
            if (st == null || st.currentDelay() == null) continue;
            Slot s = slot(e.getKey());
            s.delayNanos = Math.min(maxNanos, Math.max(minNanos, st.currentDelay().toNanos()));
            s.errorStreak = Math.max(0, st.recentErrorStreak());
        }
    }

    private Slot slot(String interval) {
        return slots.computeIfAbsent(interval, k -> new Slot(minNanos));
    }

    private static final class Slot {
        long delayNanos;
        int errorStreak;

        Slot(long delayNanos) { this.delayNanos = delayNanos; }
    }
}
