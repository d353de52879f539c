package io.tickersched.ratelimit;

import com.fasterxml.jackson.core.type.TypeReference;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.persist.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Carries learned pacing across process restarts ({@code rate-limits.json}).
 */
public final class RateLimitStateFile {
    private static final Logger log = LoggerFactory.getLogger(RateLimitStateFile.class);
    private static final TypeReference<TreeMap<String, RateLimiterState>> TYPE = new TypeReference<>() {};

    private RateLimitStateFile() {}

    public static void load(Path file, RateLimiter limiter) throws PersistenceFailure {
        Map<String, RateLimiterState> states = JsonFiles.read(file, TYPE).orElse(new TreeMap<>());
        if (!states.isEmpty()) {
            limiter.restore(states);
            log.info("Restored rate limits for {} interval(s) from {}", states.size(), file);
        }
    }

    public static void save(Path file, RateLimiter limiter) throws PersistenceFailure {
        JsonFiles.writeAtomically(file, limiter.snapshot());
    }
}
