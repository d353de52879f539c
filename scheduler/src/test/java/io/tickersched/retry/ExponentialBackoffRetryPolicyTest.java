package io.tickersched.retry;

import io.tickersched.error.FetchError;
import io.tickersched.error.FetchFailure;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {
    @Test
    void retriesRetryableUntilMaxAttempts() {
        var policy = new ExponentialBackoffRetryPolicy(3, 100, 1_000);
        FetchFailure throttled = FetchFailure.of(FetchError.RATE_LIMITED, "429");
        assertTrue(policy.shouldRetry(1, throttled));
        assertTrue(policy.shouldRetry(2, throttled));
        assertFalse(policy.shouldRetry(3, throttled));
    }

    @Test
    void neverRetriesPermanentFailures() {
        var policy = new ExponentialBackoffRetryPolicy(5, 100, 1_000);
        assertFalse(policy.shouldRetry(1, FetchFailure.of(FetchError.NOT_FOUND, "404")));
        assertFalse(policy.shouldRetry(1, FetchFailure.of(FetchError.MALFORMED, "bad json")));
    }

    @Test
    void backoffDoublesAndCaps() {
        var policy = new ExponentialBackoffRetryPolicy(10, 100, 500);
        assertEquals(100, policy.backoffMillis(1));
        assertEquals(200, policy.backoffMillis(2));
        assertEquals(400, policy.backoffMillis(3));
        assertEquals(500, policy.backoffMillis(4));
        assertEquals(500, policy.backoffMillis(60));
    }

    @Test
    void singleAttemptMeansNoRetry() {
        var policy = new ExponentialBackoffRetryPolicy(0, 1, 1);
        assertEquals(1, policy.maxAttempts());
        assertFalse(policy.shouldRetry(1, FetchFailure.of(FetchError.TRANSIENT, "x")));
        assertFalse(RetryPolicy.NEVER.shouldRetry(1, FetchFailure.of(FetchError.TRANSIENT, "x")));
    }
}
