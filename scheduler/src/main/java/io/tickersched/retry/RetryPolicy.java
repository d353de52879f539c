package io.tickersched.retry;

import io.tickersched.error.FetchFailure;

/**
 * Decides whether a failed fetch is attempted again inside the same pass.
 */
public interface RetryPolicy {
    RetryPolicy NEVER = new RetryPolicy() {
        @Override public boolean shouldRetry(int attempt, FetchFailure failure) { return false; }
        @Override public long backoffMillis(int attempt) { return 0L; }
    };

    /** {@code attempt} is the 1-based number of the attempt that just failed. */
    boolean shouldRetry(int attempt, FetchFailure failure);

    long backoffMillis(int attempt);
}
