package io.tickersched.error;

/**
 * Failure classes reported by a fetcher.
 */
public enum FetchError {
    RATE_LIMITED(true),
    NOT_FOUND(false),
    TRANSIENT(true),
    MALFORMED(false);

    private final boolean retryable;

    FetchError(boolean retryable) { this.retryable = retryable; }

    /** Retryable errors are throttling or availability signals and widen the rate-limit delay. */
    public boolean isRetryable() { return retryable; }
}
