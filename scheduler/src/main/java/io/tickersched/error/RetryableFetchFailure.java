package io.tickersched.error;

/** Rate limited or transient: counts against the entity and widens the rate-limit delay. */
public class RetryableFetchFailure extends FetchFailure {
    public RetryableFetchFailure(FetchError error, String message, Throwable cause) {
        super(error, message, cause);
        if (!error.isRetryable()) throw new IllegalArgumentException(error + " is not retryable");
    }
}
