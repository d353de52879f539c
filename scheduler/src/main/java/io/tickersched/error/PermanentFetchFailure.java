package io.tickersched.error;

/** Not found or malformed: counts against the entity but is not a throttling signal. */
public class PermanentFetchFailure extends FetchFailure {
    public PermanentFetchFailure(FetchError error, String message, Throwable cause) {
        super(error, message, cause);
        if (error.isRetryable()) throw new IllegalArgumentException(error + " is retryable");
    }
}
