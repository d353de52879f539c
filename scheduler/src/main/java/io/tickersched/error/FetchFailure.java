package io.tickersched.error;

import java.util.Objects;

/**
 * A failed fetch attempt. Use {@link #of} so the concrete type always agrees with {@link FetchError#isRetryable()}.
 */
public abstract class FetchFailure extends Exception {
    private final FetchError error;

    protected FetchFailure(FetchError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public static FetchFailure of(FetchError error, String message) {
        return of(error, message, null);
    }

    public static FetchFailure of(FetchError error, String message, Throwable cause) {
        return error.isRetryable()
                ? new RetryableFetchFailure(error, message, cause)
                : new PermanentFetchFailure(error, message, cause);
    }

    public FetchError error() { return error; }

    public boolean isRetryable() { return error.isRetryable(); }
}
