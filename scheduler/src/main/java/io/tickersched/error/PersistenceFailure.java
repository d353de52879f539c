package io.tickersched.error;

import java.io.IOException;

/**
 * A state store could not be read or written. Fatal to the current run: callers must stop rather than continue
 * with bookkeeping that may not match what is on disk.
 */
public class PersistenceFailure extends IOException {
    public PersistenceFailure(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceFailure(String message) {
        super(message);
    }
}
