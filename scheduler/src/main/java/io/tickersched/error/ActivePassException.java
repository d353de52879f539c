package io.tickersched.error;

/**
 * Thrown when a new pass is started while an incomplete cursor for the same pass id is still on disk.
 */
public class ActivePassException extends IllegalStateException {
    private final String passId;

    public ActivePassException(String passId) {
        super("Pass " + passId + " has an incomplete cursor on disk; resume it instead");
        this.passId = passId;
    }

    public String passId() { return passId; }
}
