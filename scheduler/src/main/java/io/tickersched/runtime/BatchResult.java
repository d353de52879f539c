package io.tickersched.runtime;

import io.tickersched.progress.ProgressCursor;

/**
 * Outcome counts of one batch plus the cursor after it.
 */
public record BatchResult(int successes,
                          int retryableFailures,
                          int permanentFailures,
                          int cooldownsEntered,
                          ProgressCursor cursor,
                          boolean interrupted) {
    public int attempted() { return successes + retryableFailures + permanentFailures; }
}
