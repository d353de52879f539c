package io.tickersched.runtime;

/**
 * Accumulated batch outcomes for one interval within a run.
 */
public record IntervalStats(int batches,
                            int successes,
                            int retryableFailures,
                            int permanentFailures,
                            int cooldownsEntered,
                            boolean completed,
                            boolean interrupted) {
    public static final IntervalStats EMPTY = new IntervalStats(0, 0, 0, 0, 0, false, false);

    public IntervalStats plus(BatchResult r) {
        return new IntervalStats(batches + 1,
                successes + r.successes(),
                retryableFailures + r.retryableFailures(),
                permanentFailures + r.permanentFailures(),
                cooldownsEntered + r.cooldownsEntered(),
                completed,
                interrupted || r.interrupted());
    }

    public IntervalStats markCompleted() {
        return new IntervalStats(batches, successes, retryableFailures, permanentFailures, cooldownsEntered, true, interrupted);
    }

    public int attempted() { return successes + retryableFailures + permanentFailures; }
}
