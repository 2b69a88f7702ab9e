package villagecompute.orchestrator.jobs;

/**
 * Outcome of classifying one attempt with {@link RetryPolicy}.
 */
public enum RetryDecision {

    /**
     * Handler reported full success. The run completes.
     */
    SUCCEEDED,

    /**
     * Handler reported failure without fatal errors but with forward progress. The run completes without further
     * attempts.
     */
    ACCEPT_PARTIAL,

    /**
     * Attempt failed and retries remain.
     */
    RETRY,

    /**
     * Attempt failed and the retry budget is exhausted. The run fails.
     */
    STOP;

    /**
     * Whether the run ends as completed.
     */
    public boolean isCompleted() {
        return this == SUCCEEDED || this == ACCEPT_PARTIAL;
    }
}
