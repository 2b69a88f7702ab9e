package villagecompute.orchestrator.services;

import villagecompute.orchestrator.data.models.JobExecution.ExecutionStatus;
import villagecompute.orchestrator.jobs.JobResult;

import java.time.Instant;

/**
 * Partial update of an execution record. Null fields leave the stored value untouched.
 */
public record ExecutionUpdate(ExecutionStatus status, Instant completedAt, Long durationMs, JobResult result,
        String errorMessage, String errorStack, Integer retryCount) {

    /**
     * Update that moves a run to its terminal state.
     */
    public static ExecutionUpdate terminal(ExecutionStatus status, Instant completedAt, long durationMs,
            JobResult result, String errorMessage, String errorStack, int retryCount) {
        return new ExecutionUpdate(status, completedAt, durationMs, result, errorMessage, errorStack, retryCount);
    }
}
