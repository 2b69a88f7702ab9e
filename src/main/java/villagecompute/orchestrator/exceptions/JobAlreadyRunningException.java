package villagecompute.orchestrator.exceptions;

import java.util.UUID;

/**
 * Thrown when a manual trigger arrives while a run of the same job is active.
 *
 * <p>
 * Mapped to HTTP 409 Conflict. Carries the id of the active run so callers can follow it instead.
 */
public class JobAlreadyRunningException extends RuntimeException {

    private final String jobId;
    private final UUID runningExecutionId;

    public JobAlreadyRunningException(String jobId, UUID runningExecutionId) {
        super("Job " + jobId + " is already running"
                + (runningExecutionId == null ? "" : " (execution " + runningExecutionId + ")"));
        this.jobId = jobId;
        this.runningExecutionId = runningExecutionId;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * Id of the active run, null if the run was claimed but its record is not written yet.
     */
    public UUID getRunningExecutionId() {
        return runningExecutionId;
    }
}
