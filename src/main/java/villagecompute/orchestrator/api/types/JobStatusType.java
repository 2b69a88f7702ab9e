package villagecompute.orchestrator.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * API response type describing a job's configuration and recent activity.
 *
 * @param jobId
 *            stable job identifier
 * @param jobName
 *            display name
 * @param description
 *            what the job does
 * @param enabled
 *            whether the job is enabled and its cron trigger is currently registered
 * @param cronExpression
 *            5-field UNIX cron expression (UTC)
 * @param cronDescription
 *            human-readable schedule
 * @param lastExecution
 *            most recent execution, null if the job never ran
 * @param nextScheduledRun
 *            next fire time, null when the trigger is not registered
 * @param currentlyRunning
 *            whether a run is active in this process
 * @param executionHistory
 *            up to 10 recent executions, most recent first
 */
@Schema(
        description = "Job status with schedule and execution history")
public record JobStatusType(@JsonProperty("job_id") String jobId, @JsonProperty("job_name") String jobName,
        String description, boolean enabled, @JsonProperty("cron_expression") String cronExpression,

        @Schema(
                description = "Human-readable schedule",
                example = "Quarterly at midnight on January 1, April 1, July 1, and October 1") @JsonProperty("cron_description") String cronDescription,

        @JsonProperty("last_execution") JobExecutionType lastExecution,

        @Schema(
                description = "Next fire time (UTC), null when not scheduled",
                nullable = true) @JsonProperty("next_scheduled_run") Instant nextScheduledRun,

        @JsonProperty("currently_running") boolean currentlyRunning,
        @JsonProperty("execution_history") List<JobExecutionSummaryType> executionHistory) {
}
