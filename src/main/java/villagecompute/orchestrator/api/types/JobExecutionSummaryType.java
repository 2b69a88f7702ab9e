package villagecompute.orchestrator.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.orchestrator.data.models.JobExecution;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Condensed execution entry for job history lists.
 *
 * @param success
 *            {@code true} when the run completed, including accepted partial successes
 */
@Schema(
        description = "Execution history entry")
public record JobExecutionSummaryType(UUID id, String status, @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt, @JsonProperty("duration_ms") Long durationMs,
        @JsonProperty("trigger_type") String triggerType, @JsonProperty("triggered_by") String triggeredBy,
        boolean success, @JsonProperty("error_message") String errorMessage) {

    public static JobExecutionSummaryType from(JobExecution execution) {
        return new JobExecutionSummaryType(execution.id, execution.status.name().toLowerCase(Locale.ROOT),
                execution.startedAt, execution.completedAt, execution.durationMs,
                execution.triggerType.name().toLowerCase(Locale.ROOT), execution.triggeredBy,
                execution.status == JobExecution.ExecutionStatus.COMPLETED, execution.errorMessage);
    }
}
