package villagecompute.orchestrator.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.orchestrator.data.models.JobExecution;
import villagecompute.orchestrator.jobs.JobResult;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * API response type for a full execution record.
 *
 * <p>
 * {@code completed_at} and {@code result} are null while the run is active and both set once it is terminal.
 */
@Schema(
        description = "Job execution record")
public record JobExecutionType(UUID id, @JsonProperty("job_id") String jobId,
        @JsonProperty("job_name") String jobName,

        @Schema(
                description = "running, completed or failed",
                example = "completed") String status,

        @JsonProperty("started_at") Instant startedAt, @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("duration_ms") Long durationMs,

        @Schema(
                description = "scheduled or manual",
                example = "manual") @JsonProperty("trigger_type") String triggerType,

        @JsonProperty("triggered_by") String triggeredBy,

        @Schema(
                description = "Handler result of the last attempt",
                nullable = true) JobResult result,

        @JsonProperty("error_message") String errorMessage, @JsonProperty("error_stack") String errorStack,
        @JsonProperty("retry_count") int retryCount, @JsonProperty("max_retries") int maxRetries,
        Map<String, Object> metadata, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /**
     * Converts an entity; {@code result} is the already deserialized form of {@code execution.result}.
     */
    public static JobExecutionType from(JobExecution execution, JobResult result) {
        return new JobExecutionType(execution.id, execution.jobId, execution.jobName,
                execution.status.name().toLowerCase(Locale.ROOT), execution.startedAt, execution.completedAt,
                execution.durationMs, execution.triggerType.name().toLowerCase(Locale.ROOT), execution.triggeredBy,
                result, execution.errorMessage, execution.errorStack, execution.retryCount, execution.maxRetries,
                execution.metadata == null ? Map.of() : execution.metadata, execution.createdAt,
                execution.updatedAt);
    }
}
