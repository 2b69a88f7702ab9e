package villagecompute.orchestrator.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

/**
 * API response type returned as soon as a manual run has been handed to the job's worker.
 */
@Schema(
        description = "Accepted manual job run")
public record ManualTriggerResponseType(@Schema(
        description = "Execution id to poll",
        required = true) @JsonProperty("execution_id") UUID executionId,

        @Schema(
                description = "Job identifier",
                example = "hubzone-map-update",
                required = true) @JsonProperty("job_id") String jobId,

        @Schema(
                description = "Job display name",
                example = "HUBZone Map Update",
                required = true) @JsonProperty("job_name") String jobName,

        @Schema(
                description = "Always running at acceptance time",
                example = "running",
                required = true) String status,

        @Schema(
                description = "Run start",
                required = true) @JsonProperty("started_at") Instant startedAt,

        @Schema(
                description = "Human-readable confirmation",
                required = true) String message) {
}
