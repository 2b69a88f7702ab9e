package villagecompute.orchestrator.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.orchestrator.jobs.JobResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Summary of a terminal run, rendered into the completion email and stored as the notification audit content.
 */
public record JobCompletionNotificationType(@JsonProperty("job_id") String jobId,
        @JsonProperty("job_name") String jobName, @JsonProperty("execution_id") UUID executionId, String status,
        @JsonProperty("started_at") Instant startedAt, @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("duration_ms") long durationMs, JobResult result,
        @JsonProperty("error_message") String errorMessage, List<String> recipients) {

    public boolean succeeded() {
        return "completed".equals(status);
    }
}
