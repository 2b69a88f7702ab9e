package villagecompute.orchestrator.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One run of a scheduled job, from trigger to terminal state.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code job_id} (TEXT) - JobType identifier, e.g. {@code hubzone-map-update}</li>
 * <li>{@code job_name} (TEXT) - Display name at the time of the run</li>
 * <li>{@code status} (TEXT) - RUNNING, COMPLETED, FAILED</li>
 * <li>{@code started_at} (TIMESTAMPTZ) - Run start</li>
 * <li>{@code completed_at} (TIMESTAMPTZ, nullable) - Set once the run is terminal</li>
 * <li>{@code duration_ms} (BIGINT, nullable) - Wall-clock duration of the whole run including retries</li>
 * <li>{@code trigger_type} (TEXT) - SCHEDULED or MANUAL</li>
 * <li>{@code triggered_by} (TEXT, nullable) - Identity of the manual invoker</li>
 * <li>{@code result} (JSONB, nullable) - Handler result of the last attempt, set once the run is terminal</li>
 * <li>{@code error_message} / {@code error_stack} (TEXT, nullable) - Last error of a failed or retried run</li>
 * <li>{@code retry_count} (INT) - Retries consumed; at most {@code max_retries + 1}</li>
 * <li>{@code max_retries} (INT) - Retry budget the run started with</li>
 * <li>{@code metadata} (JSONB) - Open key/value bag</li>
 * <li>{@code created_at} / {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * <p>
 * <b>Lifecycle:</b> inserted with status RUNNING when a run starts, updated exactly once when it ends. While RUNNING
 * both {@code completed_at} and {@code result} are null; once terminal both are set. Rows are never deleted here.
 *
 * @see villagecompute.orchestrator.services.ExecutionTracker for the only writer
 */
@Entity
@Table(
        name = "job_executions")
@NamedQuery(
        name = JobExecution.QUERY_FIND_BY_JOB_ID,
        query = "FROM JobExecution WHERE jobId = :jobId ORDER BY startedAt DESC, createdAt DESC")
public class JobExecution extends PanacheEntityBase {

    /**
     * Named query constant: executions of a job, most recent first.
     */
    public static final String QUERY_FIND_BY_JOB_ID = "JobExecution.findByJobId";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "job_id",
            nullable = false)
    public String jobId;

    @Column(
            name = "job_name",
            nullable = false)
    public String jobName;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 20)
    public ExecutionStatus status;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "duration_ms")
    public Long durationMs;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "trigger_type",
            nullable = false,
            length = 20)
    public TriggerType triggerType;

    @Column(
            name = "triggered_by")
    public String triggeredBy;

    @Column(
            name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> result;

    @Column(
            name = "error_message",
            columnDefinition = "TEXT")
    public String errorMessage;

    @Column(
            name = "error_stack",
            columnDefinition = "TEXT")
    public String errorStack;

    @Column(
            name = "retry_count",
            nullable = false)
    public int retryCount;

    @Column(
            name = "max_retries",
            nullable = false)
    public int maxRetries;

    @Column(
            name = "metadata")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Execution lifecycle statuses.
     */
    public enum ExecutionStatus {
        /**
         * Run in progress (retry loop not yet finished).
         */
        RUNNING,

        /**
         * Run ended with full success or an accepted partial success.
         */
        COMPLETED,

        /**
         * Run ended after exhausting its retries.
         */
        FAILED
    }

    /**
     * What started a run.
     */
    public enum TriggerType {
        /**
         * Cron trigger fired.
         */
        SCHEDULED,

        /**
         * Operator request through the admin API.
         */
        MANUAL
    }

    /**
     * Finds executions of a job, most recent first.
     *
     * @param jobId
     *            job identifier
     * @param limit
     *            maximum number of rows
     * @return executions ordered by {@code started_at DESC}
     */
    public static List<JobExecution> findHistory(String jobId, int limit) {
        if (jobId == null || limit <= 0) {
            return List.of();
        }
        return find("#" + QUERY_FIND_BY_JOB_ID, Parameters.with("jobId", jobId)).page(0, limit).list();
    }

    /**
     * Finds the most recent execution of a job.
     */
    public static Optional<JobExecution> findLatest(String jobId) {
        return findHistory(jobId, 1).stream().findFirst();
    }
}
