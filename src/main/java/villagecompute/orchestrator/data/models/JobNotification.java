package villagecompute.orchestrator.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Audit row for a completion notification sent for a job execution.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code execution_id} (UUID) - The {@link JobExecution} the notification summarises</li>
 * <li>{@code notification_type} (TEXT) - Currently always {@code completion}</li>
 * <li>{@code recipients} (JSONB) - Addresses the summary was sent to</li>
 * <li>{@code sent_at} (TIMESTAMPTZ)</li>
 * <li>{@code content} (JSONB) - The notification payload as sent</li>
 * </ul>
 *
 * <p>
 * Written once, never read back by the orchestrator.
 */
@Entity
@Table(
        name = "job_notifications")
public class JobNotification extends PanacheEntityBase {

    public static final String TYPE_COMPLETION = "completion";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "execution_id",
            nullable = false)
    public UUID executionId;

    @Column(
            name = "notification_type",
            nullable = false,
            length = 50)
    public String notificationType;

    @Column(
            name = "recipients",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> recipients;

    @Column(
            name = "sent_at",
            nullable = false)
    public Instant sentAt;

    @Column(
            name = "content")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> content;

    public static List<JobNotification> findByExecution(UUID executionId) {
        return list("executionId = ?1 ORDER BY sentAt DESC", executionId);
    }
}
