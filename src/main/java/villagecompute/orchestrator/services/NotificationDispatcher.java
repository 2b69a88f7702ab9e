package villagecompute.orchestrator.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import io.quarkus.qute.Location;
import io.quarkus.qute.Template;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.orchestrator.api.types.JobCompletionNotificationType;
import villagecompute.orchestrator.data.models.JobExecution.ExecutionStatus;
import villagecompute.orchestrator.jobs.JobResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Sends the completion summary of a finished job run to the configured operators.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Build a {@link JobCompletionNotificationType} from the run's terminal state</li>
 * <li>Render {@code templates/notifications/jobCompletion.html} and send one mail per recipient</li>
 * <li>Record an audit row through {@link ExecutionTracker#recordNotification}</li>
 * </ul>
 *
 * <p>
 * Notifications never affect the outcome of a run: an empty recipient list is a no-op and every failure is logged and
 * swallowed.
 */
@ApplicationScoped
public class NotificationDispatcher {

    private static final Logger LOG = Logger.getLogger(NotificationDispatcher.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @Inject
    Mailer mailer;

    @Inject
    ExecutionTracker executionTracker;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "orchestrator.notifications.recipients")
    Optional<List<String>> recipients;

    @ConfigProperty(
            name = "orchestrator.notifications.from")
    String fromEmail;

    @ConfigProperty(
            name = "orchestrator.notifications.platform-name")
    String platformName;

    @Inject
    @Location("notifications/jobCompletion.html")
    Template jobCompletion;

    /**
     * Notifies operators that a run reached its terminal state.
     *
     * @param jobId
     *            job identifier
     * @param jobName
     *            job display name
     * @param executionId
     *            execution record id
     * @param status
     *            COMPLETED or FAILED
     * @param startedAt
     *            run start
     * @param completedAt
     *            run end
     * @param durationMs
     *            run duration including retries
     * @param result
     *            result of the last attempt, never null
     * @param errorMessage
     *            last error, null for completed runs without error
     */
    public void notifyCompletion(String jobId, String jobName, UUID executionId, ExecutionStatus status,
            Instant startedAt, Instant completedAt, long durationMs, JobResult result, String errorMessage) {
        List<String> to = configuredRecipients();
        if (to.isEmpty()) {
            LOG.debugf("No notification recipients configured, skipping completion notice for execution %s",
                    executionId);
            return;
        }

        try {
            JobCompletionNotificationType notification = new JobCompletionNotificationType(jobId, jobName,
                    executionId, status.name().toLowerCase(Locale.ROOT), startedAt, completedAt, durationMs, result,
                    errorMessage, to);

            String subject = subject(notification);
            String htmlBody = jobCompletion.data("notification", notification).data("platformName", platformName)
                    .data("duration", formatDuration(durationMs)).data("statistics", result.statistics().entrySet())
                    .render();

            List<String> delivered = new ArrayList<>();
            for (String recipient : to) {
                try {
                    mailer.send(Mail.withHtml(recipient, subject, htmlBody).setFrom(fromEmail)
                            .addHeader("X-Platform", platformName).addHeader("X-Notification-Type", "job_completion")
                            .addHeader("X-Execution-ID", executionId.toString()));
                    delivered.add(recipient);
                } catch (Exception e) {
                    LOG.errorf(e, "Failed to send completion notice for execution %s to %s", executionId, recipient);
                }
            }

            if (delivered.isEmpty()) {
                LOG.warnf("Completion notice for execution %s reached no recipient", executionId);
                return;
            }

            executionTracker.recordNotification(executionId, delivered,
                    objectMapper.convertValue(notification, MAP_TYPE));
            LOG.infof("Sent completion notice for job %s execution %s (status=%s) to %d recipient(s)", jobId,
                    executionId, notification.status(), delivered.size());

        } catch (Exception e) {
            LOG.errorf(e, "Failed to build completion notice for execution %s", executionId);
        }
    }

    List<String> configuredRecipients() {
        return recipients.orElse(List.of()).stream().map(String::trim).filter(r -> !r.isEmpty()).toList();
    }

    String subject(JobCompletionNotificationType notification) {
        return String.format("[%s] %s %s", platformName, notification.jobName(), notification.status());
    }

    /**
     * Formats a duration for humans: {@code 850ms}, {@code 12.3s}, {@code 4m 5s}, {@code 2h 3m}.
     */
    public static String formatDuration(long durationMs) {
        if (durationMs < 1000) {
            return durationMs + "ms";
        }
        if (durationMs < 60_000) {
            return String.format(Locale.ROOT, "%.1fs", durationMs / 1000.0);
        }
        long totalSeconds = durationMs / 1000;
        if (totalSeconds < 3600) {
            return (totalSeconds / 60) + "m " + (totalSeconds % 60) + "s";
        }
        long totalMinutes = totalSeconds / 60;
        return (totalMinutes / 60) + "h " + (totalMinutes % 60) + "m";
    }
}
