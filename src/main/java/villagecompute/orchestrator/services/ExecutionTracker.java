package villagecompute.orchestrator.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.orchestrator.data.models.JobExecution;
import villagecompute.orchestrator.data.models.JobExecution.ExecutionStatus;
import villagecompute.orchestrator.data.models.JobExecution.TriggerType;
import villagecompute.orchestrator.data.models.JobNotification;
import villagecompute.orchestrator.exceptions.ResourceNotFoundException;
import villagecompute.orchestrator.jobs.JobResult;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable store of job execution records and notification audit rows.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Insert the RUNNING record before a handler is invoked</li>
 * <li>Apply the single terminal update once the retry loop ends</li>
 * <li>Serve history and single-execution lookups for status pages</li>
 * <li>Record notification audit rows (best effort)</li>
 * </ul>
 *
 * <p>
 * Job results are stored as JSON maps and converted with the application {@link ObjectMapper}.
 */
@ApplicationScoped
public class ExecutionTracker {

    private static final Logger LOG = Logger.getLogger(ExecutionTracker.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @Inject
    ObjectMapper objectMapper;

    /**
     * Inserts a RUNNING record for a new run.
     *
     * @param jobId
     *            job identifier
     * @param jobName
     *            job display name
     * @param triggerType
     *            SCHEDULED or MANUAL
     * @param triggeredBy
     *            manual invoker, null for scheduled runs
     * @param maxRetries
     *            retry budget of the run
     * @param metadata
     *            free-form key/value bag, may be null
     * @return the persisted record with its generated id
     */
    @Transactional
    public JobExecution createExecution(String jobId, String jobName, TriggerType triggerType, String triggeredBy,
            int maxRetries, Map<String, Object> metadata) {
        Instant now = Instant.now();

        JobExecution execution = new JobExecution();
        execution.jobId = jobId;
        execution.jobName = jobName;
        execution.status = ExecutionStatus.RUNNING;
        execution.startedAt = now;
        execution.triggerType = triggerType;
        execution.triggeredBy = triggeredBy;
        execution.retryCount = 0;
        execution.maxRetries = maxRetries;
        execution.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        execution.createdAt = now;
        execution.updatedAt = now;
        execution.persist();

        LOG.infof("Created execution %s for job %s (trigger=%s, triggeredBy=%s)", execution.id, jobId, triggerType,
                triggeredBy);
        return execution;
    }

    /**
     * Applies the non-null fields of {@code update} to an execution.
     *
     * @throws ResourceNotFoundException
     *             if no execution has this id
     */
    @Transactional
    public JobExecution updateExecution(UUID executionId, ExecutionUpdate update) {
        JobExecution execution = JobExecution.findById(executionId);
        if (execution == null) {
            throw new ResourceNotFoundException("Execution not found: " + executionId);
        }

        if (update.status() != null) {
            execution.status = update.status();
        }
        if (update.completedAt() != null) {
            execution.completedAt = update.completedAt();
        }
        if (update.durationMs() != null) {
            execution.durationMs = update.durationMs();
        }
        if (update.result() != null) {
            execution.result = toMap(update.result());
        }
        if (update.errorMessage() != null) {
            execution.errorMessage = update.errorMessage();
        }
        if (update.errorStack() != null) {
            execution.errorStack = update.errorStack();
        }
        if (update.retryCount() != null) {
            execution.retryCount = update.retryCount();
        }
        execution.updatedAt = Instant.now();

        LOG.debugf("Updated execution %s (status=%s)", executionId, execution.status);
        return execution;
    }

    @Transactional
    public Optional<JobExecution> getExecution(UUID executionId) {
        return JobExecution.findByIdOptional(executionId);
    }

    @Transactional
    public Optional<JobExecution> getLastExecution(String jobId) {
        return JobExecution.findLatest(jobId);
    }

    /**
     * Executions of a job, most recent first.
     */
    @Transactional
    public List<JobExecution> getHistory(String jobId, int limit) {
        return JobExecution.findHistory(jobId, limit);
    }

    /**
     * Writes a notification audit row in its own transaction. Failures are logged and never reach the caller.
     */
    public void recordNotification(UUID executionId, List<String> recipients, Map<String, Object> content) {
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                JobNotification notification = new JobNotification();
                notification.executionId = executionId;
                notification.notificationType = JobNotification.TYPE_COMPLETION;
                notification.recipients = List.copyOf(recipients);
                notification.sentAt = Instant.now();
                notification.content = content;
                notification.persist();
            });
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record notification for execution %s", executionId);
        }
    }

    public Map<String, Object> toMap(JobResult result) {
        return objectMapper.convertValue(result, MAP_TYPE);
    }

    /**
     * Reads a stored result back, null when nothing is stored.
     */
    public JobResult toResult(Map<String, Object> stored) {
        return stored == null ? null : objectMapper.convertValue(stored, JobResult.class);
    }
}
