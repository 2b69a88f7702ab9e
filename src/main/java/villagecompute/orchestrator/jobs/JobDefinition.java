package villagecompute.orchestrator.jobs;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of one periodic job, resolved once at startup.
 *
 * @param id
 *            stable job identifier
 * @param name
 *            human-readable name used in logs and notifications
 * @param description
 *            what the job does
 * @param cronExpression
 *            5-field UNIX cron expression evaluated in UTC
 * @param enabled
 *            whether {@link JobManager#start()} registers the cron trigger
 * @param maxRetries
 *            retries after the first attempt; a run makes at most {@code maxRetries + 1} attempts
 * @param retryDelay
 *            base unit of the linear backoff, the n-th retry waits {@code retryDelay * n}
 * @param timeout
 *            limit for a single attempt
 * @param fatalErrorCodes
 *            error codes that disqualify a failed result from the partial-success exemption
 * @param progressStatistic
 *            statistic that must be positive for a failed result to be accepted as partial success
 * @param handler
 *            the job's work
 */
public record JobDefinition(String id, String name, String description, String cronExpression, boolean enabled,
        int maxRetries, Duration retryDelay, Duration timeout, Set<String> fatalErrorCodes, String progressStatistic,
        JobHandler handler) {

    public JobDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cronExpression, "cronExpression");
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(handler, "handler");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        CronExpressions.validate(cronExpression);
        description = description == null ? "" : description;
        fatalErrorCodes = fatalErrorCodes == null ? Set.of() : Set.copyOf(fatalErrorCodes);
    }

    /**
     * Builds a definition from the catalogue defaults of the handler's {@link JobType}.
     */
    public static JobDefinition defaults(JobHandler handler) {
        JobType type = handler.handlesType();
        return new JobDefinition(type.getId(), type.getDisplayName(), type.getDescription(), type.getDefaultCron(),
                true, JobType.DEFAULT_MAX_RETRIES, JobType.DEFAULT_RETRY_DELAY, JobType.DEFAULT_TIMEOUT,
                type.getFatalErrorCodes(), type.getProgressStatistic(), handler);
    }

    public JobDefinition withSchedule(String cron, boolean enabledFlag) {
        return new JobDefinition(id, name, description, cron, enabledFlag, maxRetries, retryDelay, timeout,
                fatalErrorCodes, progressStatistic, handler);
    }

    public JobDefinition withRetries(int retries, Duration delay, Duration attemptTimeout) {
        return new JobDefinition(id, name, description, cronExpression, enabled, retries, delay, attemptTimeout,
                fatalErrorCodes, progressStatistic, handler);
    }
}
