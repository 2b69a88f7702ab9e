package villagecompute.orchestrator.jobs;

import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import io.quarkus.scheduler.Scheduler;
import io.quarkus.scheduler.Trigger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Binds job definitions to the Quarkus scheduler as programmatic cron triggers.
 *
 * <p>
 * <b>Schedule:</b> every trigger uses the definition's 5-field UNIX cron expression (see
 * {@code quarkus.scheduler.cron-type=unix}) evaluated in UTC.
 *
 * <p>
 * <b>Firing:</b> the task hands control to {@link JobManager#runScheduled()}, which returns as soon as the run has
 * been handed to the manager's worker. A firing that finds a run still active is dropped by the manager, never
 * queued. {@link ConcurrentExecution#SKIP} additionally guards against overlapping firings of the trigger itself.
 *
 * @see JobManager#start()
 * @see CronExpressions
 */
@ApplicationScoped
public class CronJobScheduler {

    private static final Logger LOG = Logger.getLogger(CronJobScheduler.class);

    static final String IDENTITY_PREFIX = "job:";

    static final String TIME_ZONE = "UTC";

    @Inject
    Scheduler scheduler;

    /**
     * Registers a cron trigger for the given definition.
     *
     * @param definition
     *            the job whose cron expression drives the trigger
     * @param firing
     *            invoked on each firing; must not block
     * @return {@code true} if registered, {@code false} if a trigger for this job already exists
     */
    public boolean register(JobDefinition definition, Runnable firing) {
        String identity = identity(definition.id());
        if (scheduler.getScheduledJob(identity) != null) {
            LOG.warnf("Cron trigger %s already registered, ignoring", identity);
            return false;
        }

        scheduler.newJob(identity).setCron(definition.cronExpression()).setTimeZone(TIME_ZONE)
                .setConcurrentExecution(ConcurrentExecution.SKIP).setTask(execution -> {
                    LOG.debugf("Cron trigger %s fired at %s", identity, execution.getFireTime());
                    firing.run();
                }).schedule();

        LOG.infof("Registered cron trigger %s (%s, %s)", identity, definition.cronExpression(), TIME_ZONE);
        return true;
    }

    /**
     * Removes the trigger of a job.
     *
     * @return {@code true} if a trigger was removed
     */
    public boolean deregister(String jobId) {
        Trigger removed = scheduler.unscheduleJob(identity(jobId));
        if (removed != null) {
            LOG.infof("Deregistered cron trigger %s", removed.getId());
        }
        return removed != null;
    }

    public boolean isRegistered(String jobId) {
        return scheduler.getScheduledJob(identity(jobId)) != null;
    }

    /**
     * Next fire time reported by the live trigger, empty when the job is not registered.
     */
    public Optional<Instant> nextFireTime(String jobId) {
        Trigger trigger = scheduler.getScheduledJob(identity(jobId));
        return trigger == null ? Optional.empty() : Optional.ofNullable(trigger.getNextFireTime());
    }

    static String identity(String jobId) {
        return IDENTITY_PREFIX + jobId;
    }
}
