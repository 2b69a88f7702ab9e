package villagecompute.orchestrator.services;

import io.opentelemetry.api.trace.Tracer;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.orchestrator.api.types.JobExecutionType;
import villagecompute.orchestrator.exceptions.ResourceNotFoundException;
import villagecompute.orchestrator.jobs.CronJobScheduler;
import villagecompute.orchestrator.jobs.JobDefinition;
import villagecompute.orchestrator.jobs.JobHandler;
import villagecompute.orchestrator.jobs.JobManager;
import villagecompute.orchestrator.jobs.JobType;
import villagecompute.orchestrator.observability.JobMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds and owns one {@link JobManager} per job handler.
 *
 * <p>
 * <b>Handler Discovery:</b> every {@link JobHandler} bean is collected at construction. Two handlers for the same
 * {@link JobType} fail startup with {@link IllegalStateException}.
 *
 * <p>
 * <b>Configuration:</b> each definition starts from the {@link JobType} defaults and applies
 * {@code orchestrator.jobs.<job-id>.enabled|cron|max-retries|retry-delay|timeout} when present. Invalid values fail
 * startup.
 *
 * <p>
 * <b>Lifecycle:</b> managers are started on {@link StartupEvent} when {@code orchestrator.scheduler.autostart} is
 * true, and stopped on {@link ShutdownEvent}. Runs in progress get {@code orchestrator.scheduler.shutdown-grace} to
 * finish.
 */
@ApplicationScoped
public class JobRegistry {

    private static final Logger LOG = Logger.getLogger(JobRegistry.class);

    static final String CONFIG_PREFIX = "orchestrator.jobs.";

    @Inject
    Instance<JobHandler> handlers;

    @Inject
    ExecutionTracker executionTracker;

    @Inject
    NotificationDispatcher notificationDispatcher;

    @Inject
    CronJobScheduler cronJobScheduler;

    @Inject
    Tracer tracer;

    @Inject
    JobMetrics metrics;

    @Inject
    Config config;

    @ConfigProperty(
            name = "orchestrator.scheduler.autostart",
            defaultValue = "true")
    boolean autostart;

    @ConfigProperty(
            name = "orchestrator.scheduler.shutdown-grace",
            defaultValue = "30s")
    Duration shutdownGrace;

    private final Map<String, JobManager> managers = new LinkedHashMap<>();

    @PostConstruct
    void init() {
        Map<JobType, JobHandler> byType = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (byType.containsKey(type)) {
                throw new IllegalStateException("Duplicate handler for JobType." + type + ": "
                        + byType.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            byType.put(type, handler);
        }

        for (JobHandler handler : byType.values()) {
            JobDefinition definition = buildDefinition(handler);
            managers.put(definition.id(), new JobManager(definition, executionTracker, notificationDispatcher,
                    cronJobScheduler, tracer, metrics));
            LOG.infof("Registered job %s (cron=%s, enabled=%s, maxRetries=%d, retryDelay=%s, timeout=%s)",
                    definition.id(), definition.cronExpression(), definition.enabled(), definition.maxRetries(),
                    definition.retryDelay(), definition.timeout());
        }

        for (JobType type : JobType.values()) {
            if (!byType.containsKey(type)) {
                LOG.warnf("No handler registered for JobType.%s", type);
            }
        }
    }

    void onStart(@Observes StartupEvent event) {
        if (!autostart) {
            LOG.info("Job scheduler autostart disabled, jobs must be started through the admin API");
            return;
        }
        managers.values().forEach(JobManager::start);
        LOG.infof("Started %d job(s)", managers.size());
    }

    void onStop(@Observes ShutdownEvent event) {
        for (JobManager manager : managers.values()) {
            manager.shutdown(shutdownGrace);
        }
        LOG.infof("Shut down %d job(s)", managers.size());
    }

    /**
     * All managers, in {@link JobType} order.
     */
    public List<JobManager> getManagers() {
        return Collections.unmodifiableList(new ArrayList<>(managers.values()));
    }

    /**
     * @throws ResourceNotFoundException
     *             if no job has this id
     */
    public JobManager getManager(String jobId) {
        JobManager manager = managers.get(jobId);
        if (manager == null) {
            throw new ResourceNotFoundException("Job not found: " + jobId);
        }
        return manager;
    }

    /**
     * Looks up an execution of any job.
     */
    public Optional<JobExecutionType> findExecution(UUID executionId) {
        return executionTracker.getExecution(executionId)
                .map(e -> JobExecutionType.from(e, executionTracker.toResult(e.result)));
    }

    JobDefinition buildDefinition(JobHandler handler) {
        JobDefinition defaults = JobDefinition.defaults(handler);
        String prefix = CONFIG_PREFIX + defaults.id() + ".";

        String cron = config.getOptionalValue(prefix + "cron", String.class).orElse(defaults.cronExpression());
        boolean enabled = config.getOptionalValue(prefix + "enabled", Boolean.class).orElse(defaults.enabled());
        int maxRetries = config.getOptionalValue(prefix + "max-retries", Integer.class)
                .orElse(defaults.maxRetries());
        Duration retryDelay = config.getOptionalValue(prefix + "retry-delay", Duration.class)
                .orElse(defaults.retryDelay());
        Duration timeout = config.getOptionalValue(prefix + "timeout", Duration.class).orElse(defaults.timeout());

        return defaults.withSchedule(cron, enabled).withRetries(maxRetries, retryDelay, timeout);
    }
}
