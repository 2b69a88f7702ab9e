package villagecompute.orchestrator.jobs;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import org.jboss.logging.Logger;
import villagecompute.orchestrator.api.types.JobExecutionSummaryType;
import villagecompute.orchestrator.api.types.JobExecutionType;
import villagecompute.orchestrator.api.types.JobStatusType;
import villagecompute.orchestrator.api.types.ManualTriggerRequestType;
import villagecompute.orchestrator.api.types.ManualTriggerResponseType;
import villagecompute.orchestrator.data.models.JobExecution;
import villagecompute.orchestrator.data.models.JobExecution.ExecutionStatus;
import villagecompute.orchestrator.data.models.JobExecution.TriggerType;
import villagecompute.orchestrator.exceptions.JobAlreadyRunningException;
import villagecompute.orchestrator.observability.JobMetrics;
import villagecompute.orchestrator.observability.LoggingConfig;
import villagecompute.orchestrator.services.ExecutionTracker;
import villagecompute.orchestrator.services.ExecutionUpdate;
import villagecompute.orchestrator.services.NotificationDispatcher;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one periodic job: owns its cron registration, its single-flight guard and its retry loop.
 *
 * <p>
 * <b>Run protocol:</b>
 * <ol>
 * <li>A scheduled firing or a manual trigger claims the single-flight flag by compare-and-set. A manual trigger that
 * loses throws {@link JobAlreadyRunningException}; a scheduled firing that loses is dropped.</li>
 * <li>A RUNNING execution record is written before the handler is invoked.</li>
 * <li>The retry loop runs on the manager's worker thread. Each attempt runs on an attempt thread, bounded by the
 * definition's timeout, and is classified by the {@link RetryPolicy}. Retry {@code n} waits {@code retryDelay * n}.</li>
 * <li>The terminal state is written with a single update, the completion notice is sent, then the flag is
 * released.</li>
 * </ol>
 *
 * <p>
 * Handler failures never escape the worker: every run ends as a COMPLETED or FAILED record.
 *
 * <p>
 * Instances are created by {@link villagecompute.orchestrator.services.JobRegistry}, one per job definition.
 */
public class JobManager {

    private static final Logger LOG = Logger.getLogger(JobManager.class);

    static final int HISTORY_LIMIT = 10;

    static final String DEFAULT_TRIGGERED_BY = "admin";

    static final String OPTIONS_METADATA_KEY = "options";

    private final JobDefinition definition;
    private final RetryPolicy retryPolicy;
    private final ExecutionTracker executionTracker;
    private final NotificationDispatcher notificationDispatcher;
    private final CronJobScheduler cronJobScheduler;
    private final Tracer tracer;
    private final JobMetrics metrics;
    private final ExecutorService worker;
    private final ExecutorService attemptExecutor;
    private final RetrySleeper sleeper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final List<JobProgressListener> progressListeners = new CopyOnWriteArrayList<>();
    private volatile JobExecution currentExecution;

    /**
     * Waits between retries.
     */
    @FunctionalInterface
    interface RetrySleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    public JobManager(JobDefinition definition, ExecutionTracker executionTracker,
            NotificationDispatcher notificationDispatcher, CronJobScheduler cronJobScheduler, Tracer tracer,
            JobMetrics metrics) {
        this(definition, executionTracker, notificationDispatcher, cronJobScheduler, tracer, metrics,
                Executors.newSingleThreadExecutor(namedThreads("job-worker-" + definition.id())),
                Executors.newCachedThreadPool(namedThreads("job-attempt-" + definition.id())),
                delay -> Thread.sleep(delay.toMillis()));
    }

    JobManager(JobDefinition definition, ExecutionTracker executionTracker,
            NotificationDispatcher notificationDispatcher, CronJobScheduler cronJobScheduler, Tracer tracer,
            JobMetrics metrics, ExecutorService worker, ExecutorService attemptExecutor, RetrySleeper sleeper) {
        this.definition = definition;
        this.retryPolicy = RetryPolicy.forDefinition(definition);
        this.executionTracker = executionTracker;
        this.notificationDispatcher = notificationDispatcher;
        this.cronJobScheduler = cronJobScheduler;
        this.tracer = tracer;
        this.metrics = metrics;
        this.worker = worker;
        this.attemptExecutor = attemptExecutor;
        this.sleeper = sleeper;
        metrics.registerRunningGauge(definition.id(), running);
    }

    public JobDefinition getDefinition() {
        return definition;
    }

    /**
     * Registers the cron trigger. Calling it again while started only logs a warning.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            LOG.warnf("Job %s already started", definition.id());
            return;
        }
        if (!definition.enabled()) {
            LOG.infof("Job %s is disabled, cron trigger not registered", definition.id());
            return;
        }
        cronJobScheduler.register(definition, this::runScheduled);
        LOG.infof("Started job %s (%s, %s)", definition.id(), definition.cronExpression(),
                CronExpressions.describe(definition.cronExpression()));
    }

    /**
     * Deregisters the cron trigger. A run in progress is left to finish. Calling it again while stopped only logs a
     * warning.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            LOG.warnf("Job %s is not started", definition.id());
            return;
        }
        cronJobScheduler.deregister(definition.id());
        LOG.infof("Stopped job %s", definition.id());
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Starts a run on behalf of an operator.
     *
     * @param request
     *            identity and handler options, may be null
     * @return acceptance details; the run continues on the worker thread
     * @throws JobAlreadyRunningException
     *             if a run is active; no record is created in that case
     */
    public ManualTriggerResponseType triggerManual(ManualTriggerRequestType request) {
        ManualTriggerRequestType effective = request == null ? ManualTriggerRequestType.empty() : request;
        String triggeredBy = effective.triggeredBy() == null || effective.triggeredBy().isBlank()
                ? DEFAULT_TRIGGERED_BY
                : effective.triggeredBy();
        Map<String, Object> options = effective.options() == null ? Map.of() : effective.options();

        if (!running.compareAndSet(false, true)) {
            JobExecution active = currentExecution;
            LOG.warnf("Manual trigger of job %s by %s rejected, already running", definition.id(), triggeredBy);
            throw new JobAlreadyRunningException(definition.id(), active == null ? null : active.id);
        }

        JobExecution execution = beginRun(TriggerType.MANUAL, triggeredBy, options);
        LOG.infof("Job %s manually triggered by %s (execution %s)", definition.id(), triggeredBy, execution.id);
        return new ManualTriggerResponseType(execution.id, definition.id(), definition.name(), "running",
                execution.startedAt, "Job " + definition.name() + " triggered");
    }

    /**
     * Starts a run from the cron trigger. Never throws and never waits for the run.
     *
     * @return the new execution id, empty if the firing was skipped or the run could not start
     */
    public Optional<UUID> runScheduled() {
        if (!running.compareAndSet(false, true)) {
            JobExecution active = currentExecution;
            LOG.warnf("Skipping scheduled run of job %s, execution %s still running", definition.id(),
                    active == null ? "(starting)" : active.id);
            return Optional.empty();
        }
        try {
            return Optional.of(beginRun(TriggerType.SCHEDULED, null, Map.of()).id);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to start scheduled run of job %s", definition.id());
            return Optional.empty();
        }
    }

    public boolean isJobRunning() {
        return running.get();
    }

    public Optional<JobExecution> getCurrentExecution() {
        return Optional.ofNullable(currentExecution);
    }

    public void addProgressListener(JobProgressListener listener) {
        progressListeners.add(listener);
    }

    public void removeProgressListener(JobProgressListener listener) {
        progressListeners.remove(listener);
    }

    /**
     * Job metadata with schedule, last execution and the 10 most recent executions.
     */
    public JobStatusType getStatus() {
        String cron = definition.cronExpression();
        boolean registered = cronJobScheduler.isRegistered(definition.id());
        Instant nextRun = registered
                ? cronJobScheduler.nextFireTime(definition.id())
                        .or(() -> CronExpressions.nextExecution(cron, Instant.now())).orElse(null)
                : null;

        JobExecutionType lastExecution = executionTracker.getLastExecution(definition.id()).map(this::toType)
                .orElse(null);
        List<JobExecutionSummaryType> history = executionTracker.getHistory(definition.id(), HISTORY_LIMIT).stream()
                .map(JobExecutionSummaryType::from).toList();

        return new JobStatusType(definition.id(), definition.name(), definition.description(),
                definition.enabled() && registered, cron, CronExpressions.describe(cron), lastExecution, nextRun,
                running.get(), history);
    }

    /**
     * Looks up an execution of this job.
     */
    public Optional<JobExecutionType> getExecution(UUID executionId) {
        return executionTracker.getExecution(executionId).filter(e -> definition.id().equals(e.jobId))
                .map(this::toType);
    }

    /**
     * Stops the trigger and the worker threads. A run in progress gets {@code grace} to finish before it is
     * interrupted.
     */
    public void shutdown(Duration grace) {
        if (started.get()) {
            stop();
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnf("Job %s still running after %s, interrupting", definition.id(), grace);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
        attemptExecutor.shutdownNow();
    }

    /**
     * Writes the RUNNING record and hands the run to the worker. The caller must hold the single-flight flag; it is
     * released here if the run cannot start.
     */
    private JobExecution beginRun(TriggerType triggerType, String triggeredBy, Map<String, Object> options) {
        JobExecution execution;
        try {
            Map<String, Object> metadata = options.isEmpty() ? Map.of() : Map.of(OPTIONS_METADATA_KEY, options);
            execution = executionTracker.createExecution(definition.id(), definition.name(), triggerType,
                    triggeredBy, definition.maxRetries(), metadata);
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }

        currentExecution = execution;
        try {
            worker.execute(() -> runLoop(execution, options));
        } catch (RejectedExecutionException e) {
            LOG.errorf(e, "Worker of job %s rejected execution %s", definition.id(), execution.id);
            finish(execution, ExecutionStatus.FAILED, null, "Job worker is shut down", stackTrace(e), 0, false);
            throw e;
        }
        return execution;
    }

    /**
     * The retry loop. Runs on the worker thread.
     */
    void runLoop(JobExecution execution, Map<String, Object> options) {
        LoggingConfig.setExecution(definition.id(), execution.id, execution.triggerType.name());
        LOG.infof("Starting job %s (execution %s, trigger=%s)", definition.id(), execution.id,
                execution.triggerType);

        int retryCount = 0;
        JobResult result = null;
        String lastErrorMessage = null;
        String lastErrorStack = null;
        boolean completed = false;

        try {
            while (retryCount <= definition.maxRetries()) {
                if (retryCount > 0) {
                    Duration delay = definition.retryDelay().multipliedBy(retryCount);
                    LOG.infof("Retry %d/%d of job %s in %s", retryCount, definition.maxRetries(), definition.id(),
                            delay);
                    sleeper.sleep(delay);
                }

                int attempt = retryCount + 1;
                LoggingConfig.setAttempt(attempt);

                JobResult attemptResult = null;
                Exception attemptError = null;
                try {
                    attemptResult = runAttempt(execution, attempt, options);
                    result = attemptResult;
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    attemptError = e;
                }

                RetryDecision decision = retryPolicy.decide(retryCount, definition.maxRetries(), attemptResult,
                        attemptError);
                metrics.recordAttempt(definition.id(), decision.name().toLowerCase(Locale.ROOT));

                if (decision.isCompleted()) {
                    if (decision == RetryDecision.ACCEPT_PARTIAL) {
                        LOG.warnf("Job %s reported failure with progress on attempt %d (%s=%d, %d error(s)), accepting",
                                definition.id(), attempt, definition.progressStatistic(),
                                attemptResult.statistic(definition.progressStatistic()),
                                attemptResult.errors().size());
                    } else {
                        LOG.infof("Job %s succeeded on attempt %d", definition.id(), attempt);
                    }
                    completed = true;
                    break;
                }

                if (attemptError != null) {
                    lastErrorMessage = messageOf(attemptError);
                    lastErrorStack = stackTrace(attemptError);
                    LOG.errorf(attemptError, "Job %s attempt %d failed: %s", definition.id(), attempt,
                            lastErrorMessage);
                } else {
                    lastErrorMessage = retryPolicy.failureMessage(attemptResult);
                    lastErrorStack = null;
                    LOG.errorf("Job %s attempt %d returned failure: %s", definition.id(), attempt, lastErrorMessage);
                }
                retryCount++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastErrorMessage = "Job interrupted during shutdown";
            lastErrorStack = stackTrace(e);
            LOG.warnf("Job %s interrupted after %d retries", definition.id(), retryCount);
        }

        ExecutionStatus status = completed ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
        if (!completed) {
            LOG.errorf("Job %s failed after %d attempt(s): %s", definition.id(), retryCount, lastErrorMessage);
        }
        finish(execution, status, result, lastErrorMessage, lastErrorStack, retryCount, true);
    }

    /**
     * Single terminal update, completion notice, flag release. {@code onWorker} is false when the run never reached
     * the worker and this is the triggering thread, whose MDC is left alone.
     */
    private void finish(JobExecution execution, ExecutionStatus status, JobResult result, String errorMessage,
            String errorStack, int retryCount, boolean onWorker) {
        try {
            JobResult finalResult = result == null ? JobResult.empty() : result;
            Instant completedAt = Instant.now();
            long durationMs = Duration.between(execution.startedAt, completedAt).toMillis();

            try {
                executionTracker.updateExecution(execution.id, ExecutionUpdate.terminal(status, completedAt,
                        durationMs, finalResult, errorMessage, errorStack, retryCount));
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to persist terminal state of execution %s (status=%s)", execution.id, status);
            }

            metrics.recordExecution(definition.id(), status.name().toLowerCase(Locale.ROOT),
                    Duration.ofMillis(durationMs));
            LOG.infof("Job %s finished with status %s in %dms (retries=%d)", definition.id(), status, durationMs,
                    retryCount);

            try {
                notificationDispatcher.notifyCompletion(definition.id(), definition.name(), execution.id, status,
                        execution.startedAt, completedAt, durationMs, finalResult, errorMessage);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Completion notice for execution %s failed", execution.id);
            }
        } finally {
            currentExecution = null;
            running.set(false);
            if (onWorker) {
                LoggingConfig.clearMDC();
            }
        }
    }

    /**
     * Invokes the handler on an attempt thread inside a {@code job.attempt} span, bounded by the timeout.
     */
    private JobResult runAttempt(JobExecution execution, int attempt, Map<String, Object> options) throws Exception {
        Span span = tracer.spanBuilder("job.attempt").setAttribute("job.id", definition.id())
                .setAttribute("job.execution_id", execution.id.toString()).setAttribute("job.attempt", attempt)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            Callable<JobResult> invocation = () -> {
                LoggingConfig.setExecution(definition.id(), execution.id, execution.triggerType.name());
                LoggingConfig.setAttempt(attempt);
                LoggingConfig.enrichWithTraceContext();
                try {
                    return definition.handler().execute(options, this::publishProgress);
                } finally {
                    LoggingConfig.clearMDC();
                }
            };
            Future<JobResult> future = attemptExecutor.submit(Context.current().wrap(invocation));

            try {
                JobResult attemptResult = future.get(definition.timeout().toMillis(), TimeUnit.MILLISECONDS);
                if (attemptResult == null) {
                    throw new IllegalStateException("Handler of job " + definition.id() + " returned no result");
                }
                span.setAttribute("job.success", attemptResult.success());
                span.addEvent("job.attempt.completed");
                return attemptResult;
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new TimeoutException(
                        "Job " + definition.id() + " timed out after " + definition.timeout().toMillis() + "ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof InterruptedException) {
                    // the handler was interrupted, not this worker
                    throw new IllegalStateException(messageOf(cause), cause);
                }
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                throw new IllegalStateException("Handler of job " + definition.id() + " failed: " + cause, cause);
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            }
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            span.addEvent("job.attempt.failed");
            throw e;
        } finally {
            span.end();
        }
    }

    private void publishProgress(JobProgressEvent event) {
        LOG.debugf("Job %s progress: %s %d%% %s", definition.id(), event.stage(), event.percentComplete(),
                event.detail());
        for (JobProgressListener listener : progressListeners) {
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Progress listener of job %s failed", definition.id());
            }
        }
    }

    private JobExecutionType toType(JobExecution execution) {
        return JobExecutionType.from(execution, executionTracker.toResult(execution.result));
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() == null ? error.getClass().getName() : error.getMessage();
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
