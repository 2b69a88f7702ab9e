package villagecompute.orchestrator.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Micrometer meters for job runs.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counter:</b> {@code orchestrator_job_executions_total{job,status}} - Terminal runs by final status</li>
 * <li><b>Counter:</b> {@code orchestrator_job_attempts_total{job,outcome}} - Attempts by retry decision</li>
 * <li><b>Timer:</b> {@code orchestrator_job_duration{job,status}} - Run duration including retry delays</li>
 * <li><b>Gauge:</b> {@code orchestrator_job_running{job}} - 1 while a run is active, else 0</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class JobMetrics {

    private static final Logger LOG = Logger.getLogger(JobMetrics.class);

    static final String EXECUTIONS = "orchestrator_job_executions_total";
    static final String ATTEMPTS = "orchestrator_job_attempts_total";
    static final String DURATION = "orchestrator_job_duration";
    static final String RUNNING = "orchestrator_job_running";

    private final MeterRegistry registry;

    @Inject
    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the running gauge of a job. The gauge reads the manager's single-flight flag.
     */
    public void registerRunningGauge(String jobId, AtomicBoolean running) {
        Gauge.builder(RUNNING, running, flag -> flag.get() ? 1.0 : 0.0)
                .description("Whether a run of the job is currently active").tag("job", jobId).register(registry);
        LOG.debugf("Registered gauge: %s{job=%s}", RUNNING, jobId);
    }

    public void recordAttempt(String jobId, String outcome) {
        Counter.builder(ATTEMPTS).description("Job attempts by retry decision").tag("job", jobId)
                .tag("outcome", outcome).register(registry).increment();
    }

    public void recordExecution(String jobId, String status, Duration duration) {
        Counter.builder(EXECUTIONS).description("Terminal job runs by status").tag("job", jobId)
                .tag("status", status).register(registry).increment();
        Timer.builder(DURATION).description("Job run duration including retry delays").tag("job", jobId)
                .tag("status", status).register(registry).record(duration);
    }
}
