package villagecompute.orchestrator.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * Standard MDC fields for job orchestration logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - OpenTelemetry context of the current attempt</li>
 * <li>{@code job_id} - Job identifier, e.g. {@code hubzone-map-update}</li>
 * <li>{@code execution_id} - Execution record id</li>
 * <li>{@code trigger_type} - SCHEDULED or MANUAL</li>
 * <li>{@code attempt} - 1-indexed attempt number within the run</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the retry loop:</b>
 *
 * <pre>
 * LoggingConfig.setExecution(jobId, executionId, triggerType);
 * LoggingConfig.setAttempt(attempt);
 * LoggingConfig.enrichWithTraceContext();
 * ...
 * LoggingConfig.clearMDC();
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> {@link MDC} is thread-local. Runs execute on worker threads that are reused, so every run must
 * end with {@link #clearMDC()}.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_EXECUTION_ID = "execution_id";

    public static final String MDC_TRIGGER_TYPE = "trigger_type";

    public static final String MDC_ATTEMPT = "attempt";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id of the current OpenTelemetry span into MDC. Empty strings when no span is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets the run-level fields.
     *
     * @param jobId
     *            job identifier
     * @param executionId
     *            execution record id, may be null before the record exists
     * @param triggerType
     *            SCHEDULED or MANUAL
     */
    public static void setExecution(String jobId, UUID executionId, String triggerType) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
        if (executionId != null) {
            MDC.put(MDC_EXECUTION_ID, executionId.toString());
        }
        if (triggerType != null) {
            MDC.put(MDC_TRIGGER_TYPE, triggerType);
        }
    }

    public static void setAttempt(int attempt) {
        MDC.put(MDC_ATTEMPT, String.valueOf(attempt));
    }

    /**
     * Clears every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_EXECUTION_ID);
        MDC.remove(MDC_TRIGGER_TYPE);
        MDC.remove(MDC_ATTEMPT);
    }
}
