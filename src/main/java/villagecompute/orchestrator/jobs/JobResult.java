package villagecompute.orchestrator.jobs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value returned by a {@link JobHandler} for one attempt.
 *
 * <p>
 * The orchestrator treats the result as an opaque payload apart from two things: the {@link #errors()} codes (to decide
 * whether a failure is fatal) and the progress statistic named by the job definition (to decide whether a failed run
 * still made enough forward progress to be accepted).
 *
 * @param importId
 *            correlation id of the domain artifact the handler produced (import batch, sweep id), may be null
 * @param success
 *            whether the handler considers the run fully successful
 * @param statistics
 *            domain counters, e.g. {@code newDesignations}, {@code processedDocuments}
 * @param affectedCount
 *            number of downstream entities affected (businesses notified, documents updated)
 * @param errors
 *            ordered structured errors
 * @param warnings
 *            ordered structured warnings
 */
public record JobResult(String importId, boolean success, Map<String, Long> statistics, long affectedCount,
        List<JobIssue> errors, List<JobIssue> warnings) {

    public JobResult {
        statistics = statistics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Fully successful result.
     */
    public static JobResult succeeded(String importId, Map<String, Long> statistics, long affectedCount) {
        return new JobResult(importId, true, statistics, affectedCount, List.of(), List.of());
    }

    /**
     * Unsuccessful result carrying the given errors.
     */
    public static JobResult failed(String importId, Map<String, Long> statistics, List<JobIssue> errors) {
        return new JobResult(importId, false, statistics, 0, errors, List.of());
    }

    /**
     * Placeholder stored on a failed execution whose handler never returned a result.
     */
    public static JobResult empty() {
        return new JobResult(null, false, Map.of(), 0, List.of(), List.of());
    }

    /**
     * Returns the named counter, or 0 when the handler did not report it.
     */
    public long statistic(String name) {
        Long value = statistics.get(name);
        return value == null ? 0L : value;
    }
}
