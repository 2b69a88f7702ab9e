package villagecompute.orchestrator.jobs;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured error or warning reported by a job handler.
 *
 * @param code
 *            machine-readable classification (e.g. {@code IMPORT_FAILED}); the orchestrator inspects it to tell fatal
 *            failures from recoverable ones
 * @param message
 *            human-readable description
 * @param reference
 *            optional domain reference the issue is about (census tract GEOID, document id), may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobIssue(String code, String message, String reference) {

    public static JobIssue of(String code, String message) {
        return new JobIssue(code, message, null);
    }
}
