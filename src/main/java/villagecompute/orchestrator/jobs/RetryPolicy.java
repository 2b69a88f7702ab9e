package villagecompute.orchestrator.jobs;

import java.util.Optional;
import java.util.Set;

/**
 * Classifies the outcome of a single job attempt.
 *
 * <p>
 * <b>Rules:</b>
 * <ul>
 * <li>A result with {@code success = true} ends the run as {@link RetryDecision#SUCCEEDED}</li>
 * <li>A failed result with no fatal error code and a positive progress statistic ends the run as
 * {@link RetryDecision#ACCEPT_PARTIAL}, even when it carries warnings or non-fatal errors</li>
 * <li>Everything else (fatal error, zero progress, thrown exception, timeout) is a failed attempt: {@link
 * RetryDecision#RETRY} while {@code retryCount + 1 <= maxRetries}, {@link RetryDecision#STOP} afterwards</li>
 * </ul>
 *
 * <p>
 * The policy holds no state and does no I/O; the {@link JobManager} owns counting, sleeping and persistence.
 */
public final class RetryPolicy {

    static final String NO_PROGRESS_MESSAGE = "Job reported failure without progress";

    private final Set<String> fatalErrorCodes;
    private final String progressStatistic;

    public RetryPolicy(Set<String> fatalErrorCodes, String progressStatistic) {
        this.fatalErrorCodes = fatalErrorCodes == null ? Set.of() : Set.copyOf(fatalErrorCodes);
        this.progressStatistic = progressStatistic;
    }

    public static RetryPolicy forDefinition(JobDefinition definition) {
        return new RetryPolicy(definition.fatalErrorCodes(), definition.progressStatistic());
    }

    /**
     * Classifies an attempt.
     *
     * @param retryCount
     *            retries already consumed before this attempt (0 for the first attempt)
     * @param maxRetries
     *            retry budget of the job
     * @param result
     *            what the handler returned, null if it threw
     * @param error
     *            what the handler threw (or the timeout), null if it returned
     * @return the decision for the run
     */
    public RetryDecision decide(int retryCount, int maxRetries, JobResult result, Throwable error) {
        if (error == null && result != null) {
            if (result.success()) {
                return RetryDecision.SUCCEEDED;
            }
            if (firstFatalError(result).isEmpty() && hasProgress(result)) {
                return RetryDecision.ACCEPT_PARTIAL;
            }
        }
        return retryCount + 1 <= maxRetries ? RetryDecision.RETRY : RetryDecision.STOP;
    }

    public boolean isFatal(JobIssue issue) {
        return issue != null && issue.code() != null && fatalErrorCodes.contains(issue.code());
    }

    public Optional<JobIssue> firstFatalError(JobResult result) {
        return result.errors().stream().filter(this::isFatal).findFirst();
    }

    /**
     * Whether the configured progress statistic is positive. A policy without progress statistic never sees progress.
     */
    public boolean hasProgress(JobResult result) {
        return progressStatistic != null && result.statistic(progressStatistic) > 0;
    }

    /**
     * Message recorded as the attempt's error when a handler returned an unsuccessful result: the first fatal error,
     * otherwise the first error, otherwise a generic text.
     */
    public String failureMessage(JobResult result) {
        return firstFatalError(result).or(() -> result.errors().stream().findFirst()).map(JobIssue::message)
                .orElse(NO_PROGRESS_MESSAGE);
    }
}
