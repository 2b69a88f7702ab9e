package villagecompute.orchestrator.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Set.of("IMPORT_FAILED"), "newItems");

    @Test
    void testSuccessfulResult_succeeds() {
        JobResult result = JobResult.succeeded("imp-1", Map.of("newItems", 0L), 0);

        assertEquals(RetryDecision.SUCCEEDED, policy.decide(0, 3, result, null));
    }

    @Test
    void testFailureWithProgressAndNoFatalError_acceptedAsPartial() {
        JobResult result = JobResult.failed("imp-1", Map.of("newItems", 5L), List.of());

        RetryDecision decision = policy.decide(0, 3, result, null);

        assertEquals(RetryDecision.ACCEPT_PARTIAL, decision);
        assertTrue(decision.isCompleted());
    }

    @Test
    void testNonFatalErrorsAndWarnings_stillAcceptedAsPartial() {
        JobResult result = new JobResult("imp-1", false, Map.of("newItems", 1L), 0,
                List.of(JobIssue.of("TRACT_SKIPPED", "geometry invalid")),
                List.of(JobIssue.of("SLOW_SOURCE", "SBA feed slow")));

        assertEquals(RetryDecision.ACCEPT_PARTIAL, policy.decide(2, 3, result, null));
    }

    @Test
    void testFailureWithoutProgress_retried() {
        JobResult result = JobResult.failed("imp-1", Map.of("newItems", 0L), List.of());

        assertEquals(RetryDecision.RETRY, policy.decide(0, 3, result, null));
        assertFalse(policy.hasProgress(result));
    }

    @Test
    void testMissingProgressStatistic_countsAsNoProgress() {
        JobResult result = JobResult.failed("imp-1", Map.of("otherCounter", 12L), List.of());

        assertEquals(RetryDecision.RETRY, policy.decide(0, 3, result, null));
    }

    @Test
    void testFatalError_retriedEvenWithProgress() {
        JobResult result = JobResult.failed("imp-1", Map.of("newItems", 7L),
                List.of(JobIssue.of("TRACT_SKIPPED", "minor"), JobIssue.of("IMPORT_FAILED", "download failed")));

        assertEquals(RetryDecision.RETRY, policy.decide(0, 3, result, null));
        assertEquals("download failed", policy.failureMessage(result));
    }

    @Test
    void testThrownError_retriedUntilBudgetExhausted() {
        RuntimeException error = new RuntimeException("upstream down");

        assertEquals(RetryDecision.RETRY, policy.decide(0, 3, null, error));
        assertEquals(RetryDecision.RETRY, policy.decide(2, 3, null, error));
        assertEquals(RetryDecision.STOP, policy.decide(3, 3, null, error));
    }

    @Test
    void testZeroRetryBudget_stopsAfterFirstFailure() {
        assertEquals(RetryDecision.STOP, policy.decide(0, 0, null, new IllegalStateException("boom")));
    }

    @Test
    void testFailureMessage_fallsBackToFirstErrorThenGenericText() {
        JobResult withErrors = JobResult.failed("imp-1", Map.of(),
                List.of(JobIssue.of("TRACT_SKIPPED", "first"), JobIssue.of("OTHER", "second")));
        JobResult withoutErrors = JobResult.failed("imp-1", Map.of(), List.of());

        assertEquals("first", policy.failureMessage(withErrors));
        assertEquals(RetryPolicy.NO_PROGRESS_MESSAGE, policy.failureMessage(withoutErrors));
    }

    @Test
    void testIsFatal() {
        assertTrue(policy.isFatal(JobIssue.of("IMPORT_FAILED", "x")));
        assertFalse(policy.isFatal(JobIssue.of("import_failed", "x")));
        assertFalse(policy.isFatal(new JobIssue(null, "x", null)));
        assertFalse(policy.isFatal(null));
    }

    @Test
    void testPolicyWithoutProgressStatistic_neverAcceptsPartial() {
        RetryPolicy strict = new RetryPolicy(Set.of(), null);
        JobResult result = JobResult.failed("imp-1", Map.of("newItems", 5L), List.of());

        assertEquals(RetryDecision.RETRY, strict.decide(0, 1, result, null));
    }
}
