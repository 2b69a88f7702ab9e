package villagecompute.orchestrator.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.orchestrator.data.models.JobExecution;
import villagecompute.orchestrator.data.models.JobExecution.ExecutionStatus;
import villagecompute.orchestrator.data.models.JobExecution.TriggerType;
import villagecompute.orchestrator.data.models.JobNotification;
import villagecompute.orchestrator.exceptions.ResourceNotFoundException;
import villagecompute.orchestrator.jobs.JobIssue;
import villagecompute.orchestrator.jobs.JobResult;
import villagecompute.orchestrator.testing.H2TestResource;

/**
 * Tests for {@link ExecutionTracker} against the H2 test database.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class ExecutionTrackerTest {

    private static final String JOB_ID = "tracker-test-job";

    @Inject
    ExecutionTracker executionTracker;

    @BeforeEach
    @Transactional
    void setUp() {
        JobNotification.deleteAll();
        JobExecution.deleteAll();
    }

    @Test
    void testCreateExecution_running() {
        JobExecution created = executionTracker.createExecution(JOB_ID, "Tracker Test", TriggerType.MANUAL,
                "ops@villagecompute.com", 3, Map.of("options", Map.of("dry_run", true)));

        assertNotNull(created.id);
        JobExecution stored = executionTracker.getExecution(created.id).orElseThrow();
        assertEquals(ExecutionStatus.RUNNING, stored.status);
        assertEquals(TriggerType.MANUAL, stored.triggerType);
        assertEquals("ops@villagecompute.com", stored.triggeredBy);
        assertEquals(0, stored.retryCount);
        assertEquals(3, stored.maxRetries);
        assertNull(stored.completedAt);
        assertNull(stored.result);
        assertEquals(Map.of("dry_run", true), stored.metadata.get("options"));
    }

    @Test
    void testUpdateExecution_terminalState() {
        JobExecution created = executionTracker.createExecution(JOB_ID, "Tracker Test", TriggerType.SCHEDULED, null,
                3, null);
        JobResult result = new JobResult("imp-1", false, Map.of("newDesignations", 12L), 4,
                List.of(new JobIssue("STATE_FAILED", "Download of WY failed", "56")), List.of());
        Instant completedAt = Instant.now();

        executionTracker.updateExecution(created.id, ExecutionUpdate.terminal(ExecutionStatus.COMPLETED,
                completedAt, 1500L, result, "Download of WY failed", null, 1));

        JobExecution stored = executionTracker.getExecution(created.id).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, stored.status);
        assertEquals(1500L, stored.durationMs);
        assertEquals(1, stored.retryCount);
        assertEquals("Download of WY failed", stored.errorMessage);
        assertNull(stored.errorStack);
        assertNotNull(stored.completedAt);
        assertEquals(result, executionTracker.toResult(stored.result));
    }

    @Test
    void testUpdateExecution_nullFieldsLeaveValues() {
        JobExecution created = executionTracker.createExecution(JOB_ID, "Tracker Test", TriggerType.SCHEDULED, null,
                2, Map.of());
        executionTracker.updateExecution(created.id,
                new ExecutionUpdate(null, null, null, null, "first failure", "stack", 1));

        executionTracker.updateExecution(created.id,
                new ExecutionUpdate(ExecutionStatus.FAILED, Instant.now(), 10L, JobResult.empty(), null, null, null));

        JobExecution stored = executionTracker.getExecution(created.id).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, stored.status);
        assertEquals("first failure", stored.errorMessage);
        assertEquals("stack", stored.errorStack);
        assertEquals(1, stored.retryCount);
        assertEquals(JobResult.empty(), executionTracker.toResult(stored.result));
    }

    @Test
    void testUpdateExecution_unknownId() {
        UUID unknown = UUID.randomUUID();

        ResourceNotFoundException error = assertThrows(ResourceNotFoundException.class,
                () -> executionTracker.updateExecution(unknown, new ExecutionUpdate(ExecutionStatus.FAILED, null,
                        null, null, null, null, null)));
        assertTrue(error.getMessage().contains(unknown.toString()));
    }

    @Test
    void testGetExecution_unknownId() {
        assertTrue(executionTracker.getExecution(UUID.randomUUID()).isEmpty());
    }

    @Test
    void testGetHistory_mostRecentFirstAndLimited() {
        Instant base = Instant.now().truncatedTo(ChronoUnit.SECONDS).minus(1, ChronoUnit.DAYS);
        for (int i = 0; i < 12; i++) {
            insertTerminal(JOB_ID, base.plus(i, ChronoUnit.MINUTES), ExecutionStatus.COMPLETED);
        }
        insertTerminal("other-job", base.plus(1, ChronoUnit.HOURS), ExecutionStatus.FAILED);

        List<JobExecution> history = executionTracker.getHistory(JOB_ID, 10);

        assertEquals(10, history.size());
        assertEquals(base.plus(11, ChronoUnit.MINUTES), history.get(0).startedAt);
        assertEquals(base.plus(2, ChronoUnit.MINUTES), history.get(9).startedAt);
        assertTrue(history.stream().allMatch(e -> JOB_ID.equals(e.jobId)));
        assertEquals(base.plus(11, ChronoUnit.MINUTES),
                executionTracker.getLastExecution(JOB_ID).orElseThrow().startedAt);
    }

    @Test
    void testGetLastExecution_none() {
        assertTrue(executionTracker.getLastExecution("never-run").isEmpty());
        assertTrue(executionTracker.getHistory("never-run", 10).isEmpty());
    }

    @Test
    void testRecordNotification() {
        JobExecution created = executionTracker.createExecution(JOB_ID, "Tracker Test", TriggerType.SCHEDULED, null,
                0, Map.of());

        executionTracker.recordNotification(created.id, List.of("ops@villagecompute.com"),
                Map.of("status", "completed", "job_id", JOB_ID));

        List<JobNotification> notifications = QuarkusTransaction.requiringNew()
                .call(() -> JobNotification.findByExecution(created.id));
        assertEquals(1, notifications.size());
        assertEquals(JobNotification.TYPE_COMPLETION, notifications.get(0).notificationType);
        assertEquals(List.of("ops@villagecompute.com"), notifications.get(0).recipients);
        assertEquals("completed", notifications.get(0).content.get("status"));
        assertNotNull(notifications.get(0).sentAt);
    }

    @Test
    void testToResult_null() {
        assertNull(executionTracker.toResult(null));
    }

    private void insertTerminal(String jobId, Instant startedAt, ExecutionStatus status) {
        QuarkusTransaction.requiringNew().run(() -> {
            JobExecution execution = new JobExecution();
            execution.jobId = jobId;
            execution.jobName = jobId;
            execution.status = status;
            execution.startedAt = startedAt;
            execution.completedAt = startedAt.plusSeconds(5);
            execution.durationMs = 5000L;
            execution.triggerType = TriggerType.SCHEDULED;
            execution.retryCount = 0;
            execution.maxRetries = 0;
            execution.metadata = Map.of();
            execution.createdAt = startedAt;
            execution.updatedAt = startedAt;
            execution.persist();
        });
    }
}
