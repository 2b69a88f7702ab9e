package villagecompute.orchestrator.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CronExpressions}.
 */
class CronExpressionsTest {

    @Test
    void testValidate_acceptsFiveFieldExpressions() {
        CronExpressions.validate(CronExpressions.QUARTERLY);
        CronExpressions.validate("*/5 * * * *");
        CronExpressions.validate("30 2 * * 1-5");
    }

    @Test
    void testValidate_rejectsInvalidExpressions() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CronExpressions.validate("not a cron"));
        assertTrue(e.getMessage().startsWith("Invalid cron expression 'not a cron'"));

        assertThrows(IllegalArgumentException.class, () -> CronExpressions.validate("0 0 32 * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpressions.validate("  "));
        assertThrows(IllegalArgumentException.class, () -> CronExpressions.validate(null));
    }

    @Test
    void testNextExecution_quarterlyInUtc() {
        Instant next = CronExpressions.nextExecution(CronExpressions.QUARTERLY, Instant.parse("2025-02-15T12:00:00Z"))
                .orElseThrow();

        assertEquals(Instant.parse("2025-04-01T00:00:00Z"), next);
    }

    @Test
    void testNextExecution_rollsOverYear() {
        Instant next = CronExpressions.nextExecution(CronExpressions.QUARTERLY, Instant.parse("2025-10-01T00:00:00Z"))
                .orElseThrow();

        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), next);
    }

    @Test
    void testNextExecution_everyFiveMinutes() {
        Instant next = CronExpressions.nextExecution("*/5 * * * *", Instant.parse("2025-06-01T10:02:30Z"))
                .orElseThrow();

        assertEquals(Instant.parse("2025-06-01T10:05:00Z"), next);
    }

    @Test
    void testDescribe_knownSchedules() {
        assertEquals("Quarterly at midnight on January 1, April 1, July 1, and October 1",
                CronExpressions.describe(CronExpressions.QUARTERLY));
        assertEquals("Monthly at midnight on the 1st", CronExpressions.describe("0  0 1 * *"));
    }

    @Test
    void testDescribe_otherSchedulesUseDescriptor() {
        String description = CronExpressions.describe("*/5 * * * *");

        assertFalse(description.isBlank());
        assertFalse("*/5 * * * *".equals(description));
    }
}
