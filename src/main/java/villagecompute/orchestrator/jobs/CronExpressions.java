package villagecompute.orchestrator.jobs;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for the 5-field UNIX cron expressions used by job definitions.
 *
 * <p>
 * All evaluation happens in UTC so quarterly boundaries never shift with daylight saving time.
 */
public final class CronExpressions {

    /**
     * Midnight UTC on the first day of each quarter.
     */
    public static final String QUARTERLY = "0 0 1 1,4,7,10 *";

    public static final String MONTHLY = "0 0 1 * *";

    private static final CronParser PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private CronExpressions() {
    }

    /**
     * Parses and validates an expression.
     *
     * @throws IllegalArgumentException
     *             if the expression is not valid 5-field cron syntax
     */
    public static Cron validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        try {
            return PARSER.parse(expression.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    /**
     * First fire time strictly after {@code after}, evaluated in UTC.
     */
    public static Optional<Instant> nextExecution(String expression, Instant after) {
        ZonedDateTime reference = ZonedDateTime.ofInstant(after, ZoneOffset.UTC);
        return ExecutionTime.forCron(validate(expression)).nextExecution(reference).map(ZonedDateTime::toInstant);
    }

    /**
     * Human-readable description for status pages and notifications.
     */
    public static String describe(String expression) {
        String normalized = expression.trim().replaceAll("\\s+", " ");
        if (QUARTERLY.equals(normalized)) {
            return "Quarterly at midnight on January 1, April 1, July 1, and October 1";
        }
        if (MONTHLY.equals(normalized)) {
            return "Monthly at midnight on the 1st";
        }
        try {
            return CronDescriptor.instance(Locale.US).describe(validate(normalized));
        } catch (RuntimeException e) {
            // cron-utils cannot describe every valid expression; fall back to the raw text
            return normalized;
        }
    }
}
