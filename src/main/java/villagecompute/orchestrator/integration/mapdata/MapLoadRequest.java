package villagecompute.orchestrator.integration.mapdata;

import java.util.List;

/**
 * Options of one map import.
 *
 * @param dryRun
 *            compute the diff without writing designations
 * @param skipNotifications
 *            do not notify businesses whose designation changed
 * @param states
 *            two-letter state codes to import, empty for all states
 */
public record MapLoadRequest(boolean dryRun, boolean skipNotifications, List<String> states) {

    public MapLoadRequest {
        states = states == null ? List.of() : List.copyOf(states);
    }
}
