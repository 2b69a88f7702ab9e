package villagecompute.orchestrator.integration.mapdata;

import java.util.List;

/**
 * Outcome of one map import.
 *
 * @param importId
 *            identifier of the import batch
 * @param success
 *            whether every state imported cleanly
 * @param statistics
 *            designation counters
 * @param affectedBusinessCount
 *            businesses whose designation status changed
 * @param errors
 *            import errors; {@code IMPORT_FAILED} means the import as a whole did not complete
 * @param warnings
 *            non-blocking findings, e.g. tracts with invalid geometry
 */
public record MapLoadResult(String importId, boolean success, Statistics statistics, long affectedBusinessCount,
        List<Issue> errors, List<Issue> warnings) {

    public MapLoadResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public record Statistics(long totalTracts, long newDesignations, long updatedDesignations,
            long expiredDesignations, long redesignatedAreas, long activeHubzones, long processingTimeMs) {
    }

    /**
     * @param geoid
     *            census tract the issue refers to, may be null
     */
    public record Issue(String code, String message, String geoid) {
    }
}
