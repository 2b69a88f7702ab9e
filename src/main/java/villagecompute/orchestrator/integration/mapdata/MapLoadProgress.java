package villagecompute.orchestrator.integration.mapdata;

/**
 * Progress snapshot published by a {@link MapDataLoader}.
 */
public record MapLoadProgress(String stage, String currentState, int statesCompleted, int totalStates,
        long bytesDownloaded, int percentComplete) {
}
