package villagecompute.orchestrator.integration.mapdata;

import java.util.function.Consumer;

/**
 * Imports HUBZone designations from Census TIGER/Line and SBA sources.
 *
 * <p>
 * The import pipeline (download, geometry processing, designation diff, business notification) lives outside the
 * orchestrator. Deployments provide an implementation bean; until then {@link UnconfiguredMapDataLoader} is active.
 */
public interface MapDataLoader {

    /**
     * Runs one import.
     *
     * @param request
     *            import options
     * @param progress
     *            receives download and processing progress, never null
     * @return import outcome; an unsuccessful result is a normal return, not an exception
     * @throws Exception
     *             if the import could not run at all
     */
    MapLoadResult load(MapLoadRequest request, Consumer<MapLoadProgress> progress) throws Exception;
}
