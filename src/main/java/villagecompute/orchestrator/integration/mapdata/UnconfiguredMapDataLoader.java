package villagecompute.orchestrator.integration.mapdata;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.function.Consumer;

/**
 * Active when no {@link MapDataLoader} implementation is deployed. Every import fails, which the orchestrator records
 * as a failed attempt.
 */
@ApplicationScoped
@DefaultBean
public class UnconfiguredMapDataLoader implements MapDataLoader {

    @Override
    public MapLoadResult load(MapLoadRequest request, Consumer<MapLoadProgress> progress) {
        throw new IllegalStateException("No MapDataLoader implementation is configured");
    }
}
