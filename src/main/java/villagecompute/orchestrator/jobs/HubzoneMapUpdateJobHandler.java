package villagecompute.orchestrator.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.orchestrator.integration.mapdata.MapDataLoader;
import villagecompute.orchestrator.integration.mapdata.MapLoadProgress;
import villagecompute.orchestrator.integration.mapdata.MapLoadRequest;
import villagecompute.orchestrator.integration.mapdata.MapLoadResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Quarterly HUBZone map refresh.
 *
 * <p>
 * <b>Options:</b>
 * <ul>
 * <li>{@code dry_run} - compute the designation diff without writing it</li>
 * <li>{@code skip_notifications} - do not notify affected businesses</li>
 * <li>{@code states} - restrict the import to these state codes (array or comma-separated)</li>
 * </ul>
 *
 * <p>
 * <b>Result statistics:</b> {@code totalTracts}, {@code newDesignations}, {@code updatedDesignations},
 * {@code expiredDesignations}, {@code redesignatedAreas}, {@code activeHubzones}, {@code processingTimeMs}. A failed
 * import that still produced new designations and reported no {@code IMPORT_FAILED} error is accepted as partial
 * success.
 *
 * @see MapDataLoader
 */
@ApplicationScoped
public class HubzoneMapUpdateJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(HubzoneMapUpdateJobHandler.class);

    static final String OPTION_DRY_RUN = "dry_run";
    static final String OPTION_SKIP_NOTIFICATIONS = "skip_notifications";
    static final String OPTION_STATES = "states";

    @Inject
    MapDataLoader mapDataLoader;

    @Override
    public JobType handlesType() {
        return JobType.HUBZONE_MAP_UPDATE;
    }

    @Override
    public JobResult execute(Map<String, Object> options, JobProgressListener progress) throws Exception {
        List<String> states = JobOptions.strings(options, OPTION_STATES).stream()
                .map(s -> s.toUpperCase(Locale.ROOT)).toList();
        MapLoadRequest request = new MapLoadRequest(JobOptions.flag(options, OPTION_DRY_RUN),
                JobOptions.flag(options, OPTION_SKIP_NOTIFICATIONS), states);

        LOG.infof("Starting HUBZone map import (dryRun=%s, skipNotifications=%s, states=%s)", request.dryRun(),
                request.skipNotifications(), states.isEmpty() ? "all" : states);

        MapLoadResult loaded = mapDataLoader.load(request, p -> progress.onProgress(toEvent(p)));

        JobResult result = toResult(loaded);
        LOG.infof("HUBZone map import %s finished (success=%s, newDesignations=%d, errors=%d, warnings=%d)",
                result.importId(), result.success(), result.statistic("newDesignations"), result.errors().size(),
                result.warnings().size());
        return result;
    }

    static JobProgressEvent toEvent(MapLoadProgress progress) {
        String detail = progress.currentState() == null
                ? progress.statesCompleted() + "/" + progress.totalStates() + " states"
                : progress.currentState() + " (" + progress.statesCompleted() + "/" + progress.totalStates()
                        + " states)";
        return new JobProgressEvent(progress.stage(), detail, progress.percentComplete());
    }

    static JobResult toResult(MapLoadResult loaded) {
        Map<String, Long> statistics = new LinkedHashMap<>();
        MapLoadResult.Statistics stats = loaded.statistics();
        if (stats != null) {
            statistics.put("totalTracts", stats.totalTracts());
            statistics.put("newDesignations", stats.newDesignations());
            statistics.put("updatedDesignations", stats.updatedDesignations());
            statistics.put("expiredDesignations", stats.expiredDesignations());
            statistics.put("redesignatedAreas", stats.redesignatedAreas());
            statistics.put("activeHubzones", stats.activeHubzones());
            statistics.put("processingTimeMs", stats.processingTimeMs());
        }
        return new JobResult(loaded.importId(), loaded.success(), statistics, loaded.affectedBusinessCount(),
                loaded.errors().stream().map(HubzoneMapUpdateJobHandler::toIssue).toList(),
                loaded.warnings().stream().map(HubzoneMapUpdateJobHandler::toIssue).toList());
    }

    private static JobIssue toIssue(MapLoadResult.Issue issue) {
        return new JobIssue(issue.code(), issue.message(), issue.geoid());
    }
}
