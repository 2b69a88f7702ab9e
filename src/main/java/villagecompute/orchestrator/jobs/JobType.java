package villagecompute.orchestrator.jobs;

import java.time.Duration;
import java.util.Set;

/**
 * Catalogue of the periodic administrative jobs, with their default schedule and retry classification.
 *
 * <p>
 * Each job type maps to exactly one {@link JobHandler} bean. Schedule and retry settings can be overridden per job
 * under {@code orchestrator.jobs.<id>.*}; the fatal error codes and the progress statistic are fixed because they
 * describe the handler's result contract.
 *
 * @see JobHandler for handler contract
 * @see JobDefinition for the resolved, immutable configuration
 */
public enum JobType {

    /**
     * Re-imports HUBZone designations from Census TIGER/Line and SBA sources.
     * <p>
     * <b>Cadence:</b> Quarterly, midnight UTC on January 1, April 1, July 1 and October 1
     * <p>
     * <b>Handler:</b> HubzoneMapUpdateJobHandler
     * <p>
     * <b>Partial success:</b> accepted when no {@code IMPORT_FAILED} error was reported and at least one new
     * designation was imported
     */
    HUBZONE_MAP_UPDATE("hubzone-map-update", "HUBZone Map Update",
            "Quarterly update of HUBZone map data from Census TIGER/Line and SBA sources", CronExpressions.QUARTERLY,
            Set.of("IMPORT_FAILED"), "newDesignations"),

    /**
     * Runs OCR over uploaded documents that are still pending extraction.
     * <p>
     * <b>Cadence:</b> Every 5 minutes
     * <p>
     * <b>Handler:</b> DocumentOcrSweepJobHandler
     * <p>
     * <b>Partial success:</b> accepted when the pending batch could be read and at least one document was processed
     */
    DOCUMENT_OCR_SWEEP("document-ocr-sweep", "Document OCR Sweep",
            "Batch OCR extraction for uploaded documents awaiting processing", "*/5 * * * *",
            Set.of("PENDING_QUERY_FAILED"), "processedDocuments");

    public static final int DEFAULT_MAX_RETRIES = 3;

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMinutes(1);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(2);

    private final String id;
    private final String displayName;
    private final String description;
    private final String defaultCron;
    private final Set<String> fatalErrorCodes;
    private final String progressStatistic;

    JobType(String id, String displayName, String description, String defaultCron, Set<String> fatalErrorCodes,
            String progressStatistic) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.defaultCron = defaultCron;
        this.fatalErrorCodes = fatalErrorCodes;
        this.progressStatistic = progressStatistic;
    }

    /**
     * Stable identifier stored in {@code job_executions.job_id} and used in configuration keys and URLs.
     */
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Default 5-field UNIX cron expression, evaluated in UTC.
     */
    public String getDefaultCron() {
        return defaultCron;
    }

    public Set<String> getFatalErrorCodes() {
        return fatalErrorCodes;
    }

    /**
     * Name of the {@link JobResult#statistics()} counter that measures forward progress.
     */
    public String getProgressStatistic() {
        return progressStatistic;
    }
}
