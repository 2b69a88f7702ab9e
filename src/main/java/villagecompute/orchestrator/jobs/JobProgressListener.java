package villagecompute.orchestrator.jobs;

/**
 * Receives {@link JobProgressEvent}s published by a running handler.
 *
 * <p>
 * Listeners are invoked on the handler's attempt thread and must not block. Exceptions thrown by a listener are logged
 * by the {@link JobManager} and never reach the handler.
 */
@FunctionalInterface
public interface JobProgressListener {

    /**
     * Listener that drops every event.
     */
    JobProgressListener NONE = event -> {
    };

    void onProgress(JobProgressEvent event);
}
