package villagecompute.orchestrator.jobs;

import java.util.Map;

/**
 * Contract for scheduled job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement this interface. The
 * {@link villagecompute.orchestrator.services.JobRegistry} discovers handlers at startup, builds one
 * {@link JobDefinition} per {@link JobType} and hands each to its own {@link JobManager}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>A handler runs on its manager's attempt thread. A timed-out attempt is only interrupted, so a handler that
 * ignores the interrupt may still be running when the next attempt or run starts</li>
 * <li>An attempt that throws, times out, or returns a result with a fatal error code is retried with linear backoff
 * ({@code retryDelay * attempt}) up to {@code maxRetries} times</li>
 * <li>A failed result without fatal errors but with forward progress is accepted as a partial success</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class HubzoneMapUpdateJobHandler implements JobHandler {
 *     @Override
 *     public JobType handlesType() {
 *         return JobType.HUBZONE_MAP_UPDATE;
 *     }
 *
 *     @Override
 *     public JobResult execute(Map<String, Object> options, JobProgressListener progress) throws Exception {
 *         // Download and import map data...
 *     }
 * }
 * }</pre>
 *
 * @see JobManager for the retry protocol
 * @see JobType for the job catalogue
 */
public interface JobHandler {

    /**
     * Returns the job type this handler implements.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Performs one attempt of the job.
     *
     * <p>
     * <b>Interruption:</b> When the per-attempt timeout expires the attempt thread is interrupted. Handlers doing
     * blocking I/O should let {@link InterruptedException} propagate.
     *
     * @param options
     *            trigger options (empty for scheduled runs), e.g. {@code dry_run}, {@code states}
     * @param progress
     *            channel for progress events, never null
     * @return the attempt outcome
     * @throws Exception
     *             any error during execution; counts as a failed attempt and triggers the retry logic
     */
    JobResult execute(Map<String, Object> options, JobProgressListener progress) throws Exception;
}
