package villagecompute.orchestrator.jobs;

/**
 * Progress notice emitted by a handler while it runs.
 *
 * @param stage
 *            handler-defined stage name ("downloading", "importing", "ocr")
 * @param detail
 *            what is being worked on right now (a state code, a document id), may be null
 * @param percentComplete
 *            0-100, or -1 when the handler cannot estimate it
 */
public record JobProgressEvent(String stage, String detail, int percentComplete) {
}
