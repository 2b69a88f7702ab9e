package villagecompute.orchestrator.integration.ocr;

/**
 * Result of extracting one document.
 *
 * @param confidence
 *            overall extraction confidence, 0-100
 * @param message
 *            failure reason or review hint, may be null
 */
public record OcrOutcome(String documentId, Status status, double confidence, String message) {

    public enum Status {
        COMPLETED,

        /**
         * Extracted with low confidence, needs a human check.
         */
        REQUIRES_REVIEW,

        FAILED
    }
}
