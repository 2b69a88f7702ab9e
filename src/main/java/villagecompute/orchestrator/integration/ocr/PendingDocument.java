package villagecompute.orchestrator.integration.ocr;

import java.time.Instant;

/**
 * Uploaded document awaiting OCR.
 */
public record PendingDocument(String documentId, String fileName, String mimeType, Instant uploadedAt) {
}
