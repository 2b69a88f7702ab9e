package villagecompute.orchestrator.integration.ocr;

import java.util.List;

/**
 * Text extraction for uploaded compliance documents.
 *
 * <p>
 * Deployments provide an implementation bean; until then {@link UnconfiguredDocumentOcrProcessor} is active.
 */
public interface DocumentOcrProcessor {

    /**
     * Documents waiting for extraction, oldest first.
     *
     * @param limit
     *            maximum number of documents
     */
    List<PendingDocument> findPendingDocuments(int limit) throws Exception;

    /**
     * Extracts one document and stores the outcome.
     */
    OcrOutcome process(PendingDocument document) throws Exception;
}
