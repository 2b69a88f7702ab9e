package villagecompute.orchestrator.integration.ocr;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * Active when no {@link DocumentOcrProcessor} implementation is deployed.
 */
@ApplicationScoped
@DefaultBean
public class UnconfiguredDocumentOcrProcessor implements DocumentOcrProcessor {

    @Override
    public List<PendingDocument> findPendingDocuments(int limit) {
        throw new IllegalStateException("No DocumentOcrProcessor implementation is configured");
    }

    @Override
    public OcrOutcome process(PendingDocument document) {
        throw new IllegalStateException("No DocumentOcrProcessor implementation is configured");
    }
}
