package villagecompute.orchestrator.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.orchestrator.integration.ocr.DocumentOcrProcessor;
import villagecompute.orchestrator.integration.ocr.OcrOutcome;
import villagecompute.orchestrator.integration.ocr.PendingDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Sweeps uploaded documents awaiting OCR.
 *
 * <p>
 * Each sweep reads one batch of pending documents and extracts them one by one. A document that fails is recorded as
 * a non-fatal {@code OCR_FAILED} error and the sweep moves on; failing to read the batch is the fatal
 * {@code PENDING_QUERY_FAILED}.
 *
 * <p>
 * <b>Options:</b> {@code batch_size} overrides {@code orchestrator.ocr.batch-size}.
 */
@ApplicationScoped
public class DocumentOcrSweepJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(DocumentOcrSweepJobHandler.class);

    static final String OPTION_BATCH_SIZE = "batch_size";

    static final String PENDING_QUERY_FAILED = "PENDING_QUERY_FAILED";
    static final String OCR_FAILED = "OCR_FAILED";
    static final String OCR_REVIEW_REQUIRED = "OCR_REVIEW_REQUIRED";

    @Inject
    DocumentOcrProcessor ocrProcessor;

    @ConfigProperty(
            name = "orchestrator.ocr.batch-size",
            defaultValue = "5")
    int batchSize;

    @Override
    public JobType handlesType() {
        return JobType.DOCUMENT_OCR_SWEEP;
    }

    @Override
    public JobResult execute(Map<String, Object> options, JobProgressListener progress) throws Exception {
        String sweepId = "ocr-sweep-" + UUID.randomUUID();
        int limit = JobOptions.integer(options, OPTION_BATCH_SIZE, batchSize);

        List<PendingDocument> pending;
        try {
            pending = ocrProcessor.findPendingDocuments(limit);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            LOG.errorf(e, "Failed to read pending documents for sweep %s", sweepId);
            return JobResult.failed(sweepId, statistics(0, 0, 0, 0),
                    List.of(JobIssue.of(PENDING_QUERY_FAILED, "Failed to read pending documents: " + e.getMessage())));
        }

        if (pending.isEmpty()) {
            LOG.debugf("No documents pending OCR (sweep %s)", sweepId);
            return JobResult.succeeded(sweepId, statistics(0, 0, 0, 0), 0);
        }

        long processed = 0;
        long requiringReview = 0;
        long failed = 0;
        List<JobIssue> errors = new ArrayList<>();
        List<JobIssue> warnings = new ArrayList<>();

        for (int i = 0; i < pending.size(); i++) {
            PendingDocument document = pending.get(i);
            progress.onProgress(new JobProgressEvent("ocr", document.fileName(), i * 100 / pending.size()));
            try {
                OcrOutcome outcome = ocrProcessor.process(document);
                switch (outcome.status()) {
                    case COMPLETED -> processed++;
                    case REQUIRES_REVIEW -> {
                        processed++;
                        requiringReview++;
                        warnings.add(new JobIssue(OCR_REVIEW_REQUIRED,
                                String.format(Locale.ROOT, "Confidence %.1f%% below review threshold",
                                        outcome.confidence()),
                                document.documentId()));
                    }
                    case FAILED -> {
                        failed++;
                        errors.add(new JobIssue(OCR_FAILED,
                                outcome.message() == null ? "OCR extraction failed" : outcome.message(),
                                document.documentId()));
                    }
                }
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                LOG.warnf(e, "OCR failed for document %s", document.documentId());
                failed++;
                errors.add(new JobIssue(OCR_FAILED, e.getMessage(), document.documentId()));
            }
        }
        progress.onProgress(new JobProgressEvent("ocr", pending.size() + " documents", 100));

        LOG.infof("OCR sweep %s finished: %d processed, %d requiring review, %d failed", sweepId, processed,
                requiringReview, failed);
        return new JobResult(sweepId, failed == 0, statistics(pending.size(), processed, requiringReview, failed),
                processed, errors, warnings);
    }

    private static Map<String, Long> statistics(long pending, long processed, long requiringReview, long failed) {
        Map<String, Long> statistics = new LinkedHashMap<>();
        statistics.put("pendingDocuments", pending);
        statistics.put("processedDocuments", processed);
        statistics.put("requiringReview", requiringReview);
        statistics.put("failedDocuments", failed);
        return statistics;
    }
}
