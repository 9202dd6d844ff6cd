package mail.classifier.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.classifier.app.model.Classification;
import mail.classifier.app.model.EnrichmentOutcome;
import mail.classifier.app.model.EnrichmentResult;
import mail.classifier.app.model.ExtractionRequest;
import mail.classifier.app.model.MailMessage;
import mail.classifier.app.model.RawExtraction;
import mail.classifier.app.service.extraction.ModelExtractionEngine;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Phase-2 enrichment of one mail: soft classify, model extraction (heuristic fallback on
 * any failure), flatten, patch the stored record, count progress.
 * Never throws; every mail ends patched or logged as failed.
 */
@Slf4j
@Service
public class EnrichmentWorker {
    static final String MDC_EXTERNAL_ID = "externalId";

    private final HeuristicClassifier heuristicClassifier;
    private final ModelExtractionEngine modelExtractionEngine;
    private final EnrichmentFlattener enrichmentFlattener;
    private final RecordStore recordStore;

    public EnrichmentWorker(
            HeuristicClassifier heuristicClassifier,
            ModelExtractionEngine modelExtractionEngine,
            EnrichmentFlattener enrichmentFlattener,
            RecordStore recordStore) {
        this.heuristicClassifier = heuristicClassifier;
        this.modelExtractionEngine = modelExtractionEngine;
        this.enrichmentFlattener = enrichmentFlattener;
        this.recordStore = recordStore;
    }

    public EnrichmentOutcome enrich(MailMessage mail, BatchProgress progress) {
        String externalId = mail == null ? null : mail.getExternalId();
        if (externalId == null || externalId.isBlank()) {
            log.warn("Enrichment skipped: mail has no external id");
            progress.markProcessed();
            return EnrichmentOutcome.failed("missing external id");
        }

        MDC.put(MDC_EXTERNAL_ID, externalId);
        try {
            softClassify(mail);
            EnrichmentOutcome outcome = extract(mail);
            outcome = patch(externalId, outcome);
            progress.markProcessed();
            return outcome;
        } finally {
            MDC.remove(MDC_EXTERNAL_ID);
        }
    }

    private void softClassify(MailMessage mail) {
        try {
            Classification soft = heuristicClassifier.classify(mail);
            log.info("[SOFT CLASSIFICATION] externalId={} category={}, priority={}",
                    mail.getExternalId(), soft.getCategory().getLabel(), soft.getPriority().getLabel());
        } catch (Exception e) {
            log.error("Soft classification failed for externalId={}", mail.getExternalId(), e);
        }
    }

    private EnrichmentOutcome extract(MailMessage mail) {
        String textBlob = combinedText(mail);
        log.info("worker_payload_built externalId={} received_at={} body_len={}",
                mail.getExternalId(), mail.getReceivedAt(), textBlob.length());

        try {
            RawExtraction raw = modelExtractionEngine.runExtraction(ExtractionRequest.builder()
                    .externalId(mail.getExternalId())
                    .subject(mail.getSubject())
                    .bodyText(textBlob)
                    .receivedAt(mail.getReceivedAt())
                    .build());
            EnrichmentResult result = enrichmentFlattener.flatten(raw);
            log.info("[EXTRACTOR OK] externalId={} keys={}", mail.getExternalId(), populatedKeys(result));
            return EnrichmentOutcome.success(result);
        } catch (Exception e) {
            log.error("[EXTRACTOR FAIL] externalId={} falling back to keyword classifier: {}",
                    mail.getExternalId(), e.getMessage(), e);
            Classification fallback = heuristicClassifier.classify(mail);
            return EnrichmentOutcome.degraded(EnrichmentResult.of(fallback), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private EnrichmentOutcome patch(String externalId, EnrichmentOutcome outcome) {
        switch (outcome.getStatus()) {
            case SUCCESS:
            case DEGRADED:
                boolean ok;
                try {
                    ok = recordStore.patchRecord(externalId, outcome.getResult());
                } catch (Exception e) {
                    log.error("[ENRICH PATCH FAIL] externalId={}: {}", externalId, e.getMessage(), e);
                    return outcome.patchFailed("patch error: " + e.getMessage());
                }
                if (!ok) {
                    log.error("[ENRICH PATCH FAIL] externalId={}", externalId);
                    return outcome.patchFailed("patch rejected by store");
                }
                log.info("[ENRICH PATCH OK] externalId={} status={}", externalId, outcome.getStatus());
                return outcome;
            case FAILED:
                log.error("Enrichment failed for externalId={}: {}", externalId, outcome.getReason());
                return outcome;
            default:
                throw new IllegalStateException("Unknown outcome " + outcome.getStatus());
        }
    }

    /**
     * Subject, body (full text, else plain body, else preview) and attachment text, blank-line separated.
     */
    static String combinedText(MailMessage mail) {
        List<String> parts = new ArrayList<>();
        String subject = mail.getSubject() == null ? "" : mail.getSubject().strip();
        if (!subject.isEmpty()) {
            parts.add("Subject: " + subject);
        }
        String body = mail.resolveBody();
        if (!body.isEmpty()) {
            parts.add(body);
        }
        String attachmentText = mail.getAttachmentText();
        if (attachmentText != null && !attachmentText.isEmpty()) {
            parts.add("--- Attachment text ---\n" + attachmentText);
        }
        return String.join("\n\n", parts).strip();
    }

    private static TreeSet<String> populatedKeys(EnrichmentResult result) {
        TreeSet<String> keys = new TreeSet<>();
        result.asMap().forEach((key, value) -> {
            if (value != null) {
                keys.add(key);
            }
        });
        return keys;
    }
}
