package mail.classifier.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.classifier.app.config.MailClassifierProperties;
import mail.classifier.app.model.IngestionSummary;
import mail.classifier.app.model.IngestionSummary.MailDetail;
import mail.classifier.app.model.IngestionSummary.TextPreview;
import mail.classifier.app.model.MailMessage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Two-phase ingestion of already-fetched mails.
 *
 * Phase 1 runs on the caller's thread: an idempotent minimal insert per mail.
 * Phase 2 is queued on the bounded enrichment pool whatever Phase 1 returned.
 * The summary is returned without waiting for enrichment.
 */
@Slf4j
@Service
public class MailIngestionService {
    private static final int SUBJECT_PREVIEW_CHARS = 120;

    private final RecordStore recordStore;
    private final EnrichmentWorker enrichmentWorker;
    private final Executor enrichmentExecutor;
    private final MailClassifierProperties properties;

    public MailIngestionService(
            RecordStore recordStore,
            EnrichmentWorker enrichmentWorker,
            @Qualifier("enrichmentExecutor") Executor enrichmentExecutor,
            MailClassifierProperties properties) {
        this.recordStore = recordStore;
        this.enrichmentWorker = enrichmentWorker;
        this.enrichmentExecutor = enrichmentExecutor;
        this.properties = properties;
    }

    public IngestionSummary ingest(List<MailMessage> mails) {
        List<MailMessage> batch = mails == null ? List.of() : mails;
        List<MailMessage> valid = new ArrayList<>(batch.size());
        int failed = 0;
        for (int i = 0; i < batch.size(); i++) {
            if (batch.get(i) == null) {
                log.error("Skipping null mail at index {}", i);
                failed++;
            } else {
                valid.add(batch.get(i));
            }
        }

        BatchProgress progress = new BatchProgress(UUID.randomUUID().toString(), valid.size());
        log.info("Ingestion started batch={} fetched={}", progress.getBatchId(), batch.size());

        int createdOrSkipped = 0;
        int queued = 0;
        List<MailDetail> details = new ArrayList<>();

        for (MailMessage mail : valid) {
            String externalId = mail.getExternalId();
            String subject = truncate(mail.getSubject(), SUBJECT_PREVIEW_CHARS);
            log.info("mail_begin externalId={} subject={}", externalId, subject);

            long start = System.nanoTime();
            boolean created = createQuietly(mail);
            long createMs = (System.nanoTime() - start) / 1_000_000;
            if (createMs > properties.getSlowStoreMs()) {
                log.warn("slow_store_create externalId={} elapsed_ms={}", externalId, createMs);
            }
            if (created) {
                createdOrSkipped++;
                log.info("store_create_or_skip_ok externalId={} elapsed_ms={}", externalId, createMs);
            } else {
                failed++;
                log.error("store_create_failed externalId={} elapsed_ms={}", externalId, createMs);
            }

            try {
                enrichmentExecutor.execute(() -> enrichmentWorker.enrich(mail, progress));
                queued++;
                log.info("enrichment_queued externalId={} attachments_count={} attachment_methods={}",
                        externalId, sizeOf(mail.getAttachmentNames()), mail.getAttachmentMethods());
            } catch (RejectedExecutionException e) {
                log.error("Enrichment pool rejected externalId={}: {}", externalId, e.getMessage());
            }

            details.add(MailDetail.builder()
                    .externalId(externalId)
                    .subject(subject)
                    .bodyText(TextPreview.of(mail.resolveBody(), properties.getPreviewChars()))
                    .attachmentText(TextPreview.of(mail.getAttachmentText(), properties.getPreviewChars()))
                    .attachmentsCount(sizeOf(mail.getAttachmentNames()))
                    .attachmentMethods(mail.getAttachmentMethods() == null ? List.of() : mail.getAttachmentMethods())
                    .createdOrSkipped(created)
                    .storeCreateMs(createMs)
                    .build());
        }

        log.info("Ingestion finished batch={} created_or_skipped={} queued={} failed={}",
                progress.getBatchId(), createdOrSkipped, queued, failed);
        return IngestionSummary.builder()
                .ok(true)
                .fetched(batch.size())
                .createdOrSkipped(createdOrSkipped)
                .queued(queued)
                .failed(failed)
                .details(details)
                .build();
    }

    private boolean createQuietly(MailMessage mail) {
        try {
            return recordStore.createRecord(mail);
        } catch (Exception e) {
            log.error("Record create threw for externalId={}: {}", mail.getExternalId(), e.getMessage(), e);
            return false;
        }
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
