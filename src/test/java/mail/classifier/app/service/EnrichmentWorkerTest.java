package mail.classifier.app.service;

import mail.classifier.app.config.MailClassifierProperties;
import mail.classifier.app.model.EnrichmentOutcome;
import mail.classifier.app.model.EnrichmentOutcome.Status;
import mail.classifier.app.model.EnrichmentResult;
import mail.classifier.app.model.ExtractionRequest;
import mail.classifier.app.model.MailMessage;
import mail.classifier.app.model.RawExtraction;
import mail.classifier.app.service.backend.GenerationBackend.GenerationException;
import mail.classifier.app.service.extraction.ModelExtractionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnrichmentWorkerTest {

    @Mock
    private ModelExtractionEngine modelExtractionEngine;

    @Mock
    private RecordStore recordStore;

    private EnrichmentWorker worker;
    private BatchProgress progress;
    private MailMessage invoiceMail;

    @BeforeEach
    void setUp() {
        worker = new EnrichmentWorker(
                new HeuristicClassifier(new MailClassifierProperties()),
                modelExtractionEngine,
                new EnrichmentFlattener(),
                recordStore);
        progress = new BatchProgress("batch-test", 1);
        invoiceMail = MailMessage.builder()
                .externalId("AAMk-inv-001")
                .subject("URGENT invoice INV-42")
                .bodyText("Please pay $99.00 by Friday.")
                .attachmentText("Invoice No: INV-42\nTotal: $99.00")
                .receivedAt("2025-08-27T06:50:00Z")
                .build();
    }

    @Test
    void enrich_WhenModelSucceeds_ShouldPatchFlattenedInvoice() {
        // Given
        when(modelExtractionEngine.runExtraction(any())).thenReturn(RawExtraction.builder()
                .category("Invoice")
                .priority("High")
                .invoice(Map.of("invoice_number", "INV-42", "invoice_amount", "$99.00"))
                .build());
        when(recordStore.patchRecord(eq("AAMk-inv-001"), any())).thenReturn(true);

        // When
        EnrichmentOutcome outcome = worker.enrich(invoiceMail, progress);

        // Then
        assertEquals(Status.SUCCESS, outcome.getStatus());
        ArgumentCaptor<EnrichmentResult> captor = ArgumentCaptor.forClass(EnrichmentResult.class);
        verify(recordStore).patchRecord(eq("AAMk-inv-001"), captor.capture());
        assertEquals("Invoice", captor.getValue().getCategory());
        assertEquals("INV-42", captor.getValue().getFields().get("invoice_number"));
        assertEquals(11, captor.getValue().getFields().size());
        assertEquals(1, progress.getProcessed());
    }

    @Test
    void enrich_ShouldSendCombinedSubjectBodyAndAttachmentText() {
        // Given
        when(modelExtractionEngine.runExtraction(any()))
                .thenReturn(RawExtraction.builder().category("General").priority("Low").build());
        when(recordStore.patchRecord(any(), any())).thenReturn(true);

        // When
        worker.enrich(invoiceMail, progress);

        // Then
        ArgumentCaptor<ExtractionRequest> captor = ArgumentCaptor.forClass(ExtractionRequest.class);
        verify(modelExtractionEngine).runExtraction(captor.capture());
        ExtractionRequest sent = captor.getValue();
        assertEquals("AAMk-inv-001", sent.getExternalId());
        assertEquals("2025-08-27T06:50:00Z", sent.getReceivedAt());
        assertEquals("Subject: URGENT invoice INV-42\n\nPlease pay $99.00 by Friday.\n\n"
                + "--- Attachment text ---\nInvoice No: INV-42\nTotal: $99.00", sent.getBodyText());
    }

    @Test
    void enrich_WhenModelFails_ShouldPatchHeuristicLabelsAsDegraded() {
        // Given
        when(modelExtractionEngine.runExtraction(any())).thenThrow(new GenerationException("read timed out"));
        when(recordStore.patchRecord(eq("AAMk-inv-001"), any())).thenReturn(true);

        // When
        EnrichmentOutcome outcome = worker.enrich(invoiceMail, progress);

        // Then
        assertEquals(Status.DEGRADED, outcome.getStatus());
        assertTrue(outcome.getReason().contains("read timed out"));
        ArgumentCaptor<EnrichmentResult> captor = ArgumentCaptor.forClass(EnrichmentResult.class);
        verify(recordStore).patchRecord(eq("AAMk-inv-001"), captor.capture());
        assertEquals("Invoice", captor.getValue().getCategory());
        assertEquals("High", captor.getValue().getPriority());
        assertTrue(captor.getValue().getFields().isEmpty());
        assertEquals(1, progress.getProcessed());
    }

    @Test
    void enrich_WhenBodyMissing_ShouldFallBackToo() {
        // Given
        MailMessage empty = MailMessage.builder().externalId("AAMk-empty").build();
        when(modelExtractionEngine.runExtraction(any()))
                .thenThrow(new IllegalArgumentException("body_text is required for extraction"));
        when(recordStore.patchRecord(eq("AAMk-empty"), any())).thenReturn(true);

        // When
        EnrichmentOutcome outcome = worker.enrich(empty, progress);

        // Then
        assertEquals(Status.DEGRADED, outcome.getStatus());
        assertEquals("General", outcome.getResult().getCategory());
        assertEquals("Low", outcome.getResult().getPriority());
    }

    @Test
    void enrich_WhenPatchRejected_ShouldReportFailedButCountProgress() {
        when(modelExtractionEngine.runExtraction(any()))
                .thenReturn(RawExtraction.builder().category("Misc").priority("Low").build());
        when(recordStore.patchRecord(any(), any())).thenReturn(false);

        EnrichmentOutcome outcome = worker.enrich(invoiceMail, progress);

        assertEquals(Status.FAILED, outcome.getStatus());
        assertEquals("Misc", outcome.getResult().getCategory());
        assertEquals(1, progress.getProcessed());
    }

    @Test
    void enrich_WhenPatchThrows_ShouldNotPropagate() {
        when(modelExtractionEngine.runExtraction(any()))
                .thenReturn(RawExtraction.builder().category("Misc").priority("Low").build());
        when(recordStore.patchRecord(any(), any())).thenThrow(new IllegalStateException("db down"));

        EnrichmentOutcome outcome = assertDoesNotThrow(() -> worker.enrich(invoiceMail, progress));

        assertEquals(Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getReason().contains("db down"));
    }

    @Test
    void enrich_WithoutExternalId_ShouldSkipButCountProgress() {
        MailMessage anonymous = MailMessage.builder().subject("no id").attachmentNames(List.of()).build();

        EnrichmentOutcome outcome = worker.enrich(anonymous, progress);

        assertEquals(Status.FAILED, outcome.getStatus());
        assertEquals(1, progress.getProcessed());
        verifyNoInteractions(modelExtractionEngine, recordStore);
    }

    @Test
    void enrich_ShouldClearExternalIdFromMdcAfterwards() {
        when(modelExtractionEngine.runExtraction(any())).thenThrow(new RuntimeException("boom"));
        when(recordStore.patchRecord(any(), any())).thenReturn(true);

        worker.enrich(invoiceMail, progress);

        assertNull(MDC.get(EnrichmentWorker.MDC_EXTERNAL_ID));
    }

    @Test
    void combinedText_WithOnlyPreview_ShouldUsePreviewAsBody() {
        MailMessage mail = MailMessage.builder().subject("  Hello ").bodyPreview("short preview").build();

        assertEquals("Subject: Hello\n\nshort preview", EnrichmentWorker.combinedText(mail));
    }
}
