package mail.classifier.app.service;

import mail.classifier.app.config.MailClassifierProperties;
import mail.classifier.app.model.IngestionSummary;
import mail.classifier.app.model.MailMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MailIngestionServiceTest {

    @Mock
    private RecordStore recordStore;

    @Mock
    private EnrichmentWorker enrichmentWorker;

    private MailClassifierProperties properties;
    private MailIngestionService service;

    @BeforeEach
    void setUp() {
        properties = new MailClassifierProperties();
        properties.setPreviewChars(10);
        Executor sameThread = Runnable::run;
        service = new MailIngestionService(recordStore, enrichmentWorker, sameThread, properties);
    }

    @Test
    void ingest_ShouldCreateThenQueueEveryMail() {
        // Given
        MailMessage first = MailMessage.builder().externalId("m-1").subject("Invoice 1")
                .bodyText("Please pay the attached invoice").attachmentNames(List.of("inv.pdf"))
                .attachmentMethods(List.of("pdf_text")).build();
        MailMessage second = MailMessage.builder().externalId("m-2").subject("Hello").bodyPreview("hi").build();
        when(recordStore.createRecord(any())).thenReturn(true);

        // When
        IngestionSummary summary = service.ingest(List.of(first, second));

        // Then
        assertTrue(summary.isOk());
        assertEquals(2, summary.getFetched());
        assertEquals(2, summary.getCreatedOrSkipped());
        assertEquals(2, summary.getQueued());
        assertEquals(2, summary.getDetails().size());
        verify(enrichmentWorker).enrich(eq(first), argThat(p -> p.getTotal() == 2));
        verify(enrichmentWorker).enrich(eq(second), any());

        IngestionSummary.MailDetail detail = summary.getDetails().get(0);
        assertEquals("m-1", detail.getExternalId());
        assertEquals(1, detail.getAttachmentsCount());
        assertEquals(List.of("pdf_text"), detail.getAttachmentMethods());
        assertTrue(detail.isCreatedOrSkipped());
        assertEquals(31, detail.getBodyText().getLen());
        assertTrue(detail.getBodyText().getPreview().startsWith("Please pay"));
    }

    @Test
    void ingest_WhenCreateFails_ShouldStillQueueEnrichment() {
        // Given
        MailMessage mail = MailMessage.builder().externalId("m-3").subject("x").bodyText("y").build();
        when(recordStore.createRecord(mail)).thenThrow(new IllegalStateException("db down"));

        // When
        IngestionSummary summary = service.ingest(List.of(mail));

        // Then
        assertEquals(0, summary.getCreatedOrSkipped());
        assertEquals(1, summary.getQueued());
        assertEquals(1, summary.getFailed());
        assertFalse(summary.getDetails().get(0).isCreatedOrSkipped());
        verify(enrichmentWorker).enrich(eq(mail), any());
    }

    @Test
    void ingest_WithNullEntry_ShouldSkipItAndCountAsFailed() {
        // Given
        MailMessage mail = MailMessage.builder().externalId("m-5").subject("Hello").bodyText("hi").build();
        when(recordStore.createRecord(mail)).thenReturn(true);

        // When
        IngestionSummary summary = service.ingest(Arrays.asList(null, mail, null));

        // Then
        assertTrue(summary.isOk());
        assertEquals(3, summary.getFetched());
        assertEquals(1, summary.getCreatedOrSkipped());
        assertEquals(1, summary.getQueued());
        assertEquals(2, summary.getFailed());
        assertEquals(1, summary.getDetails().size());
        assertEquals("m-5", summary.getDetails().get(0).getExternalId());
        verify(recordStore, times(1)).createRecord(any());
        verify(enrichmentWorker).enrich(eq(mail), argThat(p -> p.getTotal() == 1));
    }

    @Test
    void ingest_WhenPoolRejects_ShouldNotCountAsQueued() {
        // Given
        Executor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };
        MailIngestionService saturated = new MailIngestionService(recordStore, enrichmentWorker, rejecting, properties);
        when(recordStore.createRecord(any())).thenReturn(true);

        // When
        IngestionSummary summary = saturated.ingest(List.of(MailMessage.builder().externalId("m-4").build()));

        // Then
        assertEquals(1, summary.getCreatedOrSkipped());
        assertEquals(0, summary.getQueued());
        verifyNoInteractions(enrichmentWorker);
    }

    @Test
    void ingest_WithEmptyOrNullBatch_ShouldReturnEmptySummary() {
        IngestionSummary empty = service.ingest(List.of());
        IngestionSummary none = service.ingest(null);

        assertTrue(empty.isOk());
        assertEquals(0, empty.getFetched());
        assertEquals(0, none.getQueued());
        verifyNoInteractions(recordStore, enrichmentWorker);
    }
}
