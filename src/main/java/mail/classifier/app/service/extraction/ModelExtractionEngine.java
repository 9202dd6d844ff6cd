package mail.classifier.app.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mail.classifier.app.config.MailClassifierProperties;
import mail.classifier.app.model.Category;
import mail.classifier.app.model.Classification;
import mail.classifier.app.model.ExtractionRequest;
import mail.classifier.app.model.InvoiceFields;
import mail.classifier.app.model.Priority;
import mail.classifier.app.model.RawExtraction;
import mail.classifier.app.model.RequestFields;
import mail.classifier.app.service.TicketNumberGenerator;
import mail.classifier.app.service.backend.GenerationBackend;
import mail.classifier.app.service.backend.GenerationBackend.GenerationRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model-backed classification and structured extraction.
 *
 * <p>Every call is seeded from (external id, trimmed text) so identical inputs replay
 * identically on a deterministic backend. Backend failures and unrecoverable output
 * propagate; the caller owns the fallback.
 */
@Slf4j
@Service
public class ModelExtractionEngine {
    private static final int MIN_MODEL_INVOICE_FIELDS = 2;

    private final StructuredOutputParser outputParser;
    private final ObjectMapper objectMapper;
    private final InvoiceRegexFallback invoiceRegexFallback;
    private final TicketNumberGenerator ticketNumberGenerator;
    private final MailClassifierProperties.Model settings;

    public ModelExtractionEngine(
            GenerationBackend generationBackend,
            ObjectMapper objectMapper,
            InvoiceRegexFallback invoiceRegexFallback,
            TicketNumberGenerator ticketNumberGenerator,
            MailClassifierProperties properties) {
        this.outputParser = new StructuredOutputParser(generationBackend, objectMapper);
        this.objectMapper = objectMapper;
        this.invoiceRegexFallback = invoiceRegexFallback;
        this.ticketNumberGenerator = ticketNumberGenerator;
        this.settings = properties.getModel();
    }

    public Classification classifyText(String text, String externalId) {
        long start = System.nanoTime();
        log.info("llm_classify_invoked externalId={} input_chars={} hash={}",
                orDash(externalId), text == null ? 0 : text.length(), DeterministicSeed.shortHash(text));

        String small = ExtractionText.trim(text, settings.getClassifyMaxChars());
        JsonNode data = outputParser.generateObject(request(
                settings.getClassifierModel(), small, ExtractionPrompts.CLASSIFY,
                OutputSchemas.classification(), externalId, settings.getNumPredict()));

        String categoryLabel = ExtractionText.titleCase(data.path("category").asText(""));
        String priorityLabel = ExtractionText.titleCase(data.path("priority").asText(""));
        Classification classification = new Classification(Category.coerce(categoryLabel), Priority.coerce(priorityLabel));

        log.info("llm_classify_complete externalId={} category={} priority={} elapsed_ms={}",
                orDash(externalId), classification.getCategory().getLabel(),
                classification.getPriority().getLabel(), elapsedMs(start));
        return classification;
    }

    public InvoiceFields extractInvoice(String text, String externalId) {
        long start = System.nanoTime();
        String big = ExtractionText.trim(text, settings.getExtractMaxChars());
        JsonNode data = outputParser.generateObject(request(
                settings.getInvoiceModel(), big, ExtractionPrompts.INVOICE,
                OutputSchemas.invoice(), externalId, settings.getInvoiceNumPredict()));

        InvoiceFields invoice = read(data, InvoiceFields.class);
        if (invoice.populatedCount() <= MIN_MODEL_INVOICE_FIELDS) {
            invoice = invoice.fillMissingFrom(invoiceRegexFallback.parse(big));
            log.info("llm_invoice_fallback_applied externalId={} fields_detected={}",
                    orDash(externalId), invoice.populatedCount());
        }

        log.info("llm_extract_invoice_complete externalId={} elapsed_ms={} fields_detected={}",
                orDash(externalId), elapsedMs(start), invoice.populatedCount());
        return invoice;
    }

    /**
     * Summary only; the ticket number is never taken from the model.
     */
    public RequestFields extractCustomerRequestSummary(String text, String externalId) {
        long start = System.nanoTime();
        String big = ExtractionText.trim(text, settings.getExtractMaxChars());
        JsonNode data = outputParser.generateObject(request(
                settings.getRequestModel(), big, ExtractionPrompts.REQUEST,
                OutputSchemas.requestSummary(), externalId, settings.getNumPredict()));

        String summary = data.path("summary").asText("").strip();
        log.info("llm_extract_request_complete externalId={} elapsed_ms={} summary_chars={}",
                orDash(externalId), elapsedMs(start), summary.length());
        return new RequestFields(summary, null);
    }

    /**
     * Classify a short view of the mail, then extract from the long view when the category needs it.
     * @throws IllegalArgumentException when the body text is blank
     */
    public RawExtraction runExtraction(ExtractionRequest request) {
        String body = request.getBodyText() == null ? "" : request.getBodyText().strip();
        if (body.isEmpty()) {
            throw new IllegalArgumentException("body_text is required for extraction");
        }
        String subject = request.getSubject() == null ? "" : request.getSubject().strip();
        String externalId = request.getExternalId() == null ? "" : request.getExternalId().strip();
        List<String> attachments = request.getAttachmentsText() == null ? List.of() : request.getAttachmentsText();

        String smallText = ExtractionText.composeEmailText(
                subject, ExtractionText.trim(body, settings.getClassifyMaxChars()), List.of());
        Classification classification = classifyText(smallText, externalId);
        log.info("llm_classification_done externalId={} body_sha={} category={} priority={} attachments={}",
                orDash(externalId), DeterministicSeed.shortHash(body), classification.getCategory().getLabel(),
                classification.getPriority().getLabel(), attachments.size());

        RawExtraction.RawExtractionBuilder out = RawExtraction.builder()
                .category(classification.getCategory().getLabel())
                .priority(classification.getPriority().getLabel());

        switch (classification.getCategory()) {
            case INVOICE:
                InvoiceFields invoice = extractInvoice(longText(subject, body, attachments), externalId);
                out.invoice(new LinkedHashMap<>(invoice.toMap()));
                break;
            case CUSTOMER_REQUESTS:
                RequestFields summary = extractCustomerRequestSummary(longText(subject, body, attachments), externalId);
                String ticket = ticketNumberGenerator.generate(request.getReceivedAt(), externalId);
                log.info("llm_request_extraction_done externalId={} ticket={}", orDash(externalId), ticket);
                Map<String, Object> requestMap = new LinkedHashMap<>();
                requestMap.put("summary", summary.getSummary());
                requestMap.put("ticket_number", ticket);
                out.request(requestMap);
                break;
            case GENERAL:
            case MISC:
            default:
                log.info("llm_no_extraction_needed externalId={} category={}",
                        orDash(externalId), classification.getCategory().getLabel());
                break;
        }

        RawExtraction result = out.build();
        log.info("llm_extraction_complete externalId={} category={} priority={}",
                orDash(externalId), result.getCategory(), result.getPriority());
        return result;
    }

    private String longText(String subject, String body, List<String> attachments) {
        int max = settings.getExtractMaxChars();
        List<String> trimmed = new ArrayList<>();
        for (String attachment : attachments) {
            if (attachment != null && !attachment.isBlank()) {
                trimmed.add(ExtractionText.trim(attachment, max));
            }
        }
        return ExtractionText.composeEmailText(subject, ExtractionText.trim(body, max), trimmed);
    }

    private GenerationRequest request(String model, String text, String instructions,
                                      JsonNode schema, String externalId, int numPredict) {
        return GenerationRequest.builder()
                .model(model)
                .prompt(text + "\n\n" + instructions)
                .schema(schema)
                .seed(DeterministicSeed.of(externalId, text))
                .temperature(settings.getTemperature())
                .numPredict(numPredict)
                .numCtx(settings.getNumCtx())
                .build();
    }

    private <T> T read(JsonNode data, Class<T> type) {
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedOutputException("Model output does not fit " + type.getSimpleName(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }
}
