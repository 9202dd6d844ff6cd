package mail.classifier.app.controller;

import lombok.extern.slf4j.Slf4j;
import mail.classifier.app.model.IngestionSummary;
import mail.classifier.app.model.MailMessage;
import mail.classifier.app.service.MailIngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Entry point for an ingestion pass over mails already fetched by the caller.
 */
@Slf4j
@RestController
@RequestMapping("/api/mails")
public class MailIngestionController {
    private final MailIngestionService mailIngestionService;

    public MailIngestionController(MailIngestionService mailIngestionService) {
        this.mailIngestionService = mailIngestionService;
    }

    /**
     * Stores each mail and queues its enrichment. Responds once every mail is queued.
     */
    @PostMapping
    public ResponseEntity<?> ingest(@RequestBody List<MailMessage> mails) {
        try {
            IngestionSummary summary = mailIngestionService.ingest(mails);
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            log.error("Ingestion failed: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(Map.of("ok", false, "error", String.valueOf(e.getMessage())));
        }
    }
}
