package mail.classifier.app.controller;

import mail.classifier.app.config.MailClassifierProperties;
import mail.classifier.app.service.backend.GenerationBackend;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {
    private final MailClassifierProperties properties;
    private final GenerationBackend generationBackend;

    public HealthController(MailClassifierProperties properties, GenerationBackend generationBackend) {
        this.properties = properties;
        this.generationBackend = generationBackend;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("workers", properties.getWorkers());
        body.put("provider", generationBackend.getProviderName());
        body.put("slowStoreMs", properties.getSlowStoreMs());
        body.put("previewChars", properties.getPreviewChars());
        return body;
    }
}
