package mail.classifier.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import mail.classifier.app.service.backend.GenerationBackend;
import mail.classifier.app.service.backend.OllamaGenerationBackend;
import mail.classifier.app.service.backend.OpenAiGenerationBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Switches between generation providers.
 * Set mail.classifier.model.provider=ollama or mail.classifier.model.provider=openai in application.properties
 */
@Configuration
public class GenerationBackendConfig {

    @Bean
    @ConditionalOnProperty(name = "mail.classifier.model.provider", havingValue = "ollama", matchIfMissing = true)
    public GenerationBackend ollamaGenerationBackend(
            RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper, MailClassifierProperties properties) {
        MailClassifierProperties.Model model = properties.getModel();
        return new OllamaGenerationBackend(
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofSeconds(10))
                        .setReadTimeout(model.getTimeout())
                        .build(),
                objectMapper,
                model.getBaseUrl(),
                model.getKeepAlive());
    }

    @Bean
    @ConditionalOnProperty(name = "mail.classifier.model.provider", havingValue = "openai")
    public GenerationBackend openAiGenerationBackend(MailClassifierProperties properties) {
        MailClassifierProperties.Model model = properties.getModel();
        return new OpenAiGenerationBackend(new OpenAiService(model.getApiKey(), model.getTimeout()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
