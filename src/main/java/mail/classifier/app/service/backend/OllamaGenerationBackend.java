package mail.classifier.app.service.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Ollama {@code /api/generate} backend.
 * Schema mode sends the JSON schema as {@code format}; JSON mode sends {@code "json"}.
 */
@Slf4j
public class OllamaGenerationBackend implements GenerationBackend {
    private static final String GENERATE_PATH = "/api/generate";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String keepAlive;

    public OllamaGenerationBackend(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String keepAlive) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        this.keepAlive = keepAlive;

        if (this.baseUrl.isEmpty()) {
            log.warn("Ollama base URL not configured. Set mail.classifier.model.base-url.");
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    @Override
    public String generate(GenerationRequest request) {
        if (baseUrl.isEmpty()) {
            throw new GenerationException("Ollama base URL not configured");
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> options = new HashMap<>();
            options.put("temperature", request.getTemperature());
            options.put("num_predict", request.getNumPredict());
            options.put("num_ctx", request.getNumCtx());
            options.put("top_p", 1);
            options.put("mirostat", 0);
            if (request.getSeed() != null) {
                options.put("seed", request.getSeed());
            }

            Map<String, Object> requestBody = new HashMap<>();
            requestBody.put("model", request.getModel());
            requestBody.put("prompt", request.getPrompt());
            requestBody.put("stream", false);
            requestBody.put("keep_alive", keepAlive);
            requestBody.put("options", options);
            if (request.getMode() == OutputMode.SCHEMA && request.getSchema() != null) {
                requestBody.put("format", request.getSchema());
            } else {
                requestBody.put("format", "json");
            }

            HttpEntity<Map<String, Object>> entity = new HttpEntity<>(requestBody, headers);
            ResponseEntity<String> response = restTemplate.postForEntity(baseUrl + GENERATE_PATH, entity, String.class);

            if (response.getStatusCode().is2xxSuccessful() && response.getBody() != null) {
                JsonNode json = objectMapper.readTree(response.getBody());
                JsonNode text = json.get("response");
                if (text != null && text.isTextual()) {
                    return text.asText();
                }
                throw new GenerationException("Unexpected Ollama response format: " + abbreviate(response.getBody()));
            }
            throw new GenerationException("Ollama error: " + response.getStatusCode() + " - " + abbreviate(response.getBody()));
        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException("Ollama call failed for model " + request.getModel() + ": " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "<empty>";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
