package mail.classifier.app.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mail.classifier.app.service.backend.GenerationBackend;
import mail.classifier.app.service.backend.GenerationBackend.GenerationRequest;
import mail.classifier.app.service.backend.GenerationBackend.OutputMode;

import java.util.Optional;

/**
 * Gets a JSON object out of an unreliable backend.
 *
 * <ol>
 *   <li>schema-constrained request, parsed after stripping code fences</li>
 *   <li>on any failure, one generic-JSON request</li>
 *   <li>if that does not parse, the first balanced object/array inside the raw text</li>
 * </ol>
 * Backend errors on the second request propagate unchanged.
 */
@Slf4j
public class StructuredOutputParser {
    private final GenerationBackend backend;
    private final ObjectMapper objectMapper;

    public StructuredOutputParser(GenerationBackend backend, ObjectMapper objectMapper) {
        this.backend = backend;
        this.objectMapper = objectMapper;
    }

    public JsonNode generateObject(GenerationRequest request) {
        try {
            String raw = backend.generate(request.toBuilder().mode(OutputMode.SCHEMA).build());
            return readObject(JsonObjectScanner.stripCodeFences(raw));
        } catch (Exception e) {
            log.debug("Schema-constrained generation failed for model {}: {}", request.getModel(), e.getMessage());
        }

        String raw = JsonObjectScanner.stripCodeFences(
                backend.generate(request.toBuilder().mode(OutputMode.JSON).build()));
        try {
            return readObject(raw);
        } catch (JsonProcessingException | MalformedOutputException e) {
            Optional<String> embedded = JsonObjectScanner.firstComplete(raw);
            if (embedded.isEmpty()) {
                throw new MalformedOutputException("No JSON object in output of model " + request.getModel(), e);
            }
            log.info("Recovered embedded JSON from model {} output ({} of {} chars)",
                    request.getModel(), embedded.get().length(), raw.length());
            try {
                return readObject(embedded.get());
            } catch (JsonProcessingException inner) {
                throw new MalformedOutputException("Embedded JSON from model " + request.getModel() + " did not parse", inner);
            }
        }
    }

    private JsonNode readObject(String text) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(text);
        if (node == null || !node.isObject()) {
            throw new MalformedOutputException("Expected a JSON object but got: "
                    + (node == null ? "nothing" : node.getNodeType()));
        }
        return node;
    }
}
