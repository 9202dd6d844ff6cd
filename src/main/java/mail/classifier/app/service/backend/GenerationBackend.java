package mail.classifier.app.service.backend;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Text-generation backend used by the extraction engine.
 * Implementations may bound call duration; they never retry on their own.
 */
public interface GenerationBackend {

    /**
     * Raised when the backend is unreachable, times out or answers with an error.
     */
    class GenerationException extends RuntimeException {
        public GenerationException(String message, Throwable cause) {
            super(message, cause);
        }

        public GenerationException(String message) {
            super(message);
        }
    }

    enum OutputMode {
        /** Output constrained by the request's JSON schema. */
        SCHEMA,
        /** Any well-formed JSON. */
        JSON
    }

    @Value
    @Builder(toBuilder = true)
    class GenerationRequest {
        String model;
        String prompt;
        JsonNode schema;
        Long seed;
        OutputMode mode;
        double temperature;
        int numPredict;
        int numCtx;
    }

    /**
     * Issue one generation request.
     * @return the raw response text, possibly not valid JSON
     * @throws GenerationException on any transport or backend error
     */
    String generate(GenerationRequest request);

    /** Short name for logs and the health endpoint. */
    String getProviderName();
}
