package mail.classifier.app.service.backend;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI chat-completions backend.
 * The chat API takes no output schema here, so schema mode states the schema in a system message
 * and the seed is not forwarded; reproducibility then rests on temperature 0.
 */
@Slf4j
public class OpenAiGenerationBackend implements GenerationBackend {
    private final OpenAiService openAiService;

    public OpenAiGenerationBackend(OpenAiService openAiService) {
        this.openAiService = openAiService;
    }

    @Override
    public String getProviderName() {
        return "openai";
    }

    @Override
    public String generate(GenerationRequest request) {
        try {
            List<ChatMessage> messages = new ArrayList<>();
            messages.add(new ChatMessage("system", systemInstruction(request)));
            messages.add(new ChatMessage("user", request.getPrompt()));

            ChatCompletionRequest completionRequest = ChatCompletionRequest.builder()
                .model(request.getModel())
                .messages(messages)
                .maxTokens(request.getNumPredict())
                .temperature(request.getTemperature())
                .topP(1.0)
                .build();

            String content = openAiService.createChatCompletion(completionRequest)
                .getChoices().get(0).getMessage().getContent();
            if (content == null) {
                throw new GenerationException("OpenAI returned an empty message for model " + request.getModel());
            }
            return content.trim();
        } catch (GenerationException e) {
            throw e;
        } catch (OpenAiHttpException e) {
            throw new GenerationException("OpenAI HTTP " + e.statusCode + " for model " + request.getModel() + ": " + e.getMessage(), e);
        } catch (Exception e) {
            throw new GenerationException("OpenAI call failed for model " + request.getModel() + ": " + e.getMessage(), e);
        }
    }

    private static String systemInstruction(GenerationRequest request) {
        if (request.getMode() == OutputMode.SCHEMA && request.getSchema() != null) {
            return "Respond with ONLY a JSON object that validates against this JSON schema:\n"
                + request.getSchema().toString();
        }
        return "Respond with ONLY a single JSON object, nothing else.";
    }
}
