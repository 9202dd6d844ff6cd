package mail.classifier.app.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mail.classifier.app.service.backend.GenerationBackend;
import mail.classifier.app.service.backend.GenerationBackend.GenerationException;
import mail.classifier.app.service.backend.GenerationBackend.GenerationRequest;
import mail.classifier.app.service.backend.GenerationBackend.OutputMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StructuredOutputParserTest {

    @Mock
    private GenerationBackend backend;

    private StructuredOutputParser parser;
    private GenerationRequest request;

    @BeforeEach
    void setUp() {
        parser = new StructuredOutputParser(backend, new ObjectMapper());
        request = GenerationRequest.builder()
                .model("mail-classifier-small")
                .prompt("Subject: hello")
                .seed(42L)
                .numPredict(200)
                .numCtx(3072)
                .build();
    }

    @Test
    void generateObject_WhenSchemaOutputParses_ShouldMakeOneCall() {
        // Given
        when(backend.generate(any())).thenReturn("{\"category\":\"Invoice\",\"priority\":\"High\"}");

        // When
        JsonNode node = parser.generateObject(request);

        // Then
        assertEquals("Invoice", node.get("category").asText());
        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(backend, times(1)).generate(captor.capture());
        assertEquals(OutputMode.SCHEMA, captor.getValue().getMode());
        assertEquals(42L, captor.getValue().getSeed());
    }

    @Test
    void generateObject_WithFencedSchemaOutput_ShouldStripFences() {
        when(backend.generate(any())).thenReturn("```json\n{\"a\":2}\n```");

        JsonNode node = parser.generateObject(request);

        assertEquals(2, node.get("a").asInt());
        verify(backend, times(1)).generate(any());
    }

    @Test
    void generateObject_WhenSchemaCallFails_ShouldRetryInJsonMode() {
        // Given
        when(backend.generate(any()))
                .thenThrow(new GenerationException("schema unsupported"))
                .thenReturn("{\"summary\":\"ok\"}");

        // When
        JsonNode node = parser.generateObject(request);

        // Then
        assertEquals("ok", node.get("summary").asText());
        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(backend, times(2)).generate(captor.capture());
        List<GenerationRequest> calls = captor.getAllValues();
        assertEquals(OutputMode.SCHEMA, calls.get(0).getMode());
        assertEquals(OutputMode.JSON, calls.get(1).getMode());
        assertEquals(calls.get(0).getSeed(), calls.get(1).getSeed());
    }

    @Test
    void generateObject_WhenSchemaOutputIsNotAnObject_ShouldRetryInJsonMode() {
        when(backend.generate(any())).thenReturn("[1,2]", "{\"x\":true}");

        JsonNode node = parser.generateObject(request);

        assertTrue(node.get("x").asBoolean());
    }

    @Test
    void generateObject_WhenJsonOutputHasChatter_ShouldRecoverEmbeddedObject() {
        when(backend.generate(any())).thenReturn("not json", "Here you go: {\"a\":1} thanks!");

        JsonNode node = parser.generateObject(request);

        assertEquals(1, node.get("a").asInt());
    }

    @Test
    void generateObject_WhenNothingRecoverable_ShouldThrowMalformedOutput() {
        when(backend.generate(any())).thenReturn("not json", "still not json");

        assertThrows(MalformedOutputException.class, () -> parser.generateObject(request));
    }

    @Test
    void generateObject_WhenOnlyArrayRecoverable_ShouldThrowMalformedOutput() {
        when(backend.generate(any())).thenReturn("nope", "result: [1,2]");

        assertThrows(MalformedOutputException.class, () -> parser.generateObject(request));
    }

    @Test
    void generateObject_WhenJsonCallFails_ShouldPropagateBackendError() {
        when(backend.generate(any()))
                .thenThrow(new GenerationException("timeout"))
                .thenThrow(new GenerationException("timeout again"));

        GenerationException e = assertThrows(GenerationException.class, () -> parser.generateObject(request));
        assertEquals("timeout again", e.getMessage());
    }
}
