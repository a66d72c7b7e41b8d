package villagecompute.talentqueue.integration.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;

class AiInferenceGatewayTest {

    private AiInferenceGateway gateway;
    private ChatModel chatModel;
    private EmbeddingModel embeddingModel;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        embeddingModel = mock(EmbeddingModel.class);
        gateway = new AiInferenceGateway();
        gateway.chatModel = chatModel;
        gateway.embeddingModel = embeddingModel;
        gateway.meterRegistry = new SimpleMeterRegistry();
        gateway.anthropicApiKey = Optional.of("test-anthropic");
        gateway.openAiApiKey = Optional.of("test-openai");
    }

    @Test
    void testEmbed() {
        when(embeddingModel.embed("hello")).thenReturn(Response.from(Embedding.from(new float[] { 1f, 2f })));

        assertEquals(2, gateway.embed("hello").length);
    }

    @Test
    void testEmbed_withoutKeyIsPermanent() {
        gateway.openAiApiKey = Optional.empty();

        assertThrows(NonRetryableJobException.class, () -> gateway.embed("hello"));
        verify(embeddingModel, never()).embed(anyString());
    }

    @Test
    void testAssessMatch_includesBothTexts() {
        when(chatModel.chat(anyString())).thenReturn("70 - decent fit");

        assertEquals("70 - decent fit", gateway.assessMatch("candidate cv", "job ad"));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertTrue(prompt.getValue().contains("candidate cv"));
        assertTrue(prompt.getValue().contains("job ad"));
    }

    @Test
    void testAnalyze_withBlankKeyIsPermanent() {
        gateway.anthropicApiKey = Optional.of(" ");

        assertThrows(NonRetryableJobException.class, () -> gateway.analyze("text"));
    }

    @Test
    void testPromptTextIsTruncated() {
        String longText = "x".repeat(AiInferenceGateway.MAX_PROMPT_TEXT + 50);

        assertEquals(AiInferenceGateway.MAX_PROMPT_TEXT + 3, AiInferenceGateway.truncate(longText).length());
    }
}
