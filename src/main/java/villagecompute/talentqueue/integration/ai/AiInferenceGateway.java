package villagecompute.talentqueue.integration.ai;

import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;

/**
 * Entry point for every model call made by job handlers.
 *
 * <p>
 * Failures of the provider (network, rate limits, 5xx) propagate as runtime exceptions and are retried by the job
 * executor. A missing API key is permanent and reported as {@link NonRetryableJobException}.
 */
@ApplicationScoped
public class AiInferenceGateway {

    private static final Logger LOG = Logger.getLogger(AiInferenceGateway.class);

    /**
     * Longest text sent to the chat model, in characters.
     */
    static final int MAX_PROMPT_TEXT = 12_000;

    @Inject
    ChatModel chatModel;

    @Inject
    EmbeddingModel embeddingModel;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "talentqueue.ai.anthropic.api-key")
    Optional<String> anthropicApiKey;

    @ConfigProperty(
            name = "talentqueue.ai.openai.api-key")
    Optional<String> openAiApiKey;

    /**
     * Embeds text with the configured embedding model.
     */
    public float[] embed(String text) {
        requireKey(openAiApiKey, "talentqueue.ai.openai.api-key");
        try {
            float[] vector = embeddingModel.embed(text).content().vector();
            record("embedding", true);
            LOG.debugf("Embedded %d characters into %d dimensions", text.length(), vector.length);
            return vector;
        } catch (RuntimeException e) {
            record("embedding", false);
            throw e;
        }
    }

    /**
     * Asks the chat model for a short structured assessment of a candidate document.
     */
    public String analyze(String text) {
        String prompt = String.format("""
                You review candidate profiles for a recruiting platform.

                Summarize the following text in at most five sentences, then list the candidate's main skills
                and their seniority level (junior, mid, senior, lead).

                TEXT:
                %s
                """, truncate(text));
        return chat("analysis", prompt);
    }

    /**
     * Asks the chat model how well a candidate text fits a job description.
     */
    public String assessMatch(String candidateText, String jobDescription) {
        String prompt = String.format("""
                You match candidates to job openings.

                Rate how well the candidate fits the job on a scale from 0 to 100, then explain the rating in at
                most three sentences. Start your answer with the number.

                JOB DESCRIPTION:
                %s

                CANDIDATE:
                %s
                """, truncate(jobDescription), truncate(candidateText));
        return chat("matching", prompt);
    }

    private String chat(String operation, String prompt) {
        requireKey(anthropicApiKey, "talentqueue.ai.anthropic.api-key");
        try {
            String response = chatModel.chat(prompt);
            record(operation, true);
            LOG.debugf("Chat %s returned %d characters (prompt: %d characters)", operation, response.length(),
                    prompt.length());
            return response;
        } catch (RuntimeException e) {
            record(operation, false);
            throw e;
        }
    }

    private static void requireKey(Optional<String> key, String property) {
        if (key.filter(value -> !value.isBlank()).isEmpty()) {
            throw new NonRetryableJobException("AI provider is not configured (" + property + " missing)");
        }
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_PROMPT_TEXT ? text.substring(0, MAX_PROMPT_TEXT) + "..." : text;
    }

    private void record(String operation, boolean success) {
        Counter.builder("talentqueue_ai_requests_total").tag("operation", operation)
                .tag("status", success ? "success" : "failure").register(meterRegistry).increment();
    }
}
