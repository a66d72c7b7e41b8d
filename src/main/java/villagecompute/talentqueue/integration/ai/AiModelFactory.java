/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.talentqueue.integration.ai;

import java.time.Duration;
import java.util.Optional;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Produces the LangChain4j models used by {@link AiInferenceGateway}.
 *
 * <ul>
 * <li><b>Chat</b>: Anthropic Claude, used for resume analysis and candidate/job matching</li>
 * <li><b>Embeddings</b>: OpenAI embeddings, Anthropic offers no embedding model</li>
 * </ul>
 *
 * <p>
 * Both beans are application scoped and therefore built on first use. The gateway checks that the matching API key is
 * configured before touching a model, so the application starts without AI credentials.
 */
@ApplicationScoped
public class AiModelFactory {

    private static final Logger LOG = Logger.getLogger(AiModelFactory.class);

    @ConfigProperty(
            name = "talentqueue.ai.anthropic.api-key")
    Optional<String> anthropicApiKey;

    @ConfigProperty(
            name = "talentqueue.ai.anthropic.model-name",
            defaultValue = "claude-3-5-haiku-20241022")
    String chatModelName;

    @ConfigProperty(
            name = "talentqueue.ai.anthropic.temperature",
            defaultValue = "0.3")
    Double temperature;

    @ConfigProperty(
            name = "talentqueue.ai.anthropic.max-tokens",
            defaultValue = "1024")
    Integer maxTokens;

    @ConfigProperty(
            name = "talentqueue.ai.anthropic.timeout",
            defaultValue = "60s")
    Duration chatTimeout;

    @ConfigProperty(
            name = "talentqueue.ai.anthropic.max-retries",
            defaultValue = "3")
    Integer maxRetries;

    @ConfigProperty(
            name = "talentqueue.ai.openai.api-key")
    Optional<String> openAiApiKey;

    @ConfigProperty(
            name = "talentqueue.ai.openai.embedding-model-name",
            defaultValue = "text-embedding-3-small")
    String embeddingModelName;

    @ConfigProperty(
            name = "talentqueue.ai.openai.timeout",
            defaultValue = "60s")
    Duration embeddingTimeout;

    @Produces
    @ApplicationScoped
    public ChatModel chatModel() {
        String apiKey = anthropicApiKey.filter(key -> !key.isBlank())
                .orElseThrow(() -> new IllegalStateException("talentqueue.ai.anthropic.api-key is not configured"));

        LOG.infof("Creating Anthropic ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%s, maxRetries=%d",
                chatModelName, temperature, maxTokens, chatTimeout, maxRetries);

        return AnthropicChatModel.builder().apiKey(apiKey).modelName(chatModelName).temperature(temperature)
                .maxTokens(maxTokens).timeout(chatTimeout).maxRetries(maxRetries).logRequests(false)
                .logResponses(false).build();
    }

    @Produces
    @ApplicationScoped
    public EmbeddingModel embeddingModel() {
        String apiKey = openAiApiKey.filter(key -> !key.isBlank())
                .orElseThrow(() -> new IllegalStateException("talentqueue.ai.openai.api-key is not configured"));

        LOG.infof("Creating OpenAI EmbeddingModel: model=%s, timeout=%s", embeddingModelName, embeddingTimeout);

        return OpenAiEmbeddingModel.builder().apiKey(apiKey).modelName(embeddingModelName).timeout(embeddingTimeout)
                .maxRetries(maxRetries).build();
    }
}
