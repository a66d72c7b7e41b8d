package villagecompute.talentqueue.jobs.payload;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Text to run through an AI model.
 *
 * @param userId
 *            user the inference is done for
 * @param text
 *            input text (profile, resume, job description...)
 * @param type
 *            operation to perform
 * @param metadata
 *            optional operation-specific context (e.g. {@code jobDescription} for matching); may be null
 */
public record AiProcessingPayload(@NotBlank String userId, @NotBlank String text, @NotNull Type type,
        Map<String, Object> metadata) implements JobPayload {

    /**
     * AI operation types. Embeddings are cheap batch work; analysis and matching back interactive screens.
     */
    public enum Type {
        @JsonProperty("embedding")
        EMBEDDING,

        @JsonProperty("analysis")
        ANALYSIS,

        @JsonProperty("matching")
        MATCHING
    }

    @Override
    public JobQueue queue() {
        return JobQueue.AI;
    }

    public Map<String, Object> metadataOrEmpty() {
        return metadata == null ? Map.of() : metadata;
    }
}
