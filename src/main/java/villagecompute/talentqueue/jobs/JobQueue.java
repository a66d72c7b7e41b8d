package villagecompute.talentqueue.jobs;

import java.util.Optional;

import villagecompute.talentqueue.jobs.payload.AiProcessingPayload;
import villagecompute.talentqueue.jobs.payload.DocumentProcessingPayload;
import villagecompute.talentqueue.jobs.payload.JobPayload;
import villagecompute.talentqueue.jobs.payload.VideoProcessingPayload;

/**
 * Defines the workload classes for background job processing.
 *
 * <p>
 * Each queue has its own worker pool and concurrency limit (see {@code talentqueue.jobs.queues.<name>.*}). Concurrency
 * is bounded per queue, not globally: a video transcode pins far more memory than an embedding call, so the pools are
 * sized independently.
 *
 * <p>
 * The queue is also the tag of the payload union: every queue accepts exactly one {@link JobPayload} record type, and
 * the broker stores the queue next to the serialized payload so it can be decoded without runtime type probing.
 *
 * @see JobHandler for the processor contract
 * @see villagecompute.talentqueue.services.BackgroundJobService for the producer API
 */
public enum JobQueue {

    /**
     * VIDEO queue - candidate video introductions.
     * <p>
     * <b>Default concurrency:</b> 2 workers per pod (memory heavy).
     */
    VIDEO("video", VideoProcessingPayload.class, "Video intro processing and upload"),

    /**
     * DOCUMENT queue - resume and document parsing.
     * <p>
     * <b>Default concurrency:</b> 3 workers per pod.
     */
    DOCUMENT("document", DocumentProcessingPayload.class, "Resume/document parsing and text extraction"),

    /**
     * AI queue - embeddings, analysis and matching calls against remote models.
     * <p>
     * <b>Default concurrency:</b> 4 workers per pod (I/O bound).
     */
    AI("ai", AiProcessingPayload.class, "AI inference (embedding, analysis, matching)");

    private final String name;
    private final Class<? extends JobPayload> payloadType;
    private final String description;

    JobQueue(String name, Class<? extends JobPayload> payloadType, String description) {
        this.name = name;
        this.payloadType = payloadType;
        this.description = description;
    }

    /**
     * Returns the external queue name used in the API, configuration keys and the broker's {@code queue} column.
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the only payload type this queue accepts.
     */
    public Class<? extends JobPayload> getPayloadType() {
        return payloadType;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolves a queue from its external name (case-insensitive).
     *
     * @param name
     *            queue name such as {@code "video"}
     * @return the queue, or empty if the name is unknown
     */
    public static Optional<JobQueue> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (JobQueue queue : values()) {
            if (queue.name.equalsIgnoreCase(name.trim())) {
                return Optional.of(queue);
            }
        }
        return Optional.empty();
    }
}
