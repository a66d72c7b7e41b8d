package villagecompute.talentqueue.jobs.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Resume or other candidate document to store and parse.
 *
 * @param userId
 *            owner of the document
 * @param storageKey
 *            object key of the raw upload in the storage gateway
 * @param fileName
 *            original file name
 * @param fileType
 *            MIME type reported by the uploader (e.g. {@code application/pdf})
 * @param originalSize
 *            size of the raw upload in bytes
 */
public record DocumentProcessingPayload(@NotBlank String userId, @NotBlank String storageKey,
        @NotBlank String fileName, @NotBlank String fileType, @PositiveOrZero long originalSize) implements JobPayload {

    @Override
    public JobQueue queue() {
        return JobQueue.DOCUMENT;
    }
}
