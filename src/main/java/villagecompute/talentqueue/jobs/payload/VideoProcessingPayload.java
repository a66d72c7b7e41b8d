package villagecompute.talentqueue.jobs.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import villagecompute.talentqueue.jobs.JobQueue;

/**
 * Candidate video introduction to process.
 *
 * @param userId
 *            owner of the video
 * @param storageKey
 *            object key of the raw upload in the storage gateway
 * @param fileName
 *            original file name
 * @param originalSize
 *            size of the raw upload in bytes
 */
public record VideoProcessingPayload(@NotBlank String userId, @NotBlank String storageKey, @NotBlank String fileName,
        @PositiveOrZero long originalSize) implements JobPayload {

    @Override
    public JobQueue queue() {
        return JobQueue.VIDEO;
    }
}
