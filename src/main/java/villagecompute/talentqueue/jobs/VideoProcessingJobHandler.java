package villagecompute.talentqueue.jobs;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.api.types.StoredObjectType;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;
import villagecompute.talentqueue.exceptions.ResourceNotFoundException;
import villagecompute.talentqueue.integration.storage.StorageGateway;
import villagecompute.talentqueue.jobs.payload.VideoProcessingPayload;

/**
 * Processes candidate video introductions.
 *
 * <p>
 * Workflow:
 * <ol>
 * <li>Reject uploads over {@value #MAX_VIDEO_BYTES} bytes (permanent failure)</li>
 * <li>Download the raw upload from {@code storageKey}</li>
 * <li>Store it under {@code candidates/{userId}/video-intro/{fileName}}</li>
 * </ol>
 *
 * <p>
 * Re-running the job overwrites the same object key, so duplicate deliveries are harmless.
 */
@ApplicationScoped
public class VideoProcessingJobHandler implements JobHandler<VideoProcessingPayload> {

    private static final Logger LOG = Logger.getLogger(VideoProcessingJobHandler.class);

    public static final long MAX_VIDEO_BYTES = 10L * 1024 * 1024;

    @Inject
    StorageGateway storageGateway;

    @Inject
    MeterRegistry meterRegistry;

    @Override
    public JobQueue handlesQueue() {
        return JobQueue.VIDEO;
    }

    @Override
    public Class<VideoProcessingPayload> payloadType() {
        return VideoProcessingPayload.class;
    }

    @Override
    public Map<String, Object> execute(Long jobId, VideoProcessingPayload payload, JobProgress progress) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            LOG.infof("Processing video: jobId=%d, fileName=%s, originalSize=%d", jobId, payload.fileName(),
                    payload.originalSize());
            requireWithinLimit(payload.originalSize(), payload.fileName());

            byte[] video = download(payload.storageKey());
            requireWithinLimit(video.length, payload.fileName());
            progress.report(40);

            StoredObjectType stored = storageGateway.upload(
                    StorageGateway.videoIntroKey(payload.userId(), payload.fileName()), video,
                    contentType(payload.fileName()));
            progress.report(90);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("url", stored.url());
            result.put("objectKey", stored.objectKey());
            result.put("fileName", payload.fileName());
            result.put("originalSize", payload.originalSize());
            result.put("uploadedSize", stored.sizeBytes());
            result.put("profileComplete", true);

            status = "success";
            LOG.infof("Stored video introduction for jobId=%d at %s", jobId, stored.objectKey());
            return result;
        } finally {
            sample.stop(Timer.builder("talentqueue_video_processing_duration").tag("status", status)
                    .register(meterRegistry));
        }
    }

    private byte[] download(String storageKey) {
        try {
            return storageGateway.download(storageKey);
        } catch (ResourceNotFoundException e) {
            throw new NonRetryableJobException("Raw video upload is missing: " + storageKey, e);
        }
    }

    private static void requireWithinLimit(long size, String fileName) {
        if (size > MAX_VIDEO_BYTES) {
            throw new NonRetryableJobException(
                    String.format("Video %s is %d bytes, limit is %d bytes", fileName, size, MAX_VIDEO_BYTES));
        }
    }

    static String contentType(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".webm")) {
            return "video/webm";
        }
        if (lower.endsWith(".mp4") || lower.endsWith(".m4v")) {
            return "video/mp4";
        }
        if (lower.endsWith(".mov")) {
            return "video/quicktime";
        }
        return "application/octet-stream";
    }
}
