package villagecompute.talentqueue.integration.storage;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import villagecompute.talentqueue.api.types.StoredObjectType;
import villagecompute.talentqueue.exceptions.ResourceNotFoundException;

/**
 * Object storage for candidate media (video introductions and resumes).
 *
 * <p>
 * Raw uploads land wherever the API tier put them ({@code storageKey} on the job payload); job handlers download them,
 * validate them and store the processed copy under a per-candidate prefix:
 * <ul>
 * <li>{@code candidates/{userId}/video-intro/{fileName}}</li>
 * <li>{@code candidates/{userId}/resume/{fileName}}</li>
 * </ul>
 *
 * <p>
 * Every operation is traced ({@code storage.upload}, {@code storage.download}) and counted. Failures are rethrown as
 * {@link RuntimeException} so the job executor treats them as retryable; a missing object is reported as
 * {@link ResourceNotFoundException} because retrying cannot make it appear.
 */
@ApplicationScoped
public class StorageGateway {

    private static final Logger LOG = Logger.getLogger(StorageGateway.class);

    static final String CANDIDATE_PREFIX = "candidates";

    @Inject
    S3Client s3Client;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "talentqueue.storage.bucket")
    String bucket;

    @ConfigProperty(
            name = "talentqueue.storage.public-base-url")
    Optional<String> publicBaseUrl;

    /**
     * Object key of a candidate's processed video introduction.
     */
    public static String videoIntroKey(String userId, String fileName) {
        return candidateKey(userId, "video-intro", fileName);
    }

    /**
     * Object key of a candidate's processed resume.
     */
    public static String resumeKey(String userId, String fileName) {
        return candidateKey(userId, "resume", fileName);
    }

    private static String candidateKey(String userId, String folder, String fileName) {
        return CANDIDATE_PREFIX + "/" + userId + "/" + folder + "/" + fileName;
    }

    /**
     * Stores bytes under the given key.
     *
     * @param objectKey
     *            full object key
     * @param bytes
     *            object content
     * @param contentType
     *            MIME type to record on the object
     * @return stored object metadata including its public URL
     * @throws RuntimeException
     *             if the upload fails
     */
    public StoredObjectType upload(String objectKey, byte[] bytes, String contentType) {
        Span span = tracer.spanBuilder("storage.upload").setAttribute("bucket", bucket)
                .setAttribute("object_key", objectKey).setAttribute("size_bytes", bytes.length).startSpan();
        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            PutObjectRequest putRequest = PutObjectRequest.builder().bucket(bucket).key(objectKey)
                    .contentType(contentType).metadata(Map.of("processed-by", "talent-queue")).build();
            s3Client.putObject(putRequest, RequestBody.fromBytes(bytes));

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.infof("Uploaded %s/%s (%d bytes, %dms)", bucket, objectKey, bytes.length, latencyMs);
            recordMetrics("upload", bytes.length, latencyMs, true);
            span.setAttribute("upload_success", true);

            return new StoredObjectType(objectKey, bucket, publicUrl(objectKey), bytes.length, contentType);

        } catch (S3Exception e) {
            recordMetrics("upload", 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("upload_success", false);
            LOG.errorf(e, "Failed to upload %s: %s", objectKey, errorMessage(e));
            throw new RuntimeException("Storage upload failed: " + errorMessage(e), e);

        } catch (RuntimeException e) {
            recordMetrics("upload", 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("upload_success", false);
            LOG.errorf(e, "Failed to upload %s: %s", objectKey, e.getMessage());
            throw new RuntimeException("Storage upload failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Downloads an object.
     *
     * @param objectKey
     *            full object key
     * @return raw bytes
     * @throws ResourceNotFoundException
     *             if no object exists under the key
     * @throws RuntimeException
     *             if the download fails for any other reason
     */
    public byte[] download(String objectKey) {
        Span span = tracer.spanBuilder("storage.download").setAttribute("bucket", bucket)
                .setAttribute("object_key", objectKey).startSpan();
        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucket).key(objectKey).build();
            byte[] bytes = s3Client.getObjectAsBytes(getRequest).asByteArray();

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Downloaded %s/%s (%d bytes, %dms)", bucket, objectKey, bytes.length, latencyMs);
            recordMetrics("download", bytes.length, latencyMs, true);
            span.setAttribute("download_success", true);
            span.setAttribute("size_bytes", bytes.length);
            return bytes;

        } catch (NoSuchKeyException e) {
            recordMetrics("download", 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("download_success", false);
            LOG.warnf("Object %s/%s does not exist", bucket, objectKey);
            throw new ResourceNotFoundException("Stored object not found: " + objectKey, e);

        } catch (S3Exception e) {
            recordMetrics("download", 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("download_success", false);
            LOG.errorf(e, "Failed to download %s: %s", objectKey, errorMessage(e));
            throw new RuntimeException("Storage download failed: " + errorMessage(e), e);

        } catch (RuntimeException e) {
            recordMetrics("download", 0, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("download_success", false);
            LOG.errorf(e, "Failed to download %s: %s", objectKey, e.getMessage());
            throw new RuntimeException("Storage download failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Public URL of an object: {@code talentqueue.storage.public-base-url} when set, otherwise an {@code s3://} URI.
     */
    public String publicUrl(String objectKey) {
        return publicBaseUrl.map(base -> stripTrailingSlash(base) + "/" + objectKey)
                .orElse("s3://" + bucket + "/" + objectKey);
    }

    private static String stripTrailingSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String errorMessage(S3Exception e) {
        return e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
    }

    private void recordMetrics(String operation, long bytes, long latencyMs, boolean success) {
        String status = success ? "success" : "failure";

        Counter.builder("talentqueue_storage_operations_total").tag("operation", operation).tag("status", status)
                .register(meterRegistry).increment();

        if (success) {
            Counter.builder("talentqueue_storage_bytes_total").tag("operation", operation).register(meterRegistry)
                    .increment(bytes);
        }

        Timer.builder("talentqueue_storage_duration").tag("operation", operation).tag("status", status)
                .register(meterRegistry).record(Duration.ofMillis(latencyMs));
    }
}
