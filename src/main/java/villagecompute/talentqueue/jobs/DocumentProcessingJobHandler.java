package villagecompute.talentqueue.jobs;

import java.util.LinkedHashMap;
import java.util.Map;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.api.types.StoredObjectType;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;
import villagecompute.talentqueue.exceptions.ResourceNotFoundException;
import villagecompute.talentqueue.integration.ai.AiInferenceGateway;
import villagecompute.talentqueue.integration.documents.DocumentTextExtractor;
import villagecompute.talentqueue.integration.storage.StorageGateway;
import villagecompute.talentqueue.jobs.payload.DocumentProcessingPayload;

/**
 * Processes uploaded resumes and other candidate documents.
 *
 * <p>
 * Workflow:
 * <ol>
 * <li>Reject documents over {@value #MAX_DOCUMENT_BYTES} bytes (permanent failure)</li>
 * <li>Download the raw upload and store it under {@code candidates/{userId}/resume/{fileName}}</li>
 * <li>Extract the text (PDF or plain text)</li>
 * <li>Embed the text when it is longer than {@value #MIN_EMBEDDING_TEXT} characters</li>
 * </ol>
 *
 * <p>
 * Once the document is stored the job succeeds: extraction and embedding failures only degrade the result
 * ({@code textExtracted=false}, {@code hasEmbeddings=false}).
 */
@ApplicationScoped
public class DocumentProcessingJobHandler implements JobHandler<DocumentProcessingPayload> {

    private static final Logger LOG = Logger.getLogger(DocumentProcessingJobHandler.class);

    public static final long MAX_DOCUMENT_BYTES = 5L * 1024 * 1024;

    static final int MIN_EMBEDDING_TEXT = 50;

    @Inject
    StorageGateway storageGateway;

    @Inject
    DocumentTextExtractor textExtractor;

    @Inject
    AiInferenceGateway aiGateway;

    @Inject
    MeterRegistry meterRegistry;

    @Override
    public JobQueue handlesQueue() {
        return JobQueue.DOCUMENT;
    }

    @Override
    public Class<DocumentProcessingPayload> payloadType() {
        return DocumentProcessingPayload.class;
    }

    @Override
    public Map<String, Object> execute(Long jobId, DocumentProcessingPayload payload, JobProgress progress) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            LOG.infof("Processing document: jobId=%d, fileName=%s, fileType=%s", jobId, payload.fileName(),
                    payload.fileType());
            requireWithinLimit(payload.originalSize(), payload.fileName());

            byte[] document = download(payload.storageKey());
            requireWithinLimit(document.length, payload.fileName());
            progress.report(25);

            StoredObjectType stored = storageGateway.upload(
                    StorageGateway.resumeKey(payload.userId(), payload.fileName()), document,
                    contentType(payload.fileType()));
            progress.report(50);

            String text = extractText(jobId, document, payload);
            progress.report(75);

            int embeddingDimension = text == null ? 0 : embed(jobId, text);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("url", stored.url());
            result.put("objectKey", stored.objectKey());
            result.put("fileName", payload.fileName());
            result.put("originalSize", payload.originalSize());
            result.put("uploadedSize", stored.sizeBytes());
            result.put("textExtracted", text != null);
            result.put("textLength", text == null ? 0 : text.length());
            result.put("hasEmbeddings", embeddingDimension > 0);
            if (embeddingDimension > 0) {
                result.put("embeddingDimension", embeddingDimension);
            }

            status = "success";
            LOG.infof("Stored document for jobId=%d at %s (textExtracted=%s, hasEmbeddings=%s)", jobId,
                    stored.objectKey(), text != null, embeddingDimension > 0);
            return result;
        } finally {
            sample.stop(Timer.builder("talentqueue_document_processing_duration").tag("status", status)
                    .register(meterRegistry));
        }
    }

    private byte[] download(String storageKey) {
        try {
            return storageGateway.download(storageKey);
        } catch (ResourceNotFoundException e) {
            throw new NonRetryableJobException("Raw document upload is missing: " + storageKey, e);
        }
    }

    /**
     * @return extracted text, or null when extraction failed
     */
    private String extractText(Long jobId, byte[] document, DocumentProcessingPayload payload) {
        try {
            return textExtractor.extractText(document, payload.fileType(), payload.fileName());
        } catch (RuntimeException e) {
            LOG.warnf("Text extraction failed for jobId=%d (%s): %s", jobId, payload.fileType(), e.getMessage());
            return null;
        }
    }

    /**
     * @return embedding dimension, 0 when the text is too short or embedding failed
     */
    private int embed(Long jobId, String text) {
        if (text.length() <= MIN_EMBEDDING_TEXT) {
            return 0;
        }
        try {
            return aiGateway.embed(text).length;
        } catch (RuntimeException e) {
            LOG.warnf("Embedding failed for jobId=%d: %s", jobId, e.getMessage());
            return 0;
        }
    }

    private static void requireWithinLimit(long size, String fileName) {
        if (size > MAX_DOCUMENT_BYTES) {
            throw new NonRetryableJobException(
                    String.format("Document %s is %d bytes, limit is %d bytes", fileName, size, MAX_DOCUMENT_BYTES));
        }
    }

    private static String contentType(String fileType) {
        return fileType.contains("/") ? fileType : "application/octet-stream";
    }
}
