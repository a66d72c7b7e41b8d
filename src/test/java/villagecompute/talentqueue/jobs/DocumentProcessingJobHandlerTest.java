package villagecompute.talentqueue.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.talentqueue.api.types.StoredObjectType;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;
import villagecompute.talentqueue.integration.ai.AiInferenceGateway;
import villagecompute.talentqueue.integration.documents.DocumentTextExtractor;
import villagecompute.talentqueue.integration.storage.StorageGateway;
import villagecompute.talentqueue.jobs.payload.DocumentProcessingPayload;
import villagecompute.talentqueue.testing.TestDocuments;

/**
 * Tests for {@link DocumentProcessingJobHandler}: size limit, storage path and graceful degradation of text
 * extraction and embedding.
 */
class DocumentProcessingJobHandlerTest {

    private static final String RESUME_TEXT = "Backend engineer with eight years of Java, Kafka and PostgreSQL experience.";
    private static final String TARGET_KEY = "candidates/u1/resume/cv.txt";

    private DocumentProcessingJobHandler handler;
    private StorageGateway storageGateway;
    private DocumentTextExtractor textExtractor;
    private AiInferenceGateway aiGateway;
    private byte[] document;

    @BeforeEach
    void setUp() {
        storageGateway = mock(StorageGateway.class);
        textExtractor = mock(DocumentTextExtractor.class);
        aiGateway = mock(AiInferenceGateway.class);
        handler = new DocumentProcessingJobHandler();
        handler.storageGateway = storageGateway;
        handler.textExtractor = textExtractor;
        handler.aiGateway = aiGateway;
        handler.meterRegistry = new SimpleMeterRegistry();

        document = RESUME_TEXT.getBytes(StandardCharsets.UTF_8);
        when(storageGateway.download("raw/cv.txt")).thenReturn(document);
        when(storageGateway.upload(eq(TARGET_KEY), any(byte[].class), eq("text/plain"))).thenReturn(
                new StoredObjectType(TARGET_KEY, "bucket", "https://cdn/" + TARGET_KEY, document.length, "text/plain"));
    }

    private DocumentProcessingPayload payload() {
        return new DocumentProcessingPayload("u1", "raw/cv.txt", "cv.txt", "text/plain", document.length);
    }

    @Test
    void testExtractsAndEmbedsText() {
        when(textExtractor.extractText(document, "text/plain", "cv.txt")).thenReturn(RESUME_TEXT);
        when(aiGateway.embed(RESUME_TEXT)).thenReturn(new float[1536]);

        Map<String, Object> result = handler.execute(7L, payload(), JobProgress.NONE);

        assertEquals("https://cdn/" + TARGET_KEY, result.get("url"));
        assertEquals(true, result.get("textExtracted"));
        assertEquals(RESUME_TEXT.length(), result.get("textLength"));
        assertEquals(true, result.get("hasEmbeddings"));
        assertEquals(1536, result.get("embeddingDimension"));
    }

    @Test
    void testExtractionFailureStillCompletes() {
        when(textExtractor.extractText(any(byte[].class), anyString(), anyString()))
                .thenThrow(new IllegalArgumentException("unsupported"));

        Map<String, Object> result = handler.execute(7L, payload(), JobProgress.NONE);

        assertEquals(false, result.get("textExtracted"));
        assertEquals(false, result.get("hasEmbeddings"));
        assertFalse(result.containsKey("embeddingDimension"));
        verify(aiGateway, never()).embed(anyString());
    }

    @Test
    void testShortTextIsNotEmbedded() {
        when(textExtractor.extractText(document, "text/plain", "cv.txt")).thenReturn("Too short.");

        Map<String, Object> result = handler.execute(7L, payload(), JobProgress.NONE);

        assertEquals(true, result.get("textExtracted"));
        assertEquals(false, result.get("hasEmbeddings"));
        verify(aiGateway, never()).embed(anyString());
    }

    @Test
    void testEmbeddingFailureStillCompletes() {
        when(textExtractor.extractText(document, "text/plain", "cv.txt")).thenReturn(RESUME_TEXT);
        when(aiGateway.embed(RESUME_TEXT)).thenThrow(new RuntimeException("rate limited"));

        Map<String, Object> result = handler.execute(7L, payload(), JobProgress.NONE);

        assertEquals(true, result.get("textExtracted"));
        assertEquals(false, result.get("hasEmbeddings"));
    }

    @Test
    void testExtractsTextFromPdf() {
        byte[] pdf = TestDocuments.pdf("Jane Doe, Senior Java engineer",
                "Eight years of Quarkus, Kafka and PostgreSQL.");
        String pdfKey = "candidates/u1/resume/cv.pdf";
        when(storageGateway.download("raw/cv.pdf")).thenReturn(pdf);
        when(storageGateway.upload(eq(pdfKey), any(byte[].class), eq("application/pdf"))).thenReturn(
                new StoredObjectType(pdfKey, "bucket", "https://cdn/" + pdfKey, pdf.length, "application/pdf"));
        when(aiGateway.embed(anyString())).thenReturn(new float[1536]);
        handler.textExtractor = new DocumentTextExtractor();

        Map<String, Object> result = handler.execute(7L,
                new DocumentProcessingPayload("u1", "raw/cv.pdf", "cv.pdf", "application/pdf", pdf.length),
                JobProgress.NONE);

        assertEquals(true, result.get("textExtracted"));
        assertTrue((Integer) result.get("textLength") > 50, result.toString());
        assertEquals(true, result.get("hasEmbeddings"));
        assertEquals((long) pdf.length, result.get("originalSize"));
    }

    @Test
    void testOversizedDocumentIsPermanentFailure() {
        DocumentProcessingPayload payload = new DocumentProcessingPayload("u1", "raw/cv.txt", "cv.txt", "text/plain",
                DocumentProcessingJobHandler.MAX_DOCUMENT_BYTES + 1);

        assertThrows(NonRetryableJobException.class, () -> handler.execute(7L, payload, JobProgress.NONE));
    }

    @Test
    void testUploadFailurePropagates() {
        when(storageGateway.upload(eq(TARGET_KEY), any(byte[].class), anyString()))
                .thenThrow(new RuntimeException("Storage upload failed"));

        assertThrows(RuntimeException.class, () -> handler.execute(7L, payload(), JobProgress.NONE));
    }
}
