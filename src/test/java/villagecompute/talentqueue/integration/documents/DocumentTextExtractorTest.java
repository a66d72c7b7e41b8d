package villagecompute.talentqueue.integration.documents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import villagecompute.talentqueue.testing.TestDocuments;

class DocumentTextExtractorTest {

    private final DocumentTextExtractor extractor = new DocumentTextExtractor();

    @Test
    void testExtractText_plainText() {
        byte[] bytes = "  Java developer \n".getBytes(StandardCharsets.UTF_8);

        assertEquals("Java developer", extractor.extractText(bytes, "text/plain", "cv.txt"));
        assertEquals("Java developer", extractor.extractText(bytes, "md", "cv.md"));
    }

    @Test
    void testExtractText_pdf() {
        byte[] pdf = TestDocuments.pdf("Jane Doe", "Senior Java engineer");

        String text = extractor.extractText(pdf, "application/pdf", "cv.pdf");

        assertTrue(text.contains("Jane Doe"), text);
        assertTrue(text.contains("Senior Java engineer"), text);
    }

    @Test
    void testExtractText_pdfDetectedByExtension() {
        byte[] pdf = TestDocuments.pdf("Kotlin and Java");

        assertTrue(extractor.extractText(pdf, "application/octet-stream", "CV.PDF").contains("Kotlin and Java"));
    }

    @Test
    void testExtractText_corruptPdf() {
        byte[] notPdf = "not a pdf".getBytes(StandardCharsets.UTF_8);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> extractor.extractText(notPdf, "application/pdf", "cv.pdf"));
        assertTrue(e.getMessage().contains("cv.pdf"));
    }

    @Test
    void testExtractText_unsupportedType() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extractText(new byte[] { 1 },
                "application/vnd.openxmlformats-officedocument.wordprocessingml.document", "cv.docx"));
    }

    @Test
    void testResolveFormat() {
        assertEquals("application/pdf", DocumentTextExtractor.resolveFormat(" Application/PDF ", "cv.txt"));
        assertEquals("pdf", DocumentTextExtractor.resolveFormat(null, "cv.pdf"));
        assertEquals("", DocumentTextExtractor.resolveFormat("", "README"));
    }
}
