/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.talentqueue.integration.documents;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Reads the text of uploaded candidate documents.
 *
 * <p>
 * PDFs are parsed with PDFBox. Plain-text formats are decoded as UTF-8. The format is taken from the MIME type and,
 * when that is generic ({@code application/octet-stream}) or missing, from the file extension.
 */
@ApplicationScoped
public class DocumentTextExtractor {

    private static final Logger LOG = Logger.getLogger(DocumentTextExtractor.class);

    private static final Set<String> PLAIN_TEXT_TYPES = Set.of("text/plain", "text/markdown", "text/csv",
            "application/json", "txt", "md", "csv", "json");

    private static final Set<String> PDF_TYPES = Set.of("application/pdf", "pdf");

    /**
     * Extracts the text of a document, stripped of leading and trailing whitespace.
     *
     * @param bytes
     *            raw document content
     * @param fileType
     *            MIME type or short type name as sent by the uploader
     * @param fileName
     *            original file name, used when the type is not conclusive
     * @throws IllegalArgumentException
     *             if the format is unsupported or the document cannot be parsed
     */
    public String extractText(byte[] bytes, String fileType, String fileName) {
        String format = resolveFormat(fileType, fileName);
        if (PDF_TYPES.contains(format)) {
            return extractPdf(bytes, fileName);
        }
        if (PLAIN_TEXT_TYPES.contains(format) || format.startsWith("text/")) {
            return new String(bytes, StandardCharsets.UTF_8).strip();
        }
        throw new IllegalArgumentException("Text extraction is not supported for " + fileType);
    }

    private static String extractPdf(byte[] bytes, String fileName) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            String text = new PDFTextStripper().getText(document).strip();
            LOG.debugf("Extracted %d characters from %d PDF pages of %s", text.length(), document.getNumberOfPages(),
                    fileName);
            return text;
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable PDF document " + fileName, e);
        }
    }

    static String resolveFormat(String fileType, String fileName) {
        String type = fileType == null ? "" : fileType.toLowerCase(Locale.ROOT).trim();
        if (!type.isEmpty() && !type.equals("application/octet-stream")) {
            return type;
        }
        if (fileName == null) {
            return type;
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? type : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
