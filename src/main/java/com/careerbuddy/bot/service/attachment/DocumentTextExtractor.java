package com.careerbuddy.bot.service.attachment;

import com.careerbuddy.bot.exception.ValidationException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

/**
 * Plain text of an uploaded resume. Text files are decoded as UTF-8, PDF files go through PDFBox.
 */
@Component
public class DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);

    @NotNull
    public String extractText(String fileName, String mimeType, byte[] content) {
        if (content == null || content.length == 0) {
            throw new ValidationException(ERR_UPLOAD_EMPTY);
        }

        String mt = mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT);
        String fn = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);

        String text;
        if (mt.equals("application/pdf") || fn.endsWith(".pdf")) {
            text = extractPdf(fileName, content);
        } else if (mt.startsWith("text/") || fn.endsWith(".txt")) {
            text = stripBom(new String(content, StandardCharsets.UTF_8));
        } else {
            log.debug("Unsupported upload {} ({})", fileName, mimeType);
            throw new ValidationException(ERR_UPLOAD_FORMAT, EXAMPLE_UPLOAD);
        }

        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(ERR_UPLOAD_EMPTY);
        }
        return trimmed;
    }

    private String extractPdf(String fileName, byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            return stripper.getText(document);
        } catch (IOException e) {
            log.warn("PDF extraction failed for {}: {}", fileName, e.toString());
            throw new ValidationException(ERR_UPLOAD_UNREADABLE);
        }
    }

    private static String stripBom(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
