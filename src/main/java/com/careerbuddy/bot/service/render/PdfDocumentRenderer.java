package com.careerbuddy.bot.service.render;

import com.careerbuddy.bot.exception.RenderingException;
import com.careerbuddy.bot.model.DocumentTemplate;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF export of a generated document, drawn with the standard 14 fonts.
 */
@Component
public class PdfDocumentRenderer implements DocumentRenderer {

    private static final Logger logger = LoggerFactory.getLogger(PdfDocumentRenderer.class);

    static final String MIME_TYPE = "application/pdf";

    private static final float MARGIN = 50f;
    private static final float BODY_SIZE = 11f;
    private static final float LEADING = 1.35f;

    @Override
    public RenderedDocument render(RenderRequest request) {
        DocumentTemplate template = request.getTemplate() != null ? request.getTemplate() : DocumentTemplate.CLASSIC;
        List<LayoutLine> lines = DocumentLayout.build(request);

        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            new PageWriter(document, fonts(template)).write(lines);
            document.save(out);

            byte[] content = out.toByteArray();
            logger.debug("Rendered PDF {} for job {} ({} bytes)", request.getDocumentType(), request.getJobId(), content.length);
            return new RenderedDocument(DocumentLayout.fileName(request, "pdf"), MIME_TYPE, content);
        } catch (IOException e) {
            throw new RenderingException("PDF rendering failed for job " + request.getJobId(), e);
        }
    }

    private static Fonts fonts(DocumentTemplate template) {
        return switch (template) {
            case CLASSIC -> new Fonts(
                    new PDType1Font(Standard14Fonts.FontName.TIMES_ROMAN),
                    new PDType1Font(Standard14Fonts.FontName.TIMES_BOLD));
            case MODERN -> new Fonts(
                    new PDType1Font(Standard14Fonts.FontName.HELVETICA),
                    new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD));
            case EXECUTIVE -> new Fonts(
                    new PDType1Font(Standard14Fonts.FontName.HELVETICA),
                    new PDType1Font(Standard14Fonts.FontName.TIMES_BOLD));
        };
    }

    /**
     * Standard 14 fonts only encode WinAnsi; anything else would make PDFBox throw.
     */
    static String toWinAnsi(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if ((c >= 32 && c < 127) || (c >= 160 && c <= 255) || c == '•') {
                sb.append(c);
            } else if (c == '\t') {
                sb.append(' ');
            } else {
                sb.append('?');
            }
        }
        return sb.toString();
    }

    private static final class Fonts {

        private final PDType1Font regular;
        private final PDType1Font bold;

        Fonts(PDType1Font regular, PDType1Font bold) {
            this.regular = regular;
            this.bold = bold;
        }
    }

    private static final class PageWriter {

        private final PDDocument document;
        private final Fonts fonts;
        private final float width = PDRectangle.A4.getWidth() - 2 * MARGIN;

        private PDPageContentStream stream;
        private float y;

        PageWriter(PDDocument document, Fonts fonts) {
            this.document = document;
            this.fonts = fonts;
        }

        void write(List<LayoutLine> lines) throws IOException {
            newPage();
            try {
                for (LayoutLine line : lines) {
                    switch (line.getKind()) {
                        case NAME -> paragraph(line.getText(), fonts.bold, 20f, 0f);
                        case SUBTITLE -> paragraph(line.getText(), fonts.regular, 12f, 0f);
                        case HEADING -> {
                            y -= 4f;
                            paragraph(line.getText().toUpperCase(), fonts.bold, 13f, 0f);
                        }
                        case BULLET -> paragraph("• " + line.getText(), fonts.regular, BODY_SIZE, 12f);
                        case TEXT -> paragraph(line.getText(), fonts.regular, BODY_SIZE, 0f);
                        case BLANK -> y -= BODY_SIZE * LEADING / 2;
                    }
                }
            } finally {
                stream.close();
            }
        }

        private void paragraph(String text, PDType1Font font, float size, float indent) throws IOException {
            for (String row : wrap(toWinAnsi(text), font, size, width - indent)) {
                float lineHeight = size * LEADING;
                if (y - lineHeight < MARGIN) {
                    stream.close();
                    newPage();
                }
                y -= lineHeight;
                stream.beginText();
                stream.setFont(font, size);
                stream.newLineAtOffset(MARGIN + indent, y);
                stream.showText(row);
                stream.endText();
            }
        }

        private void newPage() throws IOException {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }

        private static List<String> wrap(String text, PDType1Font font, float size, float maxWidth) throws IOException {
            List<String> rows = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (String word : text.split(" ")) {
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (current.length() > 0 && font.getStringWidth(candidate) / 1000 * size > maxWidth) {
                    rows.add(current.toString());
                    current = new StringBuilder(word);
                } else {
                    current = new StringBuilder(candidate);
                }
            }
            if (current.length() > 0 || rows.isEmpty()) {
                rows.add(current.toString());
            }
            return rows;
        }
    }
}
