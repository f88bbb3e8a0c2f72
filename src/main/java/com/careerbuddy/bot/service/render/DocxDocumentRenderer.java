package com.careerbuddy.bot.service.render;

import com.careerbuddy.bot.exception.RenderingException;
import com.careerbuddy.bot.model.DocumentTemplate;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Word document delivered when a document is finalized. Each template picks its own font,
 * header alignment and heading style.
 */
@Primary
@Component
public class DocxDocumentRenderer implements DocumentRenderer {

    private static final Logger logger = LoggerFactory.getLogger(DocxDocumentRenderer.class);

    static final String MIME_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    private static final int BODY_SIZE = 11;
    // twips
    private static final int BULLET_INDENT = 360;
    private static final int SECTION_GAP = 240;

    @Override
    public RenderedDocument render(RenderRequest request) {
        DocumentTemplate template = request.getTemplate() != null ? request.getTemplate() : DocumentTemplate.CLASSIC;
        Style style = style(template);
        List<LayoutLine> lines = DocumentLayout.build(request);

        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (LayoutLine line : lines) {
                write(document, line, style);
            }
            document.write(out);

            byte[] content = out.toByteArray();
            logger.debug("Rendered DOCX {} for job {} ({} bytes, template {})",
                    request.getDocumentType(), request.getJobId(), content.length, template.getCode());
            return new RenderedDocument(DocumentLayout.fileName(request, "docx"), MIME_TYPE, content);
        } catch (IOException e) {
            throw new RenderingException("DOCX rendering failed for job " + request.getJobId(), e);
        }
    }

    private static void write(XWPFDocument document, LayoutLine line, Style style) {
        XWPFParagraph paragraph = document.createParagraph();
        String text = line.getText();

        switch (line.getKind()) {
            case NAME -> {
                header(paragraph, style);
                XWPFRun run = run(paragraph, style.upperName ? text.toUpperCase() : text, style, style.nameSize);
                run.setBold(true);
            }
            case SUBTITLE -> {
                header(paragraph, style);
                run(paragraph, text, style, 13);
            }
            case HEADING -> {
                paragraph.setSpacingBefore(SECTION_GAP);
                paragraph.setSpacingAfter(60);
                XWPFRun run = run(paragraph, style.upperHeadings ? text.toUpperCase() : text, style, style.headingSize);
                run.setBold(true);
                if (style.headingColor != null) {
                    run.setColor(style.headingColor);
                }
                if (style.underlineHeadings) {
                    run.setUnderline(UnderlinePatterns.SINGLE);
                }
            }
            case BULLET -> {
                paragraph.setIndentationLeft(BULLET_INDENT);
                paragraph.setSpacingAfter(0);
                run(paragraph, "• " + text, style, BODY_SIZE);
            }
            case TEXT -> run(paragraph, text, style, BODY_SIZE);
            case BLANK -> paragraph.setSpacingAfter(0);
        }
    }

    private static void header(XWPFParagraph paragraph, Style style) {
        paragraph.setAlignment(style.centeredHeader ? ParagraphAlignment.CENTER : ParagraphAlignment.LEFT);
        paragraph.setSpacingAfter(0);
    }

    private static XWPFRun run(XWPFParagraph paragraph, String text, Style style, int size) {
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        run.setFontFamily(style.font);
        run.setFontSize(size);
        return run;
    }

    private static Style style(DocumentTemplate template) {
        return switch (template) {
            case CLASSIC -> new Style("Calibri", 24, 14, null, true, false, true, false);
            case MODERN -> new Style("Arial", 22, 13, "2E5C8A", false, false, false, false);
            case EXECUTIVE -> new Style("Georgia", 26, 13, "1F1F1F", true, true, true, true);
        };
    }

    private static final class Style {

        private final String font;
        private final int nameSize;
        private final int headingSize;
        private final String headingColor;
        private final boolean centeredHeader;
        private final boolean upperName;
        private final boolean upperHeadings;
        private final boolean underlineHeadings;

        Style(String font, int nameSize, int headingSize, String headingColor,
              boolean centeredHeader, boolean upperName, boolean upperHeadings, boolean underlineHeadings) {
            this.font = font;
            this.nameSize = nameSize;
            this.headingSize = headingSize;
            this.headingColor = headingColor;
            this.centeredHeader = centeredHeader;
            this.upperName = upperName;
            this.upperHeadings = upperHeadings;
            this.underlineHeadings = underlineHeadings;
        }
    }
}
