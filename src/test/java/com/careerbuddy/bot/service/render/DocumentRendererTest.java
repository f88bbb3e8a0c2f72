package com.careerbuddy.bot.service.render;

import com.careerbuddy.bot.model.DocumentTemplate;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.model.answers.Basics;
import com.careerbuddy.bot.model.answers.CoverLetter;
import com.careerbuddy.bot.model.answers.Education;
import com.careerbuddy.bot.model.answers.Experience;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentRendererTest {

    private static Answers resumeAnswers() {
        Answers answers = new Answers();
        answers.setBasics(new Basics("Jane Doe", "jane@example.com", "+2348000000000", "Lagos"));
        answers.setTargetRole("Data Analyst");
        answers.setSummary("Analyst who turns raw data into decisions.");
        answers.setSkills(List.of("SQL", "Python"));
        Experience experience = new Experience("Analyst", "Acme", "Lagos", "2020", "Present");
        experience.getBullets().add("Built the weekly sales dashboard");
        answers.getExperiences().add(experience);
        answers.getEducation().add(new Education("BSc Statistics", "University of Lagos", "2019"));
        answers.setPersonalInfo("Nigerian, born 1996");
        return answers;
    }

    private static RenderRequest request(DocumentType type, DocumentTemplate template, Answers answers) {
        return RenderRequest.builder()
                .jobId(9L)
                .documentType(type)
                .template(template)
                .answers(answers)
                .build();
    }

    @Nested
    @DisplayName("Layout")
    class LayoutTests {

        @Test
        @DisplayName("Should lay out a resume section by section")
        void shouldBuildResumeLayout() {
            List<LayoutLine> lines = DocumentLayout.build(request(DocumentType.RESUME, null, resumeAnswers()));

            assertThat(lines.get(0).getKind()).isEqualTo(LayoutLine.Kind.NAME);
            assertThat(lines.get(0).getText()).isEqualTo("Jane Doe");
            assertThat(lines).extracting(LayoutLine::getText)
                    .contains("Data Analyst", "jane@example.com | +2348000000000 | Lagos",
                            "Professional Summary", "SQL • Python", "Analyst - Acme, Lagos", "2020 - Present",
                            "Built the weekly sales dashboard", "BSc Statistics, University of Lagos (2019)")
                    .doesNotContain("Personal Profile");
        }

        @Test
        @DisplayName("Should add the personal profile to a CV only")
        void shouldAddPersonalProfileToCv() {
            List<LayoutLine> lines = DocumentLayout.build(request(DocumentType.CV, null, resumeAnswers()));

            assertThat(lines).extracting(LayoutLine::getText).contains("Personal Profile", "Nigerian, born 1996");
        }

        @Test
        @DisplayName("Should split revamped text into headings, bullets and paragraphs")
        void shouldParseRevampedContent() {
            Answers answers = new Answers();
            answers.setOriginalContent("old");
            answers.setRevampedContent("EXPERIENCE\n- Led the migration\n\nShipped on time.");

            List<LayoutLine> lines = DocumentLayout.build(request(DocumentType.REVAMP, null, answers));

            assertThat(lines).extracting(LayoutLine::getKind).containsExactly(
                    LayoutLine.Kind.HEADING, LayoutLine.Kind.BULLET, LayoutLine.Kind.BLANK, LayoutLine.Kind.TEXT);
            assertThat(lines.get(1).getText()).isEqualTo("Led the migration");
        }

        @Test
        @DisplayName("Should drop characters that are not allowed in file names")
        void shouldSanitizeFileName() {
            Answers answers = resumeAnswers();
            answers.getBasics().setName("Jane/Doe?");

            assertThat(DocumentLayout.fileName(request(DocumentType.COVER_LETTER, null, answers), "pdf"))
                    .isEqualTo("JaneDoe - Cover Letter.pdf");
        }
    }

    @Nested
    @DisplayName("DOCX renderer")
    class DocxTests {

        private final DocxDocumentRenderer renderer = new DocxDocumentRenderer();

        private List<XWPFParagraph> paragraphs(RenderedDocument document) throws IOException {
            try (XWPFDocument docx = new XWPFDocument(new ByteArrayInputStream(document.getContent()))) {
                return docx.getParagraphs();
            }
        }

        private XWPFParagraph paragraph(List<XWPFParagraph> paragraphs, String text) {
            return paragraphs.stream()
                    .filter(p -> p.getText().equals(text))
                    .findFirst()
                    .orElseThrow();
        }

        @Test
        @DisplayName("Should produce a Word document with every section")
        void shouldRenderDocx() throws IOException {
            RenderedDocument document = renderer.render(request(DocumentType.RESUME, DocumentTemplate.CLASSIC, resumeAnswers()));

            assertThat(document.getFileName()).isEqualTo("Jane Doe - Resume.docx");
            assertThat(document.getMimeType())
                    .isEqualTo("application/vnd.openxmlformats-officedocument.wordprocessingml.document");
            assertThat(paragraphs(document)).extracting(XWPFParagraph::getText)
                    .startsWith("Jane Doe")
                    .contains("PROFESSIONAL SUMMARY", "SQL • Python", "• Built the weekly sales dashboard");
        }

        @Test
        @DisplayName("Should style the classic template with a centered Calibri header")
        void shouldStyleClassic() throws IOException {
            List<XWPFParagraph> paragraphs = paragraphs(
                    renderer.render(request(DocumentType.RESUME, DocumentTemplate.CLASSIC, resumeAnswers())));

            XWPFParagraph name = paragraphs.get(0);
            assertThat(name.getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
            assertThat(name.getRuns().get(0).getFontFamily()).isEqualTo("Calibri");
            assertThat(name.getRuns().get(0).isBold()).isTrue();
            assertThat(paragraph(paragraphs, "SKILLS").getRuns().get(0).isBold()).isTrue();
        }

        @Test
        @DisplayName("Should follow the chosen template")
        void shouldStyleModernAndExecutive() throws IOException {
            List<XWPFParagraph> modern = paragraphs(
                    renderer.render(request(DocumentType.RESUME, DocumentTemplate.MODERN, resumeAnswers())));
            List<XWPFParagraph> executive = paragraphs(
                    renderer.render(request(DocumentType.RESUME, DocumentTemplate.EXECUTIVE, resumeAnswers())));

            assertThat(modern.get(0).getAlignment()).isEqualTo(ParagraphAlignment.LEFT);
            XWPFRun modernHeading = paragraph(modern, "Work Experience").getRuns().get(0);
            assertThat(modernHeading.getFontFamily()).isEqualTo("Arial");
            assertThat(modernHeading.getColor()).isEqualTo("2E5C8A");

            assertThat(executive.get(0).getText()).isEqualTo("JANE DOE");
            XWPFRun executiveHeading = paragraph(executive, "WORK EXPERIENCE").getRuns().get(0);
            assertThat(executiveHeading.getFontFamily()).isEqualTo("Georgia");
            assertThat(executiveHeading.getUnderline()).isEqualTo(UnderlinePatterns.SINGLE);
        }

        @Test
        @DisplayName("Should write a cover letter from the collected answers")
        void shouldRenderCoverLetter() throws IOException {
            Answers answers = resumeAnswers();
            CoverLetter cover = answers.getCoverLetter();
            cover.setRole("Data Analyst");
            cover.setCompany("Globex");
            cover.setKeySkills(List.of("SQL", "Python", "Storytelling"));
            cover.setCompanyGoal("Growing the West Africa market");
            cover.setAchievement1("Cut reporting time by 40%");

            RenderedDocument document = renderer.render(request(DocumentType.COVER_LETTER, DocumentTemplate.MODERN, answers));
            List<String> texts = paragraphs(document).stream().map(XWPFParagraph::getText).toList();

            assertThat(document.getFileName()).isEqualTo("Jane Doe - Cover Letter.docx");
            assertThat(String.join("\n", texts))
                    .contains("apply for the Data Analyst position at Globex")
                    .contains("several years of experience in my field")
                    .contains("SQL, Python and Storytelling")
                    .contains("help Globex with growing the West Africa market");
            assertThat(texts).contains("• Cut reporting time by 40%").endsWith("Sincerely,", "Jane Doe");
        }
    }

    @Nested
    @DisplayName("PDF renderer")
    class PdfTests {

        private final PdfDocumentRenderer renderer = new PdfDocumentRenderer();

        @Test
        @DisplayName("Should produce a readable PDF")
        void shouldRenderPdf() throws Exception {
            RenderedDocument document = renderer.render(request(DocumentType.RESUME, DocumentTemplate.MODERN, resumeAnswers()));

            assertThat(document.getFileName()).isEqualTo("Jane Doe - Resume.pdf");
            assertThat(document.getMimeType()).isEqualTo("application/pdf");
            assertThat(new String(document.getContent(), 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");

            try (PDDocument pdf = Loader.loadPDF(document.getContent())) {
                assertThat(pdf.getNumberOfPages()).isEqualTo(1);
                assertThat(new PDFTextStripper().getText(pdf)).contains("Jane Doe").contains("Built the weekly sales dashboard");
            }
        }

        @Test
        @DisplayName("Should start new pages for long documents")
        void shouldPaginate() throws Exception {
            Answers answers = resumeAnswers();
            Experience experience = answers.getExperiences().get(0);
            for (int i = 0; i < 80; i++) {
                experience.getBullets().add("Delivered initiative number " + i + " with measurable results");
            }

            RenderedDocument document = renderer.render(request(DocumentType.RESUME, DocumentTemplate.CLASSIC, answers));

            try (PDDocument pdf = Loader.loadPDF(document.getContent())) {
                assertThat(pdf.getNumberOfPages()).isGreaterThan(1);
            }
        }

        @Test
        @DisplayName("Should replace characters the standard fonts cannot encode")
        void shouldMapToWinAnsi() {
            assertThat(PdfDocumentRenderer.toWinAnsi("Café • naïve\t→ 北京")).isEqualTo("Café • naïve ? ??");
        }
    }
}
