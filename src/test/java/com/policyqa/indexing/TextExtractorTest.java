package com.policyqa.indexing;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.policyqa.PolicyFixtures.COVERAGE_CLAUSE;
import static com.policyqa.PolicyFixtures.WAITING_CLAUSE;
import static org.assertj.core.api.Assertions.assertThat;

class TextExtractorTest {

    private final TextExtractor extractor = new TextExtractor();

    static byte[] pdf(String... pageTexts) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    stream.beginText();
                    stream.setFont(font, 8);
                    stream.newLineAtOffset(50, 700);
                    stream.showText(text);
                    stream.endText();
                }
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    @Nested
    @DisplayName("PDF")
    class Pdf {

        @Test
        @DisplayName("Should keep one entry per page with its number")
        void shouldExtractPages() throws IOException {
            List<ExtractedPage> pages = extractor.extract(pdf(COVERAGE_CLAUSE, WAITING_CLAUSE), "application/pdf");

            assertThat(pages).extracting(ExtractedPage::pageNumber).containsExactly(1, 2);
            assertThat(pages.get(0).text()).contains("knee surgery");
            assertThat(pages.get(1).text()).contains("waiting period of 90 days");
        }

        @Test
        @DisplayName("Should accept content type parameters")
        void shouldIgnoreContentTypeParameters() throws IOException {
            List<ExtractedPage> pages = extractor.extract(pdf(WAITING_CLAUSE), "application/pdf; qs=0.9");

            assertThat(pages).singleElement().satisfies(page -> assertThat(page.hasText()).isTrue());
        }

        @Test
        @DisplayName("Should return nothing for corrupted bytes")
        void shouldTreatCorruptedPdfAsUnextractable() {
            byte[] corrupted = "%PDF-1.7 this is not really a pdf".getBytes(StandardCharsets.US_ASCII);

            assertThat(extractor.extract(corrupted, "application/pdf")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Plain text")
    class PlainText {

        @Test
        @DisplayName("Should split pages on form feeds")
        void shouldSplitOnFormFeed() {
            byte[] content = (COVERAGE_CLAUSE + "\f" + WAITING_CLAUSE).getBytes(StandardCharsets.UTF_8);

            List<ExtractedPage> pages = extractor.extract(content, "text/plain");

            assertThat(pages).containsExactly(new ExtractedPage(1, COVERAGE_CLAUSE), new ExtractedPage(2, WAITING_CLAUSE));
        }

        @Test
        @DisplayName("Should reject binary content")
        void shouldRejectBinary() {
            byte[] content = {0x50, 0x4B, 0x00, 0x03, 0x04};

            assertThat(extractor.extract(content, "text/plain")).isEmpty();
        }

        @Test
        @DisplayName("Should handle missing content")
        void shouldHandleEmptyInput() {
            assertThat(extractor.extract(null, "text/plain")).isEmpty();
            assertThat(extractor.extract(new byte[0], "application/pdf")).isEmpty();
        }
    }
}
