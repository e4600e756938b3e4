package com.nevis.policy.ingest;

import com.nevis.policy.exception.ExtractionFailedException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfTextExtractorTest {

    private final PdfTextExtractor extractor = new PdfTextExtractor();

    @Test
    @DisplayName("Should extract text page by page with 1-based page numbers")
    void shouldExtractPages() throws IOException {
        byte[] pdf = PdfFixtures.pdf("Chapter 1 Introduction", "", "Paragraph 116 Design");

        List<PageText> pages = extractor.extract(pdf);

        assertThat(pages).extracting(PageText::pageNumber).containsExactly(1, 2, 3);
        assertThat(pages.get(0).text()).contains("Chapter 1 Introduction");
        assertThat(pages.get(1).text()).isBlank();
        assertThat(pages.get(2).text()).contains("Paragraph 116 Design");
    }

    @Test
    @DisplayName("Should reject an empty file")
    void shouldRejectEmptyFile() {
        assertThatThrownBy(() -> extractor.extract(new byte[0]))
            .isInstanceOf(ExtractionFailedException.class)
            .hasMessage("File is empty");
    }

    @Test
    @DisplayName("Should reject bytes that are not a PDF")
    void shouldRejectGarbage() {
        assertThatThrownBy(() -> extractor.extract("not a pdf at all".getBytes()))
            .isInstanceOf(ExtractionFailedException.class)
            .hasMessageStartingWith("PDF could not be read");
    }

    static final class PdfFixtures {

        private PdfFixtures() {
        }

        static byte[] pdf(String... pageTexts) throws IOException {
            try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                for (String text : pageTexts) {
                    PDPage page = new PDPage();
                    document.addPage(page);
                    if (text.isEmpty()) {
                        continue;
                    }
                    try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                        stream.beginText();
                        stream.setFont(PDType1Font.HELVETICA, 12);
                        stream.newLineAtOffset(72, 700);
                        stream.showText(text);
                        stream.endText();
                    }
                }
                document.save(out);
                return out.toByteArray();
            }
        }
    }
}
