package com.nevis.policy.ingest;

import com.nevis.policy.exception.ExtractionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class PdfTextExtractor {

    public List<PageText> extract(byte[] content) {
        if (content == null || content.length == 0) {
            throw new ExtractionFailedException("File is empty");
        }

        try (PDDocument pdf = PDDocument.load(content)) {
            int pageCount = pdf.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            List<PageText> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                pages.add(new PageText(page, text));
            }

            log.debug("Extracted {} pages", pageCount);
            return pages;
        } catch (IOException e) {
            throw new ExtractionFailedException("PDF could not be read: " + e.getMessage(), e);
        }
    }
}
