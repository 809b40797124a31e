package com.policyqa.indexing;

import com.policyqa.config.IndexingProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls per-page text out of uploaded bytes. Unreadable input yields an empty list rather than an error.
 */
@Slf4j
@Component
public class TextExtractor {

    static final String PDF = "application/pdf";

    public List<ExtractedPage> extract(byte[] content, String contentType) {
        if (content == null || content.length == 0) {
            return List.of();
        }
        String type = contentType == null ? "" : IndexingProperties.baseType(contentType);
        if (PDF.equals(type)) {
            return extractPdf(content);
        }
        return extractPlainText(content);
    }

    private List<ExtractedPage> extractPdf(byte[] content) {
        try (PDDocument pdf = Loader.loadPDF(content)) {
            int pageCount = pdf.getNumberOfPages();
            List<ExtractedPage> pages = new ArrayList<>(pageCount);
            PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= pageCount; page++) {
                try {
                    stripper.setStartPage(page);
                    stripper.setEndPage(page);
                    pages.add(new ExtractedPage(page, stripper.getText(pdf)));
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable PDF page {}: {}", page, e.getMessage());
                }
            }
            return pages;
        } catch (IOException e) {
            log.warn("PDF could not be parsed: {}", e.getMessage());
            return List.of();
        }
    }

    private List<ExtractedPage> extractPlainText(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.indexOf('\u0000') >= 0) {
            log.warn("Plain text upload contains binary data, treating as unextractable");
            return List.of();
        }
        String[] parts = text.split("\f");
        List<ExtractedPage> pages = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            pages.add(new ExtractedPage(i + 1, parts[i]));
        }
        return pages;
    }
}
