package com.phillippitts.selfconsistency.service.document;

import com.phillippitts.selfconsistency.exception.DocumentExtractionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF text extraction with Apache PDFBox, page by page.
 *
 * <p>Pages without extractable text (scans, images) are skipped and reported as warnings;
 * a document where no page has text is rejected.
 */
@Component
public class PdfBoxDocumentExtractor implements DocumentExtractor {

    private static final Logger LOG = LogManager.getLogger(PdfBoxDocumentExtractor.class);

    @Override
    public ExtractedDocument extract(byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentExtractionException("Uploaded PDF is empty");
        }
        try (PDDocument document = Loader.loadPDF(content)) {
            int pageCount = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(pageCount);
            List<Integer> emptyPages = new ArrayList<>();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document);
                if (text == null || text.isBlank()) {
                    emptyPages.add(page);
                } else {
                    pages.add("--- Page " + page + " ---\n" + text.strip());
                }
            }

            if (pages.isEmpty()) {
                throw new DocumentExtractionException("No text could be extracted from the PDF");
            }
            List<String> warnings = new ArrayList<>();
            if (!emptyPages.isEmpty()) {
                warnings.add("No extractable text on page(s) " + emptyPages);
            }
            LOG.info("Extracted PDF text: pages={}, pagesWithText={}", pageCount, pages.size());
            return new ExtractedDocument(String.join("\n\n", pages), pageCount, warnings);
        } catch (IOException e) {
            throw new DocumentExtractionException("Failed to extract text from PDF: " + e.getMessage(), e);
        }
    }
}
