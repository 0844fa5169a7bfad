package ch.so.arp.rag.docqa;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns fetched bytes into page texts. PDFs are read page by page with PDFBox
 * (pages numbered from 1); anything else is decoded as UTF-8 plain text and
 * returned as a single unpaged text.
 */
class DocumentTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTextExtractor.class);

    List<PageText> extract(FetchedDocument document, String source) {
        if (!document.isPdf()) {
            return List.of(PageText.unpaged(new String(document.content(), StandardCharsets.UTF_8)));
        }
        try (PDDocument pdf = Loader.loadPDF(document.content())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            int pageCount = pdf.getNumberOfPages();
            List<PageText> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(new PageText(page, stripper.getText(pdf)));
            }
            LOGGER.debug("Extracted {} pages from {}", pageCount, source);
            return pages;
        } catch (IOException ex) {
            throw new ExtractionException(source, "Failed to read PDF " + source + ": " + ex.getMessage(), ex);
        }
    }
}
