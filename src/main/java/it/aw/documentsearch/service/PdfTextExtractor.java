package it.aw.documentsearch.service;

import it.aw.documentsearch.exception.ExtractionException;
import it.aw.documentsearch.model.PageText;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Estrattore PDF pagina per pagina via PDFBox.
 * <p>
 * Ogni pagina viene estratta separatamente impostando start/end page sullo
 * stripper, così il numero di pagina di ogni chunk è noto senza dover mappare
 * offset nel testo concatenato.
 */
@Component
public class PdfTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    @Override
    public List<PageText> extractPages(Path file) {
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            int totalPages = doc.getNumberOfPages();
            log.debug("PdfTextExtractor: {} pagine trovate in {}", totalPages, file.getFileName());

            PDFTextStripper stripper = new PDFTextStripper();
            List<PageText> pages = new ArrayList<>(totalPages);
            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                pages.add(new PageText(p, stripper.getText(doc)));
            }
            return pages;
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(file.getFileName().toString(), e);
        }
    }
}
