package it.aw.documentsearch.service;

import it.aw.documentsearch.exception.ExtractionException;
import it.aw.documentsearch.model.PageText;

import java.nio.file.Path;
import java.util.List;

/**
 * Estrae il testo di un documento pagina per pagina.
 */
public interface TextExtractor {

    /**
     * @param file documento da leggere
     * @return una voce per pagina, numerate da 1 nell'ordine di estrazione
     * @throws ExtractionException se il file non può essere letto o interpretato
     */
    List<PageText> extractPages(Path file);
}
