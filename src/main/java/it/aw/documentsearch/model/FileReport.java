package it.aw.documentsearch.model;

/**
 * Esito dell'estrazione di un singolo file durante la build dell'indice.
 */
public record FileReport(String filename, int pages, int chunks) {}
