package it.aw.documentsearch.model;

/**
 * Testo estratto da una singola pagina.
 *
 * @param page numero di pagina 1-based, nell'ordine di estrazione
 * @param text testo grezzo della pagina (può essere vuoto)
 */
public record PageText(int page, String text) {}
