package it.aw.documentsearch.model;

/**
 * Risultato di una ricerca semantica.
 * <p>
 * {@code score} è la distanza grezza restituita dallo store: più è bassa,
 * più il chunk è simile alla query. Non è normalizzata.
 */
public record SearchResult(
        String id,       // null se lo store non restituisce l'id
        String text,
        int    page,     // 0 se il metadato manca
        String source,   // "" se il metadato manca
        double score
) {}
