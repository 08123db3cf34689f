package it.aw.documentsearch.model;

/**
 * Riga letta dal vector store. I metadati possono mancare (colonne NULL),
 * per cui page è un Integer.
 */
public record StoredChunk(
        String  id,
        String  text,
        Integer page,
        String  source,
        String  filePath
) {}
