package it.aw.documentsearch.model;

/**
 * Un file della directory sorgente, come restituito da GET /api/v1/files.
 */
public record FileInfo(
        String filename,
        String filepath,
        long   size,        // byte
        String extension    // minuscola, con il punto: ".pdf"; "" se assente
) {}
