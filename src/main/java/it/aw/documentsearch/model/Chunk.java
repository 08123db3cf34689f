package it.aw.documentsearch.model;

/**
 * Porzione di testo di una pagina PDF, pronta per l'embedding.
 * <p>
 * Prodotta solo durante l'indicizzazione; una volta salvata nello store
 * non viene più modificata.
 */
public record Chunk(
        String id,        // "chunk_<n>", assegnato in ordine file → pagina → chunk
        String text,
        int    page,      // 1-based
        String source,    // nome file senza path
        String filePath   // path completo del file di origine
) {

    public Chunk {
        if (page < 1) {
            throw new IllegalArgumentException("page deve essere >= 1 (ricevuto: " + page + ")");
        }
    }
}
