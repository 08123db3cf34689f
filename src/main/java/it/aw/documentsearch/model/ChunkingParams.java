package it.aw.documentsearch.model;

/**
 * Parametri di chunking usati da {@link it.aw.documentsearch.service.ChunkSplitter}.
 * <p>
 * {@code chunkSize} è la soglia in caratteri che fa chiudere il chunk corrente,
 * non un limite rigido: un paragrafo più lungo viene comunque emesso intero.
 * {@code overlap} è il numero di caratteri finali del chunk chiuso che vengono
 * ripetuti in testa al successivo.
 */
public record ChunkingParams(int chunkSize, int overlap) {

    public static final int DEFAULT_CHUNK_SIZE = 1500;
    public static final int DEFAULT_OVERLAP    = 200;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize deve essere >= 1 (ricevuto: " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") deve essere < chunkSize (" + chunkSize + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }
}
