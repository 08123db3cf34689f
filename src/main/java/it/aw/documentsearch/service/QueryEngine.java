package it.aw.documentsearch.service;

import it.aw.documentsearch.model.CollectionStats;
import it.aw.documentsearch.model.SearchResult;
import it.aw.documentsearch.model.StoredChunk;
import it.aw.documentsearch.model.VectorMatch;
import it.aw.documentsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Esegue ricerche semantiche sulla collection.
 * <p>
 * I risultati sono nell'ordine restituito dallo store (distanza crescente) e
 * riportano la distanza grezza come score: nessun riordinamento, nessuna
 * deduplicazione. Gli errori di embedding e dello store non vengono catturati.
 */
@Service
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    public static final int MIN_K = 1;
    public static final int MAX_K = 20;

    /** Righe lette per ricavare l'elenco delle sorgenti. */
    static final int SOURCES_SAMPLE_SIZE = 100;

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final String collectionName;

    public QueryEngine(EmbeddingService embeddingService,
                       VectorStore vectorStore,
                       @Value("${store.collection-name}") String collectionName) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.collectionName = collectionName;
        // lato query il modello si carica subito, non alla prima ricerca
        embeddingService.ensureModelLoaded();
    }

    /**
     * Cerca i chunk più vicini alla query testuale.
     *
     * @param query testo della query
     * @param k     numero massimo di risultati, tra {@value #MIN_K} e {@value #MAX_K}
     * @return risultati ordinati per score crescente; vuota se la collection è vuota
     */
    public List<SearchResult> search(String query, int k) {
        if (k < MIN_K || k > MAX_K) {
            throw new IllegalArgumentException("k deve essere tra " + MIN_K + " e " + MAX_K + " (ricevuto: " + k + ")");
        }
        float[] queryVector = embeddingService.embedQuery(query);
        List<VectorMatch> matches = vectorStore.query(collectionName, queryVector, k);

        List<SearchResult> results = new ArrayList<>(matches.size());
        for (VectorMatch match : matches) {
            StoredChunk chunk = match.chunk();
            results.add(new SearchResult(
                    chunk.id(),
                    chunk.text(),
                    chunk.page() != null ? chunk.page() : 0,
                    chunk.source() != null ? chunk.source() : "",
                    match.distance()
            ));
        }
        log.debug("Query '{}' (k={}): {} risultati", query, k, results.size());
        return results;
    }

    /**
     * Statistiche della collection. {@code sources} è ricavato dalle prime
     * {@value #SOURCES_SAMPLE_SIZE} righe e non è garantito completo.
     */
    public CollectionStats getCollectionStats() {
        int total = vectorStore.count(collectionName);
        Set<String> sources = new LinkedHashSet<>();
        for (StoredChunk chunk : vectorStore.peek(collectionName, SOURCES_SAMPLE_SIZE)) {
            if (chunk.source() != null) {
                sources.add(chunk.source());
            }
        }
        return new CollectionStats(total, collectionName, embeddingService.getModelName(), List.copyOf(sources));
    }
}
