package it.aw.documentsearch.store;

import it.aw.documentsearch.exception.StoreException;
import it.aw.documentsearch.model.Chunk;
import it.aw.documentsearch.model.StoredChunk;
import it.aw.documentsearch.model.VectorMatch;

import java.util.List;

/**
 * Archivio persistente di chunk e vettori, suddiviso in collection nominate.
 * <p>
 * Tutti i metodi lanciano {@link StoreException} in caso di errore.
 * Una collection non ancora popolata si comporta come una collection vuota.
 */
public interface VectorStore {

    /** Numero esatto di chunk nella collection. */
    int count(String collection);

    /** Cancella tutti i chunk della collection e restituisce quanti ne sono stati rimossi. */
    int deleteAll(String collection);

    /**
     * Inserisce i chunk con i rispettivi vettori. Le due liste sono allineate per indice;
     * gli id devono essere univoci nella collection.
     */
    void add(String collection, List<Chunk> chunks, List<float[]> vectors);

    /**
     * I {@code k} chunk più vicini al vettore dato, per distanza crescente.
     * Restituisce meno di {@code k} elementi se la collection è più piccola.
     */
    List<VectorMatch> query(String collection, float[] vector, int k);

    /** I primi {@code limit} chunk in ordine di inserimento. */
    List<StoredChunk> peek(String collection, int limit);

    DistanceMetric getDistanceMetric();
}
