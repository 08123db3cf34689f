package it.aw.documentsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Statistiche sulla collection interrogata.
 * <p>
 * {@code totalChunks} è il conteggio esatto. {@code sources} è invece ricavato
 * da un campione delle prime righe salvate e può essere incompleto quando la
 * collection contiene molti chunk di molti file diversi.
 */
public record CollectionStats(
        @JsonProperty("total_chunks")    int          totalChunks,
        @JsonProperty("collection_name") String       collectionName,
        @JsonProperty("embedding_model") String       embeddingModel,
        List<String> sources
) {}
