package it.aw.documentsearch.model;

/**
 * Vicino restituito da una query kNN, con la distanza calcolata dallo store.
 */
public record VectorMatch(StoredChunk chunk, double distance) {}
