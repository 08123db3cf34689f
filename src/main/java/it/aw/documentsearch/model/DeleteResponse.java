package it.aw.documentsearch.model;

/** Risposta di DELETE /api/v1/files/{filename}. */
public record DeleteResponse(String message, String filename) {}
