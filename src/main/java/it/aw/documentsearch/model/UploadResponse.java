package it.aw.documentsearch.model;

/** Risposta di POST /api/v1/files/upload. */
public record UploadResponse(String message, String filename, String filepath, long size) {}
