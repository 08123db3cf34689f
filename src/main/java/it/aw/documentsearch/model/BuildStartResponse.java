package it.aw.documentsearch.model;

/** Risposta di POST /api/v1/index/build. */
public record BuildStartResponse(boolean success, String message) {}
