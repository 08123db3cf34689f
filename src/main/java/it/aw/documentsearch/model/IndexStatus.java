package it.aw.documentsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stato del job di build asincrona, restituito da GET /api/v1/index/status.
 */
public record IndexStatus(
        @JsonProperty("is_running")  boolean          running,
        @JsonProperty("last_result") IndexBuildReport lastResult,   // null se nessuna build è terminata
        String progress                                             // null se nessuna build è in corso
) {}
