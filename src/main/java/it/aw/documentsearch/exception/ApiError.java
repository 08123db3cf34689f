package it.aw.documentsearch.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body JSON degli errori HTTP.
 */
public record ApiError(
        @JsonProperty("error_id") String errorId,   // id breve per correlare risposta e log
        String  code,
        String  detail,
        String  path,
        Instant timestamp
) {

    public static final String VALIDATION_ERROR   = "VALIDATION_001";
    public static final String SERVICE_FAILURE    = "SERVICE_001";
    public static final String FILE_NOT_FOUND     = "FILE_001";
    public static final String INVALID_FILE       = "FILE_002";
    public static final String FILE_STORAGE_ERROR = "FILE_003";
    public static final String INTERNAL_ERROR     = "INTERNAL_001";
}
