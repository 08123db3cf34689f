package it.aw.documentsearch.exception;

/**
 * Errore interno di un endpoint, già formattato per il client
 * (es. "Search error: ..."). Mappato a HTTP 500 da {@link GlobalExceptionHandler}.
 */
public class ServiceFailureException extends RuntimeException {

    public ServiceFailureException(String detail, Throwable cause) {
        super(detail, cause);
    }
}
