package it.aw.documentsearch.exception;

/**
 * Radice degli errori della pipeline di indicizzazione e ricerca.
 * <p>
 * Dentro {@code IndexBuilder} ogni sottoclasse viene catturata dalla fase che la
 * solleva e convertita nel campo {@code error} del report; in {@code QueryEngine}
 * si propaga fino al controller.
 */
public abstract class DocumentSearchException extends RuntimeException {

    protected DocumentSearchException(String message) {
        super(message);
    }

    protected DocumentSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
