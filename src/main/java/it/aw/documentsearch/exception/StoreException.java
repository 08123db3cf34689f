package it.aw.documentsearch.exception;

/** Errore di creazione, cancellazione, inserimento o query sul vector store. */
public class StoreException extends DocumentSearchException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
