package it.aw.documentsearch.exception;

public class ModelLoadException extends DocumentSearchException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
