package it.aw.documentsearch.exception;

/** Il modello di embedding non è riuscito a codificare uno o più testi. */
public class EncodingException extends DocumentSearchException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
