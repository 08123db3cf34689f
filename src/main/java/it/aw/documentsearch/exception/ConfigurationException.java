package it.aw.documentsearch.exception;

/** Directory sorgente assente o senza file PDF. */
public class ConfigurationException extends DocumentSearchException {

    public ConfigurationException(String message) {
        super(message);
    }
}
