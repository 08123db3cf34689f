package it.aw.documentsearch.exception;

/** Upload rifiutato: nome non valido, file vuoto o estensione non ammessa. */
public class InvalidFileException extends DocumentSearchException {

    public InvalidFileException(String message) {
        super(message);
    }
}
