package it.aw.documentsearch.exception;

/** Errore di I/O su un file della directory sorgente. */
public class FileStorageException extends DocumentSearchException {

    public FileStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
