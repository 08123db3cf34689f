package it.aw.documentsearch.exception;

/** Il file richiesto non esiste nella directory sorgente. */
public class SourceFileNotFoundException extends DocumentSearchException {

    private final String filename;

    public SourceFileNotFoundException(String filename) {
        super("File '" + filename + "' not found");
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
