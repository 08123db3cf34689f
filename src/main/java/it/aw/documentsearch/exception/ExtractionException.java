package it.aw.documentsearch.exception;

/** Un file specifico non è leggibile come PDF. */
public class ExtractionException extends DocumentSearchException {

    private final String filename;

    public ExtractionException(String filename, Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
