package it.aw.documentsearch.model;

/**
 * Esito di una singola fase della build: o un valore, o un errore.
 * <p>
 * {@code message} è il suggerimento per l'utente da riportare nel report
 * (può essere null).
 */
public record StageResult<T>(T value, String error, String message) {

    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(value, null, null);
    }

    public static <T> StageResult<T> failed(String error) {
        return new StageResult<>(null, error, null);
    }

    public static <T> StageResult<T> failed(String error, String message) {
        return new StageResult<>(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
