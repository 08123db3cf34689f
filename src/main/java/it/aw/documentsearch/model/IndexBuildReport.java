package it.aw.documentsearch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Esito di una build dell'indice. I campi null non vengono serializzati:
 * un report di errore contiene solo success, error, message ed eventualmente
 * files_processed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexBuildReport(
        boolean success,
        String  message,
        @JsonProperty("total_chunks")    Integer          totalChunks,
        @JsonProperty("previous_chunks") Integer          previousChunks,
        @JsonProperty("files_processed") List<FileReport> filesProcessed,
        @JsonProperty("embedding_model") String           embeddingModel,
        @JsonProperty("collection_name") String           collectionName,
        String  error
) {

    public static IndexBuildReport succeeded(int totalChunks, int previousChunks,
                                             List<FileReport> filesProcessed,
                                             String embeddingModel, String collectionName) {
        return new IndexBuildReport(true, "Index built successfully", totalChunks, previousChunks,
                List.copyOf(filesProcessed), embeddingModel, collectionName, null);
    }

    /** Errore prima della scansione dei file: nessun files_processed. */
    public static IndexBuildReport failed(String error, String message) {
        return new IndexBuildReport(false, message, null, null, null, null, null, error);
    }

    /** Errore dopo la scansione: riporta i file già elaborati. */
    public static IndexBuildReport failed(String error, String message, List<FileReport> filesProcessed) {
        return new IndexBuildReport(false, message, null, null,
                List.copyOf(filesProcessed), null, null, error);
    }
}
