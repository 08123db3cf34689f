package it.aw.documentsearch.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import javax.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;

/**
 * Traduce le eccezioni dei controller in risposte {@link ApiError}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ServiceFailureException.class)
    public ResponseEntity<ApiError> handleServiceFailure(ServiceFailureException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Errore servizio [{}] su {}: {}", errorId, request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.SERVICE_FAILURE, ex.getMessage(), request);
    }

    @ExceptionHandler(SourceFileNotFoundException.class)
    public ResponseEntity<ApiError> handleFileNotFound(SourceFileNotFoundException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("File non trovato [{}]: {}", errorId, ex.getFilename());
        return build(HttpStatus.NOT_FOUND, errorId, ApiError.FILE_NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidFileException.class)
    public ResponseEntity<ApiError> handleInvalidFile(InvalidFileException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("File rifiutato [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_FILE, ex.getMessage(), request);
    }

    @ExceptionHandler(FileStorageException.class)
    public ResponseEntity<ApiError> handleFileStorage(FileStorageException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Errore I/O [{}] su {}: {}", errorId, request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.FILE_STORAGE_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiError> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Parte multipart mancante [{}]: {}", errorId, ex.getRequestPartName());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR,
                "Missing request part '" + ex.getRequestPartName() + "'", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed");
        log.warn("Richiesta non valida [{}]: {}", errorId, detail);
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, detail, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Body non leggibile [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "Malformed request body", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Errore inatteso [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "Internal error: " + ex.getMessage(), request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String errorId, String code,
                                           String detail, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, detail, request.getRequestURI(), Instant.now()));
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
