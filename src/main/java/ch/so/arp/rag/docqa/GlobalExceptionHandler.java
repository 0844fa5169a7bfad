package ch.so.arp.rag.docqa;

import java.time.Instant;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps exceptions of the question and corpus pipelines to {@link ApiError}
 * responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ApiKeyException.class)
    public ResponseEntity<ApiError> handleApiKey(ApiKeyException ex, HttpServletRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            LOGGER.error("Rejected request to {}: {}", request.getRequestURI(), ex.getMessage());
        } else {
            LOGGER.warn("Rejected request to {}: {}", request.getRequestURI(), ex.getMessage());
        }
        return error(ex.getStatus(), ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOGGER.warn("Invalid request to {}: {}", request.getRequestURI(), message);
        return error(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        LOGGER.warn("Unreadable request body for {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, "Malformed request body", request);
    }

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ApiError> handleDimensionMismatch(DimensionMismatchException ex,
            HttpServletRequest request) {
        LOGGER.error("Embedding dimension mismatch for {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.INTERNAL_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        LOGGER.warn("Invalid parameter for {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(DownloadException.class)
    public ResponseEntity<ApiError> handleDownload(DownloadException ex, HttpServletRequest request) {
        LOGGER.error("Download of {} failed: {}", ex.getSource(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, ApiError.DOWNLOAD_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ApiError> handleExtraction(ExtractionException ex, HttpServletRequest request) {
        LOGGER.error("Extraction of {} failed: {}", ex.getSource(), ex.getMessage(), ex);
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ApiError.EXTRACTION_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<ApiError> handleEmbedding(EmbeddingException ex, HttpServletRequest request) {
        LOGGER.error("Embedding failed for {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, ApiError.EMBEDDING_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ApiError> handleGeneration(GenerationException ex, HttpServletRequest request) {
        LOGGER.error("Answer generation failed for {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, ApiError.GENERATION_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(CorpusNotIndexedException.class)
    public ResponseEntity<ApiError> handleCorpusNotIndexed(CorpusNotIndexedException ex, HttpServletRequest request) {
        LOGGER.warn("Corpus search without index: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ApiError.CORPUS_NOT_INDEXED, ex.getMessage(), request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiError> handleUnexpected(RuntimeException ex, HttpServletRequest request) {
        LOGGER.error("Failed to process request to {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.INTERNAL_ERROR, "Internal error: " + ex.getMessage(),
                request);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message,
            HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(code, message, request.getRequestURI(), Instant.now()));
    }
}
