package ch.so.arp.rag.docqa;

import java.time.Instant;

/**
 * Error body returned by all endpoints.
 *
 * @param code machine readable error code
 */
public record ApiError(String code, String message, String path, Instant timestamp) {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String API_KEY_NOT_CONFIGURED = "API_KEY_NOT_CONFIGURED";
    public static final String DOWNLOAD_FAILED = "DOWNLOAD_FAILED";
    public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";
    public static final String EMBEDDING_FAILED = "EMBEDDING_FAILED";
    public static final String GENERATION_FAILED = "GENERATION_FAILED";
    public static final String CORPUS_NOT_INDEXED = "CORPUS_NOT_INDEXED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
