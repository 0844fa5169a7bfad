package ch.so.arp.rag.docqa;

import org.springframework.http.HttpStatus;

/**
 * Rejection of a request by the {@link ApiKeyInterceptor}.
 */
public class ApiKeyException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    private ApiKeyException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    static ApiKeyException notConfigured() {
        return new ApiKeyException(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.API_KEY_NOT_CONFIGURED,
                "API Key not configured on the server.");
    }

    static ApiKeyException invalid() {
        return new ApiKeyException(HttpStatus.UNAUTHORIZED, ApiError.UNAUTHORIZED, "Invalid or missing API Key");
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
