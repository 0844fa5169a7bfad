package ch.so.arp.rag.docqa;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.function.Supplier;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Requires {@code Authorization: Bearer <api key>} on the protected endpoints.
 */
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final Supplier<String> apiKey;

    public ApiKeyInterceptor(Supplier<String> apiKey) {
        this.apiKey = apiKey;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String expected = apiKey.get();
        if (!StringUtils.hasText(expected)) {
            throw ApiKeyException.notConfigured();
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw ApiKeyException.invalid();
        }
        String presented = header.substring(BEARER_PREFIX.length()).trim();
        if (!MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8))) {
            throw ApiKeyException.invalid();
        }
        return true;
    }
}
