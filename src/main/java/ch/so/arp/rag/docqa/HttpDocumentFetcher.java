package ch.so.arp.rag.docqa;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches documents over {@code http}/{@code https} or from the local file
 * system ({@code file:} URIs and plain paths).
 */
class HttpDocumentFetcher implements DocumentFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpDocumentFetcher.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    HttpDocumentFetcher(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).followRedirects(HttpClient.Redirect.NORMAL).build(),
                timeout);
    }

    HttpDocumentFetcher(HttpClient httpClient, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public FetchedDocument fetch(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new DownloadException(identifier, "Document identifier must not be blank");
        }
        String trimmed = identifier.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return download(trimmed);
        }
        return readFile(trimmed);
    }

    private FetchedDocument download(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET().build();
        } catch (IllegalArgumentException ex) {
            throw new DownloadException(url, "Invalid document URL: " + url, ex);
        }
        LOGGER.info("Downloading document {}", url);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException ex) {
            throw new DownloadException(url, "Failed to download document " + url + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DownloadException(url, "Interrupted while downloading " + url, ex);
        }
        if (response.statusCode() / 100 != 2) {
            throw new DownloadException(url,
                    "Failed to download document " + url + ": HTTP " + response.statusCode());
        }
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        LOGGER.debug("Downloaded {} bytes ({}) from {}", response.body().length, contentType, url);
        return new FetchedDocument(response.body(), contentType);
    }

    private FetchedDocument readFile(String identifier) {
        Path path;
        try {
            path = identifier.regionMatches(true, 0, "file:", 0, 5) ? Path.of(URI.create(identifier))
                    : Path.of(identifier);
        } catch (IllegalArgumentException ex) {
            throw new DownloadException(identifier, "Invalid document path: " + identifier, ex);
        }
        if (!Files.isRegularFile(path)) {
            throw new DownloadException(identifier, "Document not found: " + path);
        }
        try {
            return new FetchedDocument(Files.readAllBytes(path), Files.probeContentType(path));
        } catch (IOException ex) {
            throw new DownloadException(identifier, "Failed to read document " + path + ": " + ex.getMessage(), ex);
        }
    }
}
