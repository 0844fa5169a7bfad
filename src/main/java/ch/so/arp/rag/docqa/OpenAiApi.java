package ch.so.arp.rag.docqa;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Minimal JSON-over-HTTP access to the OpenAI REST API shared by the chat and
 * embedding clients.
 */
class OpenAiApi {

    private final OpenAiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    OpenAiApi(OpenAiClientProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, HttpClient.newBuilder().connectTimeout(properties.getTimeout()).build());
    }

    OpenAiApi(OpenAiClientProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.qa.openai.api-key' or 'spring.ai.openai.api-key' must be provided "
                            + "when OpenAI is used");
        }
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    OpenAiClientProperties properties() {
        return properties;
    }

    /**
     * POSTs the body to {@code baseUrl + path} and returns the parsed response.
     *
     * @throws IOException on transport failures, non-2xx responses or unreadable
     *         JSON
     */
    JsonNode post(String path, ObjectNode body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(properties.getBaseUrl()) + path))
                .timeout(properties.getTimeout())
                .header("Authorization", "Bearer " + properties.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body),
                        StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() / 100 != 2) {
            throw new IOException("OpenAI " + path + " returned HTTP " + response.statusCode() + ": "
                    + abbreviate(response.body()));
        }
        return objectMapper.readTree(response.body());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
