package ch.so.arp.rag.docqa;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Embeddings from the OpenAI {@code /embeddings} endpoint. Batches are limited
 * to {@value #BATCH_SIZE} inputs per request.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    static final int BATCH_SIZE = 64;

    private final OpenAiApi api;
    private final int dimension;

    OpenAiEmbeddingProvider(OpenAiApi api, int dimension) {
        this.api = Objects.requireNonNull(api, "api");
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            List<String> batch = texts.subList(from, Math.min(from + BATCH_SIZE, texts.size()));
            vectors.addAll(embedBatch(batch));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private List<float[]> embedBatch(List<String> batch) {
        ObjectNode body = api.objectMapper().createObjectNode();
        body.put("model", api.properties().getEmbeddingModel());
        body.put("dimensions", dimension);
        ArrayNode input = body.putArray("input");
        batch.forEach(input::add);

        JsonNode response;
        try {
            response = api.post("/embeddings", body);
        } catch (IOException ex) {
            throw new EmbeddingException("Embedding request failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for embeddings", ex);
        }

        JsonNode data = response.path("data");
        if (!data.isArray() || data.size() != batch.size()) {
            throw new EmbeddingException("Expected " + batch.size() + " embeddings but received " + data.size());
        }
        float[][] ordered = new float[batch.size()][];
        for (JsonNode item : data) {
            int index = item.path("index").asInt(-1);
            if (index < 0 || index >= ordered.length) {
                throw new EmbeddingException("Embedding response carried invalid index " + index);
            }
            ordered[index] = toVector(item.path("embedding"));
        }
        LOGGER.debug("Embedded batch of {} texts", batch.size());
        return List.of(ordered);
    }

    private float[] toVector(JsonNode embedding) {
        if (embedding.size() != dimension) {
            throw new DimensionMismatchException(dimension, embedding.size());
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) embedding.get(i).asDouble();
        }
        return vector;
    }
}
