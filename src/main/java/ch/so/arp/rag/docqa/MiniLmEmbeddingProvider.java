package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;

/**
 * Local sentence embeddings computed in-process with the quantised
 * all-MiniLM-L6-v2 model. No network access or API key is needed.
 */
class MiniLmEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(MiniLmEmbeddingProvider.class);

    static final int DIMENSION = 384;

    private final EmbeddingModel model;

    MiniLmEmbeddingProvider() {
        this(new AllMiniLmL6V2QuantizedEmbeddingModel());
        LOGGER.info("Using local all-MiniLM-L6-v2 (quantised) embeddings");
    }

    MiniLmEmbeddingProvider(EmbeddingModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
        List<Embedding> embeddings;
        try {
            embeddings = model.embedAll(segments).content();
        } catch (RuntimeException ex) {
            throw new EmbeddingException("Local embedding model failed: " + ex.getMessage(), ex);
        }
        if (embeddings.size() != texts.size()) {
            throw new EmbeddingException("Expected " + texts.size() + " embeddings but received " + embeddings.size());
        }
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            vectors.add(embedding.vector());
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return DIMENSION;
    }
}
