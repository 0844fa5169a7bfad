package ch.so.arp.rag.docqa;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding provider that derives a pseudo-random unit vector from the SHA-256
 * of the text. Equal texts get equal vectors, but similarity carries no meaning.
 * It lets the service run without a model or API key.
 */
class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private final int dimensions;

    DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        Random random = new Random(seed(text == null ? "" : text));
        float[] vector = new float[dimensions];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (random.nextFloat() * 2.0f) - 1.0f;
        }
        return VectorIndex.normalize(vector);
    }

    @Override
    public int dimension() {
        return dimensions;
    }

    /**
     * First eight bytes of the text's SHA-256, big-endian.
     */
    static long seed(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest).getLong();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not supported by this JVM", ex);
        }
    }
}
