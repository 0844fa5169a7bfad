package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for chunks and questions.
 * Implementations can either call a remote embedding API, run a local model or
 * provide deterministic placeholders that are suited for tests and local
 * development. All vectors of one provider share {@link #dimension()}.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    float[] embed(String text);

    /**
     * Embed a batch of texts. The result has one vector per input, in input
     * order.
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * @return the length of every vector produced by this provider
     */
    int dimension();
}
