package ch.so.arp.rag.docqa;

/** Exception thrown when an embedding provider fails to produce vectors. */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
