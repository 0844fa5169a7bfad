package ch.so.arp.rag.docqa;

/**
 * Opaque failure of the answer generation boundary (network, quota, malformed
 * response). The message is surfaced to the caller without interpretation.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
