package ch.so.arp.rag.docqa;

/**
 * Thrown when a fetched document yields no usable text, either because it
 * cannot be parsed or because nothing is left after cleaning.
 */
public class ExtractionException extends RuntimeException {

    private final String source;

    public ExtractionException(String source, String message) {
        super(message);
        this.source = source;
    }

    public ExtractionException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
