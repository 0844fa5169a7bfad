package ch.so.arp.rag.docqa;

/**
 * Thrown when a document cannot be fetched from its source, e.g. because the
 * server answered with a non-success status or the request timed out.
 */
public class DownloadException extends RuntimeException {

    private final String source;

    public DownloadException(String source, String message) {
        super(message);
        this.source = source;
    }

    public DownloadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
