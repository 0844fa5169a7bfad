package ch.so.arp.rag.docqa;

/**
 * Thrown when the corpus is searched before any folder has been indexed and no
 * snapshot is available.
 */
public class CorpusNotIndexedException extends RuntimeException {

    public CorpusNotIndexedException() {
        super("No corpus has been indexed yet");
    }
}
