package ch.so.arp.rag.docqa;

/**
 * Loads the raw bytes of a document identified by a URL or path.
 */
public interface DocumentFetcher {

    /**
     * @throws DownloadException if the document cannot be retrieved
     */
    FetchedDocument fetch(String identifier);
}
