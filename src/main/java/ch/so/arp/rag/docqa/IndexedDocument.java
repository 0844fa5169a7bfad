package ch.so.arp.rag.docqa;

import java.util.Objects;

/**
 * A built vector index together with the chunk metadata of its rows, cached
 * under the document's fingerprint.
 */
public record IndexedDocument(String fingerprint, VectorIndex index, ChunkMetadataTable metadata) {

    public IndexedDocument {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(metadata, "metadata");
        if (index.size() != metadata.size()) {
            throw new IllegalStateException("Index has " + index.size() + " rows but metadata describes "
                    + metadata.size() + " chunks for " + fingerprint);
        }
    }

    public int size() {
        return index.size();
    }
}
