package ch.so.arp.rag.docqa;

import java.util.Objects;

/**
 * Contiguous span of document text together with its provenance. Chunks are
 * created while a document is indexed and never change afterwards.
 *
 * @param text         the chunk text as decoded from its token window
 * @param source       identifier of the document the chunk was taken from
 * @param page         1-based page of the first token, {@code null} if the
 *                     extraction was not page aware
 * @param clauseNumber dotted clause numeral found in the chunk, {@code null} if
 *                     none was detected
 */
public record Chunk(String text, String source, Integer page, String clauseNumber) {

    public Chunk {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
        if (page != null && page < 1) {
            throw new IllegalArgumentException("page must be positive, was " + page);
        }
    }
}
