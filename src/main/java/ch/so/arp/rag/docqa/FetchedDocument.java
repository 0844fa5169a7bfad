package ch.so.arp.rag.docqa;

import java.util.Locale;
import java.util.Objects;

/**
 * Raw document bytes as returned by a {@link DocumentFetcher}.
 *
 * @param content     the document body
 * @param contentType media type reported by the source, {@code null} if unknown
 */
public record FetchedDocument(byte[] content, String contentType) {

    public FetchedDocument {
        Objects.requireNonNull(content, "content");
    }

    /**
     * @return {@code true} if the content starts with the PDF magic bytes or the
     *         source declared it as PDF
     */
    public boolean isPdf() {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("application/pdf")) {
            return true;
        }
        return content.length >= 5 && content[0] == '%' && content[1] == 'P' && content[2] == 'D'
                && content[3] == 'F' && content[4] == '-';
    }
}
