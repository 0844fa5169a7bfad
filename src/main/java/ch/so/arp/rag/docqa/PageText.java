package ch.so.arp.rag.docqa;

import java.util.Objects;

/**
 * Text of one extracted page. {@code page} is {@code null} for sources that have
 * no notion of pages (plain text).
 */
public record PageText(Integer page, String text) {

    public PageText {
        Objects.requireNonNull(text, "text");
    }

    public static PageText unpaged(String text) {
        return new PageText(null, text);
    }
}
