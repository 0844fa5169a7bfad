package ch.so.arp.rag.docqa;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort detection of dotted clause numerals such as {@code 4.2} or
 * {@code 3.1.2}, optionally introduced by "Clause" or "Section". A missing or
 * wrong match is never an error; callers treat the result as an annotation.
 */
public final class ClauseNumberExtractor {

    private static final int HEADING_WINDOW = 200;

    private static final Pattern CHUNK_CLAUSE = Pattern.compile(
            "(?:(?:clause|section)\\s*)?(\\d+(?:\\.\\d+)+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern QUERY_CLAUSE = Pattern.compile(
            "(?:\\b[Cc]lause\\b|\\b[Ss]ection\\b)?\\s*:?\\.?\\s*(\\d+(?:\\.\\d+)+)");

    private ClauseNumberExtractor() {
    }

    /**
     * Looks at the heading area of the chunk first, then at the whole chunk.
     */
    public static Optional<String> fromChunk(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> heading = firstMatch(CHUNK_CLAUSE, text.substring(0, Math.min(HEADING_WINDOW, text.length())));
        return heading.isPresent() ? heading : firstMatch(CHUNK_CLAUSE, text);
    }

    /**
     * Detects a clause reference in a user question, e.g. "What does clause 4.2 say?".
     */
    public static Optional<String> fromQuery(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        return firstMatch(QUERY_CLAUSE, query);
    }

    private static Optional<String> firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
