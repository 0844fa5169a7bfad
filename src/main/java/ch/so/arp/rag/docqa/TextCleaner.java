package ch.so.arp.rag.docqa;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalises extracted text before chunking: Unicode NFKC, hyphenated line
 * breaks joined, single line breaks merged into spaces while paragraph breaks
 * survive, runs of whitespace collapsed.
 */
public final class TextCleaner {

    private static final Pattern HYPHENATED_BREAK = Pattern.compile("-\\n");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n{2,}");
    private static final Pattern SINGLE_BREAK = Pattern.compile("(?<!\\n)\\n(?!\\n)");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern SPACE_AROUND_BREAK = Pattern.compile(" ?\\n\\n ?");

    private TextCleaner() {
    }

    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = Normalizer.normalize(text, Normalizer.Form.NFKC);
        cleaned = cleaned.replace("\r\n", "\n");
        cleaned = HYPHENATED_BREAK.matcher(cleaned).replaceAll("");
        cleaned = PARAGRAPH_BREAK.matcher(cleaned).replaceAll("\n\n");
        cleaned = SINGLE_BREAK.matcher(cleaned).replaceAll(" ");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = SPACE_AROUND_BREAK.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }
}
