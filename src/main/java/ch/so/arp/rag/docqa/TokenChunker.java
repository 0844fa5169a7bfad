package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;

/**
 * Splits cleaned document text into overlapping token windows. The text is
 * tokenised with a BPE encoding, windows of {@code chunkSize} tokens are cut
 * every {@code chunkSize - overlap} tokens and decoded back to text. The same
 * input and parameters always produce the same windows, which keeps index
 * rebuilds reproducible.
 */
public class TokenChunker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenChunker.class);

    private static final int NO_PAGE = 0;

    private final Encoding encoding;

    public TokenChunker(Encoding encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    /**
     * Chunker backed by the {@code cl100k_base} encoding.
     */
    public static TokenChunker cl100k() {
        return new TokenChunker(Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE));
    }

    public List<String> chunk(String text, int chunkSize, int overlap) {
        return chunk(text, new ChunkingParameters(chunkSize, overlap));
    }

    public List<String> chunk(String text, ChunkingParameters parameters) {
        Objects.requireNonNull(parameters, "parameters");
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return chunkPages(List.of(PageText.unpaged(text)), parameters).stream().map(TextWindow::text).toList();
    }

    /**
     * Chunks a page-aware document. Pages are tokenised one by one and their
     * token streams concatenated, so a window may span a page break; every
     * window reports the page of its first token.
     */
    public List<TextWindow> chunkPages(List<PageText> pages, ChunkingParameters parameters) {
        Objects.requireNonNull(pages, "pages");
        Objects.requireNonNull(parameters, "parameters");

        IntArrayList tokens = new IntArrayList();
        IntArrayList tokenPages = new IntArrayList();
        for (PageText page : pages) {
            if (page.text().isBlank()) {
                continue;
            }
            IntArrayList pageTokens = encoding.encodeOrdinary(page.text());
            int pageMark = page.page() == null ? NO_PAGE : page.page();
            for (int i = 0; i < pageTokens.size(); i++) {
                tokens.add(pageTokens.get(i));
                tokenPages.add(pageMark);
            }
        }

        List<TokenWindow> windows = windows(tokens.size(), parameters);
        List<TextWindow> result = new ArrayList<>(windows.size());
        for (TokenWindow window : windows) {
            IntArrayList slice = new IntArrayList(window.length());
            for (int i = window.start(); i < window.end(); i++) {
                slice.add(tokens.get(i));
            }
            int pageMark = tokenPages.get(window.start());
            result.add(new TextWindow(encoding.decode(slice), pageMark == NO_PAGE ? null : pageMark));
        }
        LOGGER.debug("Chunked {} tokens into {} windows (chunkSize={}, overlap={})", tokens.size(), result.size(),
                parameters.chunkSize(), parameters.overlap());
        return result;
    }

    public int countTokens(String text) {
        return text == null ? 0 : encoding.countTokensOrdinary(text);
    }

    /**
     * Window boundaries over a token sequence of the given length. Starts are
     * {@code 0, stride, 2 * stride, ...} while below {@code tokenCount}; the last
     * window may be shorter than {@code chunkSize}.
     */
    public static List<TokenWindow> windows(int tokenCount, ChunkingParameters parameters) {
        if (tokenCount < 0) {
            throw new IllegalArgumentException("tokenCount must not be negative");
        }
        List<TokenWindow> windows = new ArrayList<>();
        for (int start = 0; start < tokenCount; start += parameters.stride()) {
            windows.add(new TokenWindow(start, Math.min(start + parameters.chunkSize(), tokenCount)));
        }
        return windows;
    }

    /**
     * Half-open token range {@code [start, end)}.
     */
    public record TokenWindow(int start, int end) {

        public int length() {
            return end - start;
        }
    }

    /**
     * Decoded window text and the page its first token belongs to.
     */
    public record TextWindow(String text, Integer page) {
    }
}
