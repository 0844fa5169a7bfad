package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class TokenChunkerTest {

    private final TokenChunker chunker = TokenChunker.cl100k();

    @Test
    void producesIdenticalChunksForIdenticalInput() {
        String text = "The insured must pay the premium within the grace period. ".repeat(200);

        List<String> first = chunker.chunk(text, 64, 8);
        List<String> second = chunker.chunk(text, 64, 8);

        assertThat(first).isNotEmpty().isEqualTo(second);
    }

    @Test
    void windowsCoverEveryTokenWithConfiguredOverlap() {
        List<TokenChunker.TokenWindow> windows = TokenChunker.windows(1000, new ChunkingParameters(512, 64));

        assertThat(windows).containsExactly(
                new TokenChunker.TokenWindow(0, 512),
                new TokenChunker.TokenWindow(448, 960),
                new TokenChunker.TokenWindow(896, 1000));
        for (int i = 1; i < windows.size(); i++) {
            assertThat(windows.get(i).start()).isLessThan(windows.get(i - 1).end());
        }
        assertThat(windows.get(windows.size() - 1).end()).isEqualTo(1000);
    }

    @Test
    void shortTextYieldsSingleChunkWithAllText() {
        List<String> chunks = chunker.chunk("Clause 4.2 covers maternity expenses.", ChunkingParameters.defaults());

        assertThat(chunks).containsExactly("Clause 4.2 covers maternity expenses.");
    }

    @Test
    void chunkCountMatchesWindowCountOfTokenizedText() {
        String text = "coverage ".repeat(300);
        int tokens = chunker.countTokens(text);
        ChunkingParameters parameters = new ChunkingParameters(50, 10);

        assertThat(chunker.chunk(text, parameters)).hasSize(TokenChunker.windows(tokens, parameters).size());
    }

    @Test
    void blankTextYieldsNoChunks() {
        assertThat(chunker.chunk("   ", ChunkingParameters.defaults())).isEmpty();
        assertThat(chunker.chunk(null, ChunkingParameters.defaults())).isEmpty();
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> chunker.chunk("text", 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("text", 10, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("text", 10, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsPageOfFirstTokenOfEachWindow() {
        List<PageText> pages = List.of(
                new PageText(1, "alpha beta gamma"),
                new PageText(2, "coverage ".repeat(40)));

        List<TokenChunker.TextWindow> windows = chunker.chunkPages(pages, new ChunkingParameters(10, 0));

        assertThat(windows).hasSizeGreaterThan(2);
        assertThat(windows.get(0).page()).isEqualTo(1);
        assertThat(windows.subList(1, windows.size())).allSatisfy(window -> assertThat(window.page()).isEqualTo(2));
    }

    @Test
    void unpagedTextHasNoPage() {
        List<TokenChunker.TextWindow> windows = chunker.chunkPages(List.of(PageText.unpaged("plain text")),
                ChunkingParameters.defaults());

        assertThat(windows).singleElement().satisfies(window -> assertThat(window.page()).isNull());
    }
}
