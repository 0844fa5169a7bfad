package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextCleanerTest {

    @Test
    void joinsHyphenatedLineBreaks() {
        assertThat(TextCleaner.clean("hospital-\nisation")).isEqualTo("hospitalisation");
    }

    @Test
    void mergesSingleLineBreaksAndKeepsParagraphs() {
        assertThat(TextCleaner.clean("first line\nsecond line\n\n\n\nnext   paragraph\t here "))
                .isEqualTo("first line second line\n\nnext paragraph here");
    }

    @Test
    void appliesCompatibilityNormalization() {
        assertThat(TextCleaner.clean("ﬁnal clause")).isEqualTo("final clause");
    }

    @Test
    void blankInputBecomesEmpty() {
        assertThat(TextCleaner.clean("  \n \t ")).isEmpty();
        assertThat(TextCleaner.clean(null)).isEmpty();
    }
}
