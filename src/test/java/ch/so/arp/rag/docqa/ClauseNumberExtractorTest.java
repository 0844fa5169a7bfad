package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ClauseNumberExtractorTest {

    @Test
    void findsClauseInHeading() {
        assertThat(ClauseNumberExtractor.fromChunk("Section 3.1.2 Waiting period. The insured ..."))
                .contains("3.1.2");
    }

    @Test
    void findsBareDottedNumeral() {
        assertThat(ClauseNumberExtractor.fromChunk("4.2 Maternity expenses are covered after 24 months."))
                .contains("4.2");
    }

    @Test
    void ignoresPlainNumbers() {
        assertThat(ClauseNumberExtractor.fromChunk("waiting period for PED is 36 months")).isEmpty();
        assertThat(ClauseNumberExtractor.fromChunk("")).isEmpty();
    }

    @Test
    void findsClauseReferenceInQuestion() {
        assertThat(ClauseNumberExtractor.fromQuery("What does clause 4.2 say about maternity?")).contains("4.2");
        assertThat(ClauseNumberExtractor.fromQuery("Explain Section: 7.1.3")).contains("7.1.3");
    }

    @Test
    void questionWithoutClauseYieldsNothing() {
        assertThat(ClauseNumberExtractor.fromQuery("What is the grace period?")).isEmpty();
        assertThat(ClauseNumberExtractor.fromQuery(" ")).isEmpty();
    }
}
