package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DeterministicEmbeddingProviderTest {

    private final DeterministicEmbeddingProvider provider = new DeterministicEmbeddingProvider(48);

    @Test
    void seedIsLeadingBytesOfSha256() {
        // SHA-256 of the empty string starts with e3b0c44298fc1c14
        assertThat(DeterministicEmbeddingProvider.seed("")).isEqualTo(0xe3b0c44298fc1c14L);
    }

    @Test
    void equalTextsGetEqualUnitVectors() {
        float[] first = provider.embed("grace period");
        float[] second = provider.embed("grace period");

        assertThat(first).hasSize(48).containsExactly(second);
        double norm = 0.0d;
        for (float value : first) {
            norm += (double) value * value;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0d, within(1e-5d));
        assertThat(provider.embed("waiting period")).isNotEqualTo(first);
    }

    @Test
    void rejectsNonPositiveDimension() {
        assertThatThrownBy(() -> new DeterministicEmbeddingProvider(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
