package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

class VectorIndexTest {

    private final VectorIndex index = VectorIndex.build(List.of(
            new float[] { 1f, 0f, 0f },
            new float[] { 0f, 2f, 0f },
            new float[] { 1f, 1f, 0f },
            new float[] { 3f, 0f, 0f }), 3);

    @Test
    void ranksByCosineSimilarityWithTiesByAscendingId() {
        List<SearchHit> hits = index.search(new float[] { 5f, 0f, 0f }, 3);

        assertThat(hits).extracting(SearchHit::id).containsExactly(0, 3, 2);
        assertThat(hits.get(0).score()).isCloseTo(1.0d, within(1e-6));
        assertThat(hits.get(1).score()).isCloseTo(1.0d, within(1e-6));
        assertThat(hits.get(2).score()).isCloseTo(Math.sqrt(0.5d), within(1e-6));
    }

    @Test
    void returnsAllRowsWhenKExceedsSize() {
        assertThat(index.search(new float[] { 0f, 1f, 0f }, 10)).hasSize(4);
    }

    @Test
    void rejectsVectorsOfWrongDimension() {
        assertThatThrownBy(() -> VectorIndex.build(List.of(new float[] { 1f, 0f }), 3))
                .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> index.search(new float[] { 1f, 0f }, 1))
                .isInstanceOf(DimensionMismatchException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveK() {
        assertThatThrownBy(() -> index.search(new float[] { 1f, 0f, 0f }, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reconstructsNormalizedVector() {
        assertThat(index.reconstruct(3)).containsExactly(1f, 0f, 0f);
        assertThatThrownBy(() -> index.reconstruct(4)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> index.reconstruct(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void subsetKeepsScoresOfOriginalRows() {
        float[] query = { 1f, 2f, 0f };
        VectorIndex subset = index.subset(new int[] { 1, 2 });

        List<SearchHit> full = index.search(query, 4);
        List<SearchHit> partial = subset.search(query, 2);

        assertThat(partial).hasSize(2);
        for (SearchHit hit : partial) {
            int originalId = hit.id() == 0 ? 1 : 2;
            double originalScore = full.stream().filter(h -> h.id() == originalId).findFirst().orElseThrow().score();
            assertThat(hit.score()).isEqualTo(originalScore);
        }
    }

    @Test
    void emptyIndexReturnsNoHits() {
        VectorIndex empty = VectorIndex.build(List.of(), 3);

        assertThat(empty.size()).isZero();
        assertThat(empty.search(new float[] { 1f, 0f, 0f }, 5)).isEmpty();
    }
}
