package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

class MiniLmEmbeddingProviderTest {

    private final EmbeddingModel model = mock(EmbeddingModel.class);

    @Test
    void returnsOneVectorPerText() {
        when(model.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[] { 1f, 0f }),
                Embedding.from(new float[] { 0f, 1f }))));
        MiniLmEmbeddingProvider provider = new MiniLmEmbeddingProvider(model);

        List<float[]> vectors = provider.embedAll(List.of("grace period", "waiting period"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(1)).containsExactly(0f, 1f);
        assertThat(provider.dimension()).isEqualTo(384);
    }

    @Test
    void emptyInputNeedsNoModelCall() {
        assertThat(new MiniLmEmbeddingProvider(model).embedAll(List.of())).isEmpty();
    }

    @Test
    void wrapsModelFailures() {
        when(model.embedAll(anyList())).thenThrow(new IllegalStateException("onnx failure"));
        MiniLmEmbeddingProvider provider = new MiniLmEmbeddingProvider(model);

        assertThatThrownBy(() -> provider.embed("grace")).isInstanceOf(EmbeddingException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
