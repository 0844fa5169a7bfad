package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

class IndexSnapshotStoreTest {

    private static final List<Chunk> CHUNKS = List.of(
            new Chunk("grace period is thirty days", "policy.pdf", 1, "4.1"),
            new Chunk("plain notes", "notes.txt", null, null));

    @TempDir
    Path directory;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IndexSnapshotStore store = new IndexSnapshotStore(objectMapper);

    @Test
    void restoresIndexAndMetadata() {
        VocabularyEmbeddingProvider embedder = new VocabularyEmbeddingProvider(
                CHUNKS.stream().map(Chunk::text).toList());
        IndexedDocument original = embedder.index("corpus", CHUNKS);

        store.save(original, directory);
        IndexedDocument restored = store.load(directory);

        assertThat(store.exists(directory)).isTrue();
        assertThat(restored.fingerprint()).isEqualTo("corpus");
        assertThat(restored.metadata().chunks()).isEqualTo(CHUNKS);
        assertThat(restored.index().dimension()).isEqualTo(original.index().dimension());
        float[] query = embedder.embed("grace period");
        assertThat(restored.index().search(query, 2)).extracting(SearchHit::id)
                .isEqualTo(original.index().search(query, 2).stream().map(SearchHit::id).toList());
    }

    @Test
    void rejectsMisalignedSnapshot() throws IOException {
        VocabularyEmbeddingProvider embedder = new VocabularyEmbeddingProvider(
                CHUNKS.stream().map(Chunk::text).toList());
        store.save(embedder.index("corpus", CHUNKS), directory);
        objectMapper.writeValue(directory.resolve(IndexSnapshotStore.CHUNKS_FILE).toFile(), CHUNKS.subList(0, 1));

        assertThatThrownBy(() -> store.load(directory)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingFilesRaiseUncheckedIoException() throws IOException {
        Path empty = Files.createDirectories(directory.resolve("empty"));

        assertThat(store.exists(empty)).isFalse();
        assertThatThrownBy(() -> store.load(empty)).isInstanceOf(UncheckedIOException.class);
    }
}
