package ch.so.arp.rag.docqa;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Saves and loads an {@link IndexedDocument} as two JSON files in a directory:
 * {@value #INDEX_FILE} holds the vectors, {@value #CHUNKS_FILE} the chunk
 * metadata. Both files are always written and read together.
 */
public class IndexSnapshotStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexSnapshotStore.class);

    static final String INDEX_FILE = "index.json";
    static final String CHUNKS_FILE = "chunks.json";

    private static final TypeReference<List<Chunk>> CHUNK_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public IndexSnapshotStore(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public void save(IndexedDocument document, Path directory) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(directory, "directory");
        VectorIndex index = document.index();
        List<float[]> vectors = new ArrayList<>(index.size());
        for (int id = 0; id < index.size(); id++) {
            vectors.add(index.reconstruct(id));
        }
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(directory.resolve(INDEX_FILE).toFile(),
                    new IndexFile(document.fingerprint(), index.dimension(), vectors));
            objectMapper.writeValue(directory.resolve(CHUNKS_FILE).toFile(), document.metadata().chunks());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save index snapshot to " + directory, ex);
        }
        LOGGER.info("Saved index snapshot of {} ({} rows) to {}", document.fingerprint(), index.size(), directory);
    }

    /**
     * @return {@code true} if both snapshot files exist in the directory
     */
    public boolean exists(Path directory) {
        return Files.isRegularFile(directory.resolve(INDEX_FILE)) && Files.isRegularFile(directory.resolve(CHUNKS_FILE));
    }

    /**
     * @throws IllegalStateException if vectors and metadata are not aligned
     * @throws UncheckedIOException if the files cannot be read
     */
    public IndexedDocument load(Path directory) {
        Objects.requireNonNull(directory, "directory");
        IndexFile indexFile;
        List<Chunk> chunks;
        try {
            indexFile = objectMapper.readValue(directory.resolve(INDEX_FILE).toFile(), IndexFile.class);
            chunks = objectMapper.readValue(directory.resolve(CHUNKS_FILE).toFile(), CHUNK_LIST);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load index snapshot from " + directory, ex);
        }
        if (indexFile.vectors().size() != chunks.size()) {
            throw new IllegalStateException("Snapshot in " + directory + " has " + indexFile.vectors().size()
                    + " vectors but " + chunks.size() + " chunks");
        }
        VectorIndex index = VectorIndex.build(indexFile.vectors(), indexFile.dimension());
        LOGGER.info("Loaded index snapshot of {} ({} rows) from {}", indexFile.fingerprint(), index.size(), directory);
        return new IndexedDocument(indexFile.fingerprint(), index, new ChunkMetadataTable(chunks));
    }

    record IndexFile(String fingerprint, int dimension, List<float[]> vectors) {
    }
}
