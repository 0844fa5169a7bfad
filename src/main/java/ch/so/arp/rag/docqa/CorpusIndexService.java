package ch.so.arp.rag.docqa;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline corpus mode: all PDFs of a folder are indexed into one combined
 * index that can be searched with metadata filters. When a snapshot directory
 * is configured the corpus survives restarts.
 */
public class CorpusIndexService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusIndexService.class);

    private final DocumentIndexer indexer;
    private final RetrievalEngine retrievalEngine;
    private final IndexSnapshotStore snapshotStore;
    private final Path snapshotDir;
    private final AtomicReference<IndexedDocument> corpus = new AtomicReference<>();

    public CorpusIndexService(DocumentIndexer indexer, RetrievalEngine retrievalEngine,
            IndexSnapshotStore snapshotStore, Path snapshotDir) {
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore");
        this.snapshotDir = snapshotDir;
    }

    /**
     * Indexes every {@code *.pdf} file of the folder, in file name order, and
     * makes the result the current corpus.
     *
     * @throws IllegalArgumentException if the folder does not exist
     * @throws ExtractionException if the folder contains no PDF with text
     */
    public CorpusSummary indexFolder(Path folder) {
        Objects.requireNonNull(folder, "folder");
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Not a directory: " + folder);
        }
        List<String> files;
        try (Stream<Path> entries = Files.list(folder)) {
            files = entries.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted()
                    .map(Path::toString)
                    .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + folder, ex);
        }
        if (files.isEmpty()) {
            throw new ExtractionException(folder.toString(), "No PDF files found in " + folder);
        }
        LOGGER.info("Indexing {} PDF file(s) from {}", files.size(), folder);

        IndexedDocument indexed = indexer.indexAll(folder.toAbsolutePath().normalize().toString(), files);
        corpus.set(indexed);
        if (snapshotDir != null) {
            snapshotStore.save(indexed, snapshotDir);
        }
        return CorpusSummary.of(indexed);
    }

    /**
     * The corpus indexed in this process, or the saved snapshot if there is
     * none yet.
     *
     * @throws IllegalStateException if the snapshot was built with another
     *         embedding dimension
     */
    public Optional<IndexedDocument> current() {
        IndexedDocument indexed = corpus.get();
        if (indexed == null && snapshotDir != null && snapshotStore.exists(snapshotDir)) {
            IndexedDocument loaded = snapshotStore.load(snapshotDir);
            if (loaded.index().dimension() != retrievalEngine.dimension()) {
                throw new IllegalStateException("Snapshot in " + snapshotDir + " has dimension "
                        + loaded.index().dimension() + " but the embedding provider produces "
                        + retrievalEngine.dimension() + "; re-index the corpus");
            }
            corpus.compareAndSet(null, loaded);
            indexed = corpus.get();
        }
        return Optional.ofNullable(indexed);
    }

    /**
     * @throws CorpusNotIndexedException if no corpus is available
     */
    public List<RankedChunk> search(String query, int k, RetrievalFilter filter) {
        IndexedDocument indexed = current().orElseThrow(CorpusNotIndexedException::new);
        return retrievalEngine.retrieve(query, indexed, k, filter);
    }
}
