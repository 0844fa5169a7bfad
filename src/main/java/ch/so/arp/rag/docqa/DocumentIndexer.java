package ch.so.arp.rag.docqa;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an {@link IndexedDocument} from a document identifier: fetch, extract,
 * clean, chunk, embed and index. This is the build function handed to the
 * {@link DocumentIndexCache}.
 */
public class DocumentIndexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentIndexer.class);

    private final DocumentFetcher fetcher;
    private final DocumentTextExtractor extractor;
    private final TokenChunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final ChunkingParameters chunkingParameters;

    DocumentIndexer(DocumentFetcher fetcher, DocumentTextExtractor extractor, TokenChunker chunker,
            EmbeddingProvider embeddingProvider, ChunkingParameters chunkingParameters) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.chunkingParameters = Objects.requireNonNull(chunkingParameters, "chunkingParameters");
    }

    /**
     * Indexes a single document. Chunks carry the identifier's file name as
     * source.
     *
     * @throws DownloadException if the document cannot be fetched
     * @throws ExtractionException if the document yields no text
     */
    public IndexedDocument index(String identifier) {
        return indexAll(identifier, List.of(identifier));
    }

    /**
     * Indexes several documents into one combined index under the given
     * fingerprint. Rows follow the order of {@code identifiers}.
     */
    public IndexedDocument indexAll(String fingerprint, List<String> identifiers) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        List<Chunk> chunks = new ArrayList<>();
        for (String identifier : identifiers) {
            chunks.addAll(chunkDocument(identifier));
        }
        if (chunks.isEmpty()) {
            throw new ExtractionException(fingerprint, "No text could be extracted from " + fingerprint);
        }

        List<float[]> vectors = embeddingProvider.embedAll(chunks.stream().map(Chunk::text).toList());
        if (vectors.size() != chunks.size()) {
            throw new EmbeddingException(
                    "Expected " + chunks.size() + " embeddings but received " + vectors.size());
        }
        VectorIndex index = VectorIndex.build(vectors, embeddingProvider.dimension());
        LOGGER.info("Indexed {} chunks from {} document(s) for {}", chunks.size(), identifiers.size(), fingerprint);
        return new IndexedDocument(fingerprint, index, new ChunkMetadataTable(chunks));
    }

    List<Chunk> chunkDocument(String identifier) {
        String source = sourceName(identifier);
        FetchedDocument document = fetcher.fetch(identifier);
        List<PageText> pages = new ArrayList<>();
        for (PageText page : extractor.extract(document, source)) {
            String cleaned = TextCleaner.clean(page.text());
            if (!cleaned.isEmpty()) {
                pages.add(new PageText(page.page(), cleaned));
            }
        }
        if (pages.isEmpty()) {
            throw new ExtractionException(source, "Document " + source + " contains no text after cleaning");
        }

        List<Chunk> chunks = new ArrayList<>();
        for (TokenChunker.TextWindow window : chunker.chunkPages(pages, chunkingParameters)) {
            String clause = ClauseNumberExtractor.fromChunk(window.text()).orElse(null);
            chunks.add(new Chunk(window.text(), source, window.page(), clause));
        }
        LOGGER.debug("{} pages of {} produced {} chunks", pages.size(), source, chunks.size());
        return chunks;
    }

    /**
     * Last path segment of a URL or path, without query string.
     */
    static String sourceName(String identifier) {
        String trimmed = identifier.trim();
        String path = trimmed;
        try {
            URI uri = URI.create(trimmed);
            if (uri.getPath() != null && !uri.getPath().isEmpty()) {
                path = uri.getPath();
            }
        } catch (IllegalArgumentException ex) {
            LOGGER.trace("{} is not a URI, using it as a path", trimmed);
        }
        String normalized = path.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        return name.isBlank() ? trimmed : name;
    }
}
