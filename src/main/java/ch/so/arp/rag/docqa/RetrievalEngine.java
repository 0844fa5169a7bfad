package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-k similarity retrieval over an {@link IndexedDocument} with optional
 * metadata filtering.
 * <p>
 * The index itself has no predicate support, so filtered queries use one of two
 * strategies. When the rows passing the filter are a small share of the index,
 * a temporary sub-index over exactly those rows is searched. Otherwise the
 * engine over-retrieves {@code k * overfetchFactor} candidates from the full
 * index and keeps the matching ones in rank order until {@code k} are
 * collected. If fewer than {@code k} matching rows survive although more exist,
 * the sub-index is searched after all. Both strategies score
 * with the same stored vectors, so their scores are directly comparable.
 */
public class RetrievalEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalEngine.class);

    public static final int DEFAULT_OVERFETCH_FACTOR = 16;
    public static final double DEFAULT_SUB_INDEX_MAX_FRACTION = 0.25d;

    private final EmbeddingProvider embeddingProvider;
    private final int overfetchFactor;
    private final double subIndexMaxFraction;

    public RetrievalEngine(EmbeddingProvider embeddingProvider) {
        this(embeddingProvider, DEFAULT_OVERFETCH_FACTOR, DEFAULT_SUB_INDEX_MAX_FRACTION);
    }

    public RetrievalEngine(EmbeddingProvider embeddingProvider, int overfetchFactor, double subIndexMaxFraction) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        if (overfetchFactor < 1) {
            throw new IllegalArgumentException("overfetchFactor must be at least 1");
        }
        if (subIndexMaxFraction < 0.0d || subIndexMaxFraction > 1.0d) {
            throw new IllegalArgumentException("subIndexMaxFraction must be within [0, 1]");
        }
        this.overfetchFactor = overfetchFactor;
        this.subIndexMaxFraction = subIndexMaxFraction;
    }

    /**
     * Dimension of the query vectors this engine produces.
     */
    public int dimension() {
        return embeddingProvider.dimension();
    }

    public List<RankedChunk> retrieve(String query, IndexedDocument document, int k) {
        return retrieve(query, document, k, RetrievalFilter.none());
    }

    /**
     * Returns up to {@code k} chunks ordered by descending similarity to the
     * query. A blank query or a filter that matches no chunk yields an empty
     * list.
     */
    public List<RankedChunk> retrieve(String query, IndexedDocument document, int k, RetrievalFilter filter) {
        Objects.requireNonNull(document, "document");
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1 (was " + k + ")");
        }
        if (query == null || query.isBlank() || document.size() == 0) {
            return List.of();
        }
        float[] queryVector = embeddingProvider.embed(query.strip());

        if (filter == null || filter.isEmpty()) {
            return searchAll(queryVector, document, k);
        }
        int[] allowedIds = document.metadata().matchingIds(filter);
        if (allowedIds.length == 0) {
            LOGGER.debug("Filter {} matches no chunk of {}", filter, document.fingerprint());
            return List.of();
        }
        if (allowedIds.length <= subIndexMaxFraction * document.size()) {
            LOGGER.debug("Searching sub-index of {} / {} rows for {}", allowedIds.length, document.size(), filter);
            return searchSubIndex(queryVector, document, allowedIds, k);
        }
        LOGGER.debug("Over-retrieving for {} ({} / {} rows match)", filter, allowedIds.length, document.size());
        List<RankedChunk> results = overRetrieveAndFilter(queryVector, document, k, filter);
        if (results.size() < Math.min(k, allowedIds.length)) {
            LOGGER.debug("Over-retrieval kept {} of {} wanted rows, searching sub-index instead", results.size(),
                    Math.min(k, allowedIds.length));
            return searchSubIndex(queryVector, document, allowedIds, k);
        }
        return results;
    }

    List<RankedChunk> searchAll(float[] queryVector, IndexedDocument document, int k) {
        List<RankedChunk> results = new ArrayList<>();
        for (SearchHit hit : document.index().search(queryVector, k)) {
            results.add(RankedChunk.of(document.metadata().get(hit.id()), hit.score()));
        }
        return results;
    }

    List<RankedChunk> overRetrieveAndFilter(float[] queryVector, IndexedDocument document, int k,
            RetrievalFilter filter) {
        int searchK = (int) Math.min(document.size(), (long) k * overfetchFactor);
        List<RankedChunk> results = new ArrayList<>(k);
        for (SearchHit hit : document.index().search(queryVector, searchK)) {
            Chunk chunk = document.metadata().get(hit.id());
            if (!filter.matches(chunk)) {
                continue;
            }
            results.add(RankedChunk.of(chunk, hit.score()));
            if (results.size() >= k) {
                break;
            }
        }
        return results;
    }

    List<RankedChunk> searchSubIndex(float[] queryVector, IndexedDocument document, int[] allowedIds, int k) {
        VectorIndex subIndex = document.index().subset(allowedIds);
        List<RankedChunk> results = new ArrayList<>(k);
        for (SearchHit hit : subIndex.search(queryVector, k)) {
            results.add(RankedChunk.of(document.metadata().get(allowedIds[hit.id()]), hit.score()));
        }
        return results;
    }
}
