package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered chunk metadata of one index. Position {@code i} describes row
 * {@code i} of the matching {@link VectorIndex}. Besides the rows the table
 * keeps id lists per source and per clause number so that filters on those
 * fields do not need a full scan.
 */
public final class ChunkMetadataTable {

    private final List<Chunk> chunks;
    private final Map<String, int[]> idsBySource;
    private final Map<String, int[]> idsByClause;

    public ChunkMetadataTable(List<Chunk> chunks) {
        this.chunks = List.copyOf(Objects.requireNonNull(chunks, "chunks"));
        Map<String, List<Integer>> sources = new HashMap<>();
        Map<String, List<Integer>> clauses = new HashMap<>();
        for (int id = 0; id < this.chunks.size(); id++) {
            Chunk chunk = this.chunks.get(id);
            sources.computeIfAbsent(chunk.source(), key -> new ArrayList<>()).add(id);
            if (chunk.clauseNumber() != null) {
                clauses.computeIfAbsent(chunk.clauseNumber().trim(), key -> new ArrayList<>()).add(id);
            }
        }
        this.idsBySource = toArrays(sources);
        this.idsByClause = toArrays(clauses);
    }

    public Chunk get(int id) {
        return chunks.get(id);
    }

    public int size() {
        return chunks.size();
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    /**
     * Ids of all rows matching the filter, in ascending order.
     */
    public int[] matchingIds(RetrievalFilter filter) {
        Objects.requireNonNull(filter, "filter");
        int[] candidates;
        if (filter.source() != null) {
            candidates = idsBySource.getOrDefault(filter.source(), new int[0]);
        } else if (filter.clauseNumber() != null) {
            candidates = idsByClause.getOrDefault(filter.clauseNumber(), new int[0]);
        } else {
            candidates = null;
        }
        List<Integer> matching = new ArrayList<>();
        if (candidates != null) {
            for (int id : candidates) {
                if (filter.matches(chunks.get(id))) {
                    matching.add(id);
                }
            }
        } else {
            for (int id = 0; id < chunks.size(); id++) {
                if (filter.matches(chunks.get(id))) {
                    matching.add(id);
                }
            }
        }
        return matching.stream().mapToInt(Integer::intValue).toArray();
    }

    private static Map<String, int[]> toArrays(Map<String, List<Integer>> lists) {
        Map<String, int[]> arrays = new HashMap<>();
        lists.forEach((key, ids) -> arrays.put(key, ids.stream().mapToInt(Integer::intValue).toArray()));
        return Map.copyOf(arrays);
    }
}
