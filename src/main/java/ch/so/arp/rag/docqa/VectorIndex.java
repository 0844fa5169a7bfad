package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Exact inner-product index over unit-normalised vectors, so that scores are
 * cosine similarities in {@code [-1, 1]}. Row {@code i} belongs to the vector
 * that was passed at position {@code i} to {@link #build(List, int)}. The index
 * is immutable once built.
 */
public final class VectorIndex {

    static final Comparator<SearchHit> RANKING = Comparator.comparingDouble(SearchHit::score).reversed()
            .thenComparingInt(SearchHit::id);

    private final int dimension;
    private final float[][] rows;

    private VectorIndex(int dimension, float[][] rows) {
        this.dimension = dimension;
        this.rows = rows;
    }

    /**
     * Builds an index from the given vectors. The vectors are copied and
     * normalised to unit length.
     *
     * @throws DimensionMismatchException if a vector's length differs from {@code dimension}
     */
    public static VectorIndex build(List<float[]> vectors, int dimension) {
        Objects.requireNonNull(vectors, "vectors");
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        float[][] rows = new float[vectors.size()][];
        for (int i = 0; i < rows.length; i++) {
            float[] vector = Objects.requireNonNull(vectors.get(i), "vector " + i);
            if (vector.length != dimension) {
                throw new DimensionMismatchException(dimension, vector.length);
            }
            rows[i] = normalize(vector);
        }
        return new VectorIndex(dimension, rows);
    }

    /**
     * Returns a unit-length copy of the vector. A zero vector is returned as a
     * zero copy.
     */
    public static float[] normalize(float[] vector) {
        double norm = 0.0d;
        for (float value : vector) {
            norm += (double) value * value;
        }
        norm = Math.sqrt(norm);
        float[] copy = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            copy[i] = norm > 0 ? (float) (vector[i] / norm) : 0.0f;
        }
        return copy;
    }

    /**
     * Returns at most {@code k} hits ordered by descending similarity, ties broken
     * by ascending id. The query is normalised before scoring.
     */
    public List<SearchHit> search(float[] query, int k) {
        Objects.requireNonNull(query, "query");
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1 (was " + k + ")");
        }
        if (query.length != dimension) {
            throw new DimensionMismatchException(dimension, query.length);
        }
        float[] normalized = normalize(query);
        int limit = Math.min(k, rows.length);
        if (limit == 0) {
            return List.of();
        }
        PriorityQueue<SearchHit> best = new PriorityQueue<>(limit + 1, RANKING.reversed());
        for (int id = 0; id < rows.length; id++) {
            best.add(new SearchHit(id, dot(rows[id], normalized)));
            if (best.size() > limit) {
                best.poll();
            }
        }
        List<SearchHit> hits = new ArrayList<>(best);
        hits.sort(RANKING);
        return hits;
    }

    /**
     * Copy of the stored (normalised) vector of row {@code id}.
     *
     * @throws IndexOutOfBoundsException if {@code id} is not a row of this index
     */
    public float[] reconstruct(int id) {
        Objects.checkIndex(id, rows.length);
        return rows[id].clone();
    }

    /**
     * Index over the given rows only, in the given order: row {@code j} of the
     * result is row {@code ids[j]} of this index. Stored vectors are copied as-is,
     * so scores against the subset equal scores against this index.
     */
    public VectorIndex subset(int[] ids) {
        Objects.requireNonNull(ids, "ids");
        float[][] selected = new float[ids.length][];
        for (int j = 0; j < ids.length; j++) {
            selected[j] = reconstruct(ids[j]);
        }
        return new VectorIndex(dimension, selected);
    }

    public int size() {
        return rows.length;
    }

    public int dimension() {
        return dimension;
    }

    private static double dot(float[] left, float[] right) {
        double sum = 0.0d;
        for (int i = 0; i < left.length; i++) {
            sum += (double) left[i] * right[i];
        }
        return sum;
    }
}
