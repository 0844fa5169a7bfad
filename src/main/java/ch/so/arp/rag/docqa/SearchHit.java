package ch.so.arp.rag.docqa;

/**
 * Row id and inner-product similarity returned by {@link VectorIndex#search}.
 */
public record SearchHit(int id, double score) {
}
