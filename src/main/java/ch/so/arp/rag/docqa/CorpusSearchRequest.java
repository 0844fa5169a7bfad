package ch.so.arp.rag.docqa;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Corpus search with optional metadata filters. {@code k} defaults to 3.
 */
public record CorpusSearchRequest(
        @NotBlank String query,
        @Min(1) Integer k,
        String source,
        String clauseNumber,
        @Min(1) Integer pageFrom,
        @Min(1) Integer pageTo) {

    static final int DEFAULT_K = 3;

    int effectiveK() {
        return k == null ? DEFAULT_K : k;
    }

    RetrievalFilter toFilter() {
        return new RetrievalFilter(source, clauseNumber, pageFrom, pageTo);
    }
}
