package ch.so.arp.rag.docqa;

/**
 * Metadata predicate applied to retrieval candidates. Every non-null criterion
 * must hold for a chunk to match; a filter without criteria matches everything.
 *
 * @param source       exact source document name
 * @param clauseNumber exact clause numeral, compared after trimming
 * @param pageFrom     inclusive lower page bound
 * @param pageTo       inclusive upper page bound
 */
public record RetrievalFilter(String source, String clauseNumber, Integer pageFrom, Integer pageTo) {

    private static final RetrievalFilter NONE = new RetrievalFilter(null, null, null, null);

    public RetrievalFilter {
        source = blankToNull(source);
        clauseNumber = blankToNull(clauseNumber);
        if (pageFrom != null && pageTo != null && pageFrom > pageTo) {
            throw new IllegalArgumentException("pageFrom (" + pageFrom + ") must not exceed pageTo (" + pageTo + ")");
        }
    }

    public static RetrievalFilter none() {
        return NONE;
    }

    public static RetrievalFilter bySource(String source) {
        return new RetrievalFilter(source, null, null, null);
    }

    public static RetrievalFilter byClause(String clauseNumber) {
        return new RetrievalFilter(null, clauseNumber, null, null);
    }

    public static RetrievalFilter byPageRange(int pageFrom, int pageTo) {
        return new RetrievalFilter(null, null, pageFrom, pageTo);
    }

    public RetrievalFilter withSource(String newSource) {
        return new RetrievalFilter(newSource, clauseNumber, pageFrom, pageTo);
    }

    public RetrievalFilter withClause(String newClauseNumber) {
        return new RetrievalFilter(source, newClauseNumber, pageFrom, pageTo);
    }

    public RetrievalFilter withPageRange(Integer newPageFrom, Integer newPageTo) {
        return new RetrievalFilter(source, clauseNumber, newPageFrom, newPageTo);
    }

    public boolean isEmpty() {
        return source == null && clauseNumber == null && !hasPageRange();
    }

    public boolean hasPageRange() {
        return pageFrom != null || pageTo != null;
    }

    public boolean matches(Chunk chunk) {
        if (source != null && !source.equals(chunk.source())) {
            return false;
        }
        if (clauseNumber != null
                && (chunk.clauseNumber() == null || !clauseNumber.equals(chunk.clauseNumber().trim()))) {
            return false;
        }
        if (hasPageRange()) {
            Integer page = chunk.page();
            if (page == null) {
                return false;
            }
            if (pageFrom != null && page < pageFrom) {
                return false;
            }
            if (pageTo != null && page > pageTo) {
                return false;
            }
        }
        return true;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
