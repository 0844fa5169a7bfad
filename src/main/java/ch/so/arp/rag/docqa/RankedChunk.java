package ch.so.arp.rag.docqa;

/**
 * Result element returned by the {@link RetrievalEngine}. {@code score} is the
 * raw cosine similarity between question and chunk, comparable across
 * retrieval strategies.
 */
public record RankedChunk(
        String text,
        String source,
        Integer page,
        String clauseNumber,
        double score) {

    static RankedChunk of(Chunk chunk, double score) {
        return new RankedChunk(chunk.text(), chunk.source(), chunk.page(), chunk.clauseNumber(), score);
    }

    /**
     * Formats the chunk for a prompt with a citation header, so that the model
     * can refer to the original source:
     * {@code [From policy.pdf | Page 2 | Clause 4.1]}.
     */
    public String formatForPrompt() {
        return "[From " + source
                + " | Page " + (page == null ? "N/A" : page)
                + " | Clause " + (clauseNumber == null ? "" : clauseNumber)
                + "]\n" + text;
    }
}
