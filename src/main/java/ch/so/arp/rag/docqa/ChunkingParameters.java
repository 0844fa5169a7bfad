package ch.so.arp.rag.docqa;

/**
 * Token window configuration used by {@link TokenChunker}. Both values are
 * measured in tokens of the chunker's encoding, not in characters.
 */
public record ChunkingParameters(int chunkSize, int overlap) {

    public static final int DEFAULT_CHUNK_SIZE = 512;
    public static final int DEFAULT_OVERLAP = 64;

    public ChunkingParameters {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive (was " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative (was " + overlap + ")");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") must be smaller than chunkSize (" + chunkSize + ")");
        }
    }

    public static ChunkingParameters defaults() {
        return new ChunkingParameters(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    /**
     * Number of tokens the window start advances per step.
     */
    public int stride() {
        return chunkSize - overlap;
    }
}
