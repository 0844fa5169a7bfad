package ch.so.arp.rag.docqa;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the document question answering pipeline.
 */
@ConfigurationProperties(prefix = "rag.qa")
public class DocumentQaProperties {

    /**
     * Bearer token expected on protected endpoints. Requests fail with 500 while
     * it is not configured.
     */
    private String apiKey;

    /**
     * Use the mocked language model instead of OpenAI.
     */
    private boolean mockOpenai = true;

    /**
     * Embedding backend: {@code deterministic}, {@code minilm} or {@code openai}.
     */
    private String embeddingProvider = "minilm";

    /**
     * Vector length of the deterministic embedding provider.
     */
    private int deterministicDimension = 384;

    private final Chunking chunking = new Chunking();

    private final Retrieval retrieval = new Retrieval();

    private final Conversation conversation = new Conversation();

    private final Cache cache = new Cache();

    private final Download download = new Download();

    private final Corpus corpus = new Corpus();

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public boolean isMockOpenai() {
        return mockOpenai;
    }

    public void setMockOpenai(boolean mockOpenai) {
        this.mockOpenai = mockOpenai;
    }

    public String getEmbeddingProvider() {
        return embeddingProvider;
    }

    public void setEmbeddingProvider(String embeddingProvider) {
        this.embeddingProvider = embeddingProvider;
    }

    public int getDeterministicDimension() {
        return deterministicDimension;
    }

    public void setDeterministicDimension(int deterministicDimension) {
        this.deterministicDimension = deterministicDimension;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public Cache getCache() {
        return cache;
    }

    public Download getDownload() {
        return download;
    }

    public Corpus getCorpus() {
        return corpus;
    }

    public static class Chunking {

        /**
         * Tokens per chunk.
         */
        private int chunkSize = ChunkingParameters.DEFAULT_CHUNK_SIZE;

        /**
         * Tokens shared by consecutive chunks.
         */
        private int overlap = ChunkingParameters.DEFAULT_OVERLAP;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        public ChunkingParameters toParameters() {
            return new ChunkingParameters(chunkSize, overlap);
        }
    }

    public static class Retrieval {

        /**
         * Chunks passed to the language model per question.
         */
        private int topK = 3;

        private int overfetchFactor = RetrievalEngine.DEFAULT_OVERFETCH_FACTOR;

        /**
         * Largest share of matching rows for which a filtered search uses a
         * temporary sub-index instead of over-retrieval.
         */
        private double subIndexMaxFraction = RetrievalEngine.DEFAULT_SUB_INDEX_MAX_FRACTION;

        /**
         * Restrict retrieval to a clause named in the question.
         */
        private boolean detectClause = false;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getOverfetchFactor() {
            return overfetchFactor;
        }

        public void setOverfetchFactor(int overfetchFactor) {
            this.overfetchFactor = overfetchFactor;
        }

        public double getSubIndexMaxFraction() {
            return subIndexMaxFraction;
        }

        public void setSubIndexMaxFraction(double subIndexMaxFraction) {
            this.subIndexMaxFraction = subIndexMaxFraction;
        }

        public boolean isDetectClause() {
            return detectClause;
        }

        public void setDetectClause(boolean detectClause) {
            this.detectClause = detectClause;
        }
    }

    public static class Conversation {

        /**
         * Question/answer exchanges kept as history.
         */
        private int windowExchanges = 3;

        public int getWindowExchanges() {
            return windowExchanges;
        }

        public void setWindowExchanges(int windowExchanges) {
            this.windowExchanges = windowExchanges;
        }
    }

    public static class Cache {

        /**
         * Maximum number of cached document indexes, 0 for unbounded.
         */
        private int maxDocuments = 0;

        /**
         * Threads available for concurrent index builds.
         */
        private int buildThreads = 2;

        public int getMaxDocuments() {
            return maxDocuments;
        }

        public void setMaxDocuments(int maxDocuments) {
            this.maxDocuments = maxDocuments;
        }

        public int getBuildThreads() {
            return buildThreads;
        }

        public void setBuildThreads(int buildThreads) {
            this.buildThreads = buildThreads;
        }
    }

    public static class Download {

        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Corpus {

        /**
         * Directory where the corpus index is saved after indexing and loaded
         * from on startup. Unset disables persistence.
         */
        private String snapshotDir;

        public String getSnapshotDir() {
            return snapshotDir;
        }

        public void setSnapshotDir(String snapshotDir) {
            this.snapshotDir = snapshotDir;
        }
    }
}
