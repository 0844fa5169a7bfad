package ch.so.arp.rag.docqa;

import java.nio.file.Path;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central configuration wiring the question answering components together. It
 * exposes toggles that decide whether mocked or real infrastructure components
 * should be used.
 */
@Configuration
@EnableConfigurationProperties({ DocumentQaProperties.class, OpenAiClientProperties.class })
public class DocumentQaConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "documentBuildExecutor")
    public ThreadPoolTaskExecutor documentBuildExecutor(DocumentQaProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCache().getBuildThreads());
        executor.setMaxPoolSize(properties.getCache().getBuildThreads());
        executor.setThreadNamePrefix("index-build-");
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentIndexCache documentIndexCache(
            @Qualifier("documentBuildExecutor") ThreadPoolTaskExecutor documentBuildExecutor,
            DocumentQaProperties properties) {
        return new DocumentIndexCache(documentBuildExecutor, properties.getCache().getMaxDocuments());
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenChunker tokenChunker() {
        return TokenChunker.cl100k();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.qa.embedding-provider", havingValue = "deterministic")
    public EmbeddingProvider deterministicEmbeddingProvider(DocumentQaProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getDeterministicDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.qa.embedding-provider", havingValue = "minilm", matchIfMissing = true)
    public EmbeddingProvider miniLmEmbeddingProvider() {
        return new MiniLmEmbeddingProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.qa.embedding-provider", havingValue = "openai")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {
        return new OpenAiEmbeddingProvider(new OpenAiApi(properties, objectMapper.getIfAvailable(ObjectMapper::new)),
                properties.getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.qa.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.qa.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        return new OpenAiLlmClient(new OpenAiApi(properties, objectMapper.getIfAvailable(ObjectMapper::new)));
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentFetcher documentFetcher(DocumentQaProperties properties) {
        return new HttpDocumentFetcher(properties.getDownload().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentIndexer documentIndexer(DocumentFetcher documentFetcher, TokenChunker tokenChunker,
            EmbeddingProvider embeddingProvider, DocumentQaProperties properties) {
        return new DocumentIndexer(documentFetcher, new DocumentTextExtractor(), tokenChunker, embeddingProvider,
                properties.getChunking().toParameters());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrievalEngine retrievalEngine(EmbeddingProvider embeddingProvider, DocumentQaProperties properties) {
        DocumentQaProperties.Retrieval retrieval = properties.getRetrieval();
        return new RetrievalEngine(embeddingProvider, retrieval.getOverfetchFactor(),
                retrieval.getSubIndexMaxFraction());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentQuestionService documentQuestionService(DocumentIndexCache documentIndexCache,
            DocumentIndexer documentIndexer, RetrievalEngine retrievalEngine, LlmClient llmClient,
            DocumentQaProperties properties) {
        return new DocumentQuestionService(documentIndexCache, documentIndexer, retrievalEngine, llmClient,
                properties.getRetrieval().getTopK(), properties.getConversation().getWindowExchanges(),
                properties.getRetrieval().isDetectClause());
    }

    @Bean
    @ConditionalOnMissingBean
    public IndexSnapshotStore indexSnapshotStore(ObjectProvider<ObjectMapper> objectMapper) {
        return new IndexSnapshotStore(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public CorpusIndexService corpusIndexService(DocumentIndexer documentIndexer, RetrievalEngine retrievalEngine,
            IndexSnapshotStore indexSnapshotStore, DocumentQaProperties properties) {
        String snapshotDir = properties.getCorpus().getSnapshotDir();
        return new CorpusIndexService(documentIndexer, retrievalEngine, indexSnapshotStore,
                StringUtils.hasText(snapshotDir) ? Path.of(snapshotDir) : null);
    }
}
