package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class DocumentQaConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(DocumentQaConfiguration.class);

    @Test
    void usesMockLlmAndLocalEmbeddingsByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(LlmClient.class);
            assertThat(context).getBean(LlmClient.class).isInstanceOf(MockLlmClient.class);
            assertThat(context).hasSingleBean(EmbeddingProvider.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(MiniLmEmbeddingProvider.class);
            assertThat(context.getBean(EmbeddingProvider.class).dimension()).isEqualTo(MiniLmEmbeddingProvider.DIMENSION);
            assertThat(context).hasSingleBean(DocumentQuestionService.class);
            assertThat(context).hasSingleBean(CorpusIndexService.class);
            assertThat(context).hasSingleBean(DocumentIndexCache.class);
        });
    }

    @Test
    void bindsPipelineSettings() {
        contextRunner
                .withPropertyValues(
                        "rag.qa.chunking.chunk-size=256",
                        "rag.qa.chunking.overlap=32",
                        "rag.qa.retrieval.top-k=5",
                        "rag.qa.cache.build-threads=4",
                        "rag.qa.download.timeout=10s",
                        "rag.qa.embedding-provider=deterministic",
                        "rag.qa.deterministic-dimension=64")
                .run(context -> {
                    DocumentQaProperties properties = context.getBean(DocumentQaProperties.class);
                    assertThat(properties.getChunking().toParameters()).isEqualTo(new ChunkingParameters(256, 32));
                    assertThat(properties.getRetrieval().getTopK()).isEqualTo(5);
                    assertThat(properties.getDownload().getTimeout()).hasSeconds(10);
                    assertThat(context.getBean("documentBuildExecutor", ThreadPoolTaskExecutor.class)
                            .getMaxPoolSize()).isEqualTo(4);
                    assertThat(context).getBean(EmbeddingProvider.class)
                            .isInstanceOf(DeterministicEmbeddingProvider.class);
                    assertThat(context.getBean(EmbeddingProvider.class).dimension()).isEqualTo(64);
                });
    }

    @Test
    void createsOpenAiBeansWhenMocksDisabled() {
        contextRunner
                .withPropertyValues(
                        "rag.qa.mock-openai=false",
                        "rag.qa.embedding-provider=openai",
                        "spring.ai.openai.api-key=test-key",
                        "rag.qa.openai.base-url=https://example.com/v1",
                        "rag.qa.openai.model=gpt-4o")
                .run(context -> {
                    assertThat(context).hasSingleBean(LlmClient.class);
                    assertThat(context).getBean(LlmClient.class).isInstanceOf(OpenAiLlmClient.class);
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(OpenAiEmbeddingProvider.class);
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getModel()).isEqualTo("gpt-4o");
                    assertThat(context.getBean(EmbeddingProvider.class).dimension()).isEqualTo(1536);
                });
    }

    @Test
    void failsWithoutApiKeyWhenMocksDisabled() {
        contextRunner
                .withPropertyValues("rag.qa.mock-openai=false")
                .run(context -> assertThat(context).hasFailed());
    }
}
