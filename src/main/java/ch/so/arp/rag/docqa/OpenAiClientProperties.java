package ch.so.arp.rag.docqa;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to connect to OpenAI for chat
 * completions and embeddings.
 */
@ConfigurationProperties(prefix = "rag.qa.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests against the OpenAI service. Falls back to
     * {@code spring.ai.openai.api-key}.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public OpenAI endpoint.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Name of the chat model that answers questions.
     */
    private String model = "gpt-4o-mini";

    /**
     * Name of the embedding model, used when {@code rag.qa.embedding-provider=openai}.
     */
    private String embeddingModel = "text-embedding-3-small";

    /**
     * Requested length of OpenAI embedding vectors.
     */
    private int embeddingDimensions = 1536;

    /**
     * Request timeout for chat and embedding calls.
     */
    private Duration timeout = Duration.ofSeconds(60);

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("spring.ai.openai.api-key") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public void setEmbeddingDimensions(int embeddingDimensions) {
        this.embeddingDimensions = embeddingDimensions;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
