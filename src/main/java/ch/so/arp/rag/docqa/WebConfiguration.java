package ch.so.arp.rag.docqa;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the API key check for the document and corpus endpoints. The
 * health endpoint stays open.
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    private final DocumentQaProperties properties;

    public WebConfiguration(DocumentQaProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiKeyInterceptor(properties::getApiKey))
                .addPathPatterns("/api/process-pdf", "/api/corpus/**");
    }
}
