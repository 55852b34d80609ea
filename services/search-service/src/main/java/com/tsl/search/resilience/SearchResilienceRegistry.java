package com.tsl.search.resilience;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(SearchResilienceProperties.class)
public class SearchResilienceRegistry {
    private final SearchResilienceProperties properties;
    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker extractionBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.properties = properties;
        this.embedBreaker = new CircuitBreaker(
            "embedding",
            properties.getEmbedFailureThreshold(),
            properties.getEmbedOpenMs()
        );
        this.extractionBreaker = new CircuitBreaker(
            "extraction",
            properties.getExtractionFailureThreshold(),
            properties.getExtractionOpenMs()
        );
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getExtractionBreaker() {
        return extractionBreaker;
    }

    public SearchResilienceProperties getProperties() {
        return properties;
    }
}
