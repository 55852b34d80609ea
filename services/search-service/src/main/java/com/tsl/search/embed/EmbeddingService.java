package com.tsl.search.embed;

import com.tsl.search.resilience.CircuitBreaker;
import com.tsl.search.resilience.SearchResilienceRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingService implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCache cache;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCache cache,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cache = cache;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs) {
        return cache.get(text, key -> fetch(key, timeBudgetMs));
    }

    private List<Double> fetch(String text, Integer timeBudgetMs) {
        if (properties.getMode() != EmbeddingMode.HTTP) {
            return toyEmbedder.embed(text);
        }
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open", false);
        }
        try {
            List<Double> vector = embeddingGateway.embed(text, timeBudgetMs);
            if (vector.size() != properties.getDimension()) {
                throw new EmbeddingUnavailableException(
                    "embed_dimension_mismatch expected=" + properties.getDimension() + " actual=" + vector.size(),
                    false
                );
            }
            breaker.recordSuccess();
            return vector;
        } catch (EmbeddingUnavailableException ex) {
            if (Thread.currentThread().isInterrupted()) {
                throw ex;
            }
            if (breaker.recordFailure()) {
                log.warn("embed_circuit_opened reason={}", ex.getMessage());
            }
            throw ex;
        }
    }
}
