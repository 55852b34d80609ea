package com.tsl.search.embed;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class EmbeddingCacheTest {
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final AtomicInteger calls = new AtomicInteger();

    @Test
    void normalizedQueriesShareOneEntry() {
        EmbeddingCache cache = new EmbeddingCache(properties(true), meterRegistry);

        cache.get("Wine  Tasting", this::vector);
        cache.get(" wine tasting ", this::vector);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(meterRegistry.counter("ts_embedding_cache_total", "result", "miss").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("ts_embedding_cache_total", "result", "hit").count()).isEqualTo(1.0);
    }

    @Test
    void caseIsKeptWhenNormalizationIsOff() {
        EmbeddingCache cache = new EmbeddingCache(properties(false), meterRegistry);

        cache.get("Wine Tasting", this::vector);
        cache.get("wine tasting", this::vector);

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void documentLengthTextBypassesCache() {
        EmbeddingProperties props = properties(true);
        props.getCache().setMaxTextLength(10);
        EmbeddingCache cache = new EmbeddingCache(props, meterRegistry);

        cache.get("Vineyard tours and wine cellars near Siena.", this::vector);
        cache.get("Vineyard tours and wine cellars near Siena.", this::vector);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    void keysAreNamespacedByEmbeddingSpace() {
        EmbeddingProperties toy = properties(true);
        EmbeddingProperties http = properties(true);
        http.setMode(EmbeddingMode.HTTP);
        EmbeddingProperties otherModel = properties(true);
        otherModel.setModel("other-model");

        String toyKey = new EmbeddingCache(toy, meterRegistry).keyFor("hiking");

        assertThat(new EmbeddingCache(http, meterRegistry).keyFor("hiking")).isNotEqualTo(toyKey);
        assertThat(new EmbeddingCache(otherModel, meterRegistry).keyFor("hiking")).isNotEqualTo(toyKey);
    }

    @Test
    void disabledCacheAlwaysCallsProvider() {
        EmbeddingProperties props = properties(true);
        props.getCache().setEnabled(false);
        EmbeddingCache cache = new EmbeddingCache(props, meterRegistry);

        cache.get("hiking", this::vector);
        cache.get("hiking", this::vector);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(cache.keyFor("hiking")).isNull();
    }

    private List<Double> vector(String text) {
        calls.incrementAndGet();
        return List.of(0.5, 0.5);
    }

    private static EmbeddingProperties properties(boolean normalize) {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getCache().setEnabled(true);
        props.getCache().setNormalize(normalize);
        return props;
    }
}
