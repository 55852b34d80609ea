package com.tsl.search.embed;

import com.tsl.search.cache.CacheKeys;
import com.tsl.search.cache.TtlCache;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingCache {
    private final EmbeddingProperties.Cache settings;
    private final String namespace;
    private final TtlCache<List<Double>> entries;
    private final MeterRegistry meterRegistry;

    public EmbeddingCache(EmbeddingProperties properties, MeterRegistry meterRegistry) {
        this.settings = properties.getCache() == null ? new EmbeddingProperties.Cache() : properties.getCache();
        this.namespace = "embed:" + properties.getMode() + ":" + properties.getModel() + ":" + properties.getDimension();
        this.entries = new TtlCache<>(Math.max(1, settings.getMaxEntries()));
        this.meterRegistry = meterRegistry;
    }

    public List<Double> get(String text, Function<String, List<Double>> provider) {
        String key = keyFor(text);
        if (key == null) {
            return provider.apply(text);
        }
        Optional<List<Double>> cached = entries.get(key);
        if (cached.isPresent()) {
            meterRegistry.counter("ts_embedding_cache_total", "result", "hit").increment();
            return cached.get();
        }
        meterRegistry.counter("ts_embedding_cache_total", "result", "miss").increment();
        List<Double> vector = provider.apply(text);
        entries.put(key, List.copyOf(vector), settings.getTtlMs());
        return vector;
    }

    public int size() {
        return entries.size();
    }

    String keyFor(String text) {
        if (!settings.isEnabled() || text == null) {
            return null;
        }
        String normalized = text.trim().replaceAll("\\s+", " ");
        if (settings.isNormalize()) {
            normalized = normalized.toLowerCase(Locale.ROOT);
        }
        if (normalized.isEmpty()) {
            return null;
        }
        if (settings.getMaxTextLength() > 0 && normalized.length() > settings.getMaxTextLength()) {
            return null;
        }
        return namespace + ":" + CacheKeys.sha256(normalized);
    }
}
