package com.tsl.search.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

public class TtlCache<V> {
    private final int maxEntries;
    private final LongSupplier clock;
    private final LinkedHashMap<String, Entry<V>> entries;

    public TtlCache(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public TtlCache(int maxEntries, LongSupplier clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry<V>> eldest) {
                return size() > TtlCache.this.maxEntries;
            }
        };
    }

    public synchronized Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.getAsLong() > entry.expiresAt) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    public synchronized void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        entries.put(key, new Entry<>(value, clock.getAsLong() + ttlMs));
    }

    public synchronized int size() {
        return entries.size();
    }

    private static final class Entry<V> {
        private final V value;
        private final long expiresAt;

        private Entry(V value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
