package com.tsl.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TtlCacheTest {
    private final AtomicLong now = new AtomicLong(0L);

    @Test
    void entriesExpireAfterTtl() {
        TtlCache<String> cache = new TtlCache<>(10, now::get);
        cache.put("k", "v", 100L);

        assertThat(cache.get("k")).contains("v");
        now.set(101L);
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictsLeastRecentlyUsed() {
        TtlCache<String> cache = new TtlCache<>(2, now::get);
        cache.put("a", "1", 1_000L);
        cache.put("b", "2", 1_000L);
        cache.get("a");
        cache.put("c", "3", 1_000L);

        assertThat(cache.get("a")).contains("1");
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("c")).contains("3");
    }

    @Test
    void ignoresNullsAndNonPositiveTtl() {
        TtlCache<String> cache = new TtlCache<>(2, now::get);
        cache.put(null, "v", 10L);
        cache.put("k", null, 10L);
        cache.put("k", "v", 0L);

        assertThat(cache.size()).isZero();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    void sha256IsStableHex() {
        assertThat(CacheKeys.sha256("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
