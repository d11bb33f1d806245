/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CacheManagerTest {

    private final AtomicLong clock = new AtomicLong(1_000);

    private CacheManager<byte[]> cache;

    @AfterEach
    void tearDown() {
        if (cache != null) {
            cache.close();
        }
    }

    private CacheManager.Builder<byte[]> builder() {
        return CacheManager.<byte[]>builder()
                .checksum(Arrays::hashCode)
                .clock(clock::get);
    }

    private static CacheKey key(String name) {
        return CacheKey.of(name);
    }

    @Test
    void leastRecentlyUsedEvictedByCount() {
        cache = builder().maxEntries(2).build();
        cache.put(key("a"), new byte[1], 1);
        cache.put(key("b"), new byte[1], 1);
        assertThat(cache.get(key("a"))).as("touch a").isPresent();

        cache.put(key("c"), new byte[1], 1);

        assertThat(cache.get(key("b"))).as("b").isEmpty();
        assertThat(cache.get(key("a"))).as("a").isPresent();
        assertThat(cache.get(key("c"))).as("c").isPresent();
        assertThat(cache.stats().evictions).as("evictions").isEqualTo(1);
    }

    @Test
    void evictedByTotalSize() {
        cache = builder().maxBytes(100).build();
        cache.put(key("a"), new byte[40], 40);
        cache.put(key("b"), new byte[40], 40);
        cache.put(key("c"), new byte[40], 40);

        CacheManager.Stats stats = cache.stats();
        assertThat(stats.entries).as("entries").isEqualTo(2);
        assertThat(stats.bytes).as("bytes").isEqualTo(80);
        assertThat(cache.get(key("a"))).isEmpty();
    }

    @Test
    void oversizedValueNotStored() {
        cache = builder().maxBytes(100).build();
        cache.put(key("big"), new byte[200], 200);

        assertThat(cache.size()).isZero();
    }

    @Test
    void oversizedReplacementDropsPrevious() {
        cache = builder().maxBytes(100).build();
        cache.put(key("k"), new byte[] { 1 }, 1);

        cache.put(key("k"), new byte[200], 200);

        assertThat(cache.get(key("k"))).as("stale value").isEmpty();
        assertThat(cache.stats().bytes).as("bytes").isZero();
    }

    @Test
    void negativeSizeRejected() {
        cache = builder().build();

        assertThatThrownBy(() -> cache.put(key("a"), new byte[0], -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replacingKeepsByteAccount() {
        cache = builder().build();
        cache.put(key("a"), new byte[10], 10);
        cache.put(key("a"), new byte[30], 30);

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.stats().bytes).isEqualTo(30);
        assertThat(cache.get(key("a"))).get()
                .satisfies(value -> assertThat(value).hasSize(30));
    }

    @Test
    void expiredEntryIsMiss() {
        cache = builder().ttlMillis(500).build();
        cache.put(key("a"), new byte[1], 1);

        clock.addAndGet(499);
        assertThat(cache.get(key("a"))).as("before expiry").isPresent();

        clock.addAndGet(1);
        assertThat(cache.get(key("a"))).as("at expiry").isEmpty();

        CacheManager.Stats stats = cache.stats();
        assertThat(stats.expirations).as("expirations").isEqualTo(1);
        assertThat(stats.hits).as("hits").isEqualTo(1);
        assertThat(stats.misses).as("misses").isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    @Test
    void perEntryTimeToLive() {
        cache = builder().ttlMillis(0).build();
        cache.put(key("forever"), new byte[1], 1);
        cache.put(key("short"), new byte[1], 1, 10);

        clock.addAndGet(1_000_000);

        assertThat(cache.sweep()).as("swept").isEqualTo(1);
        assertThat(cache.get(key("forever"))).isPresent();
        assertThat(cache.get(key("short"))).isEmpty();
    }

    @Test
    void sweepDropsExpired() {
        cache = builder().ttlMillis(100).build();
        cache.put(key("a"), new byte[5], 5);
        clock.addAndGet(50);
        cache.put(key("b"), new byte[5], 5);
        clock.addAndGet(60);

        assertThat(cache.sweep()).isEqualTo(1);

        CacheManager.Stats stats = cache.stats();
        assertThat(stats.entries).as("entries").isEqualTo(1);
        assertThat(stats.bytes).as("bytes").isEqualTo(5);
        assertThat(stats.expirations).as("expirations").isEqualTo(1);
    }

    @Test
    void corruptedEntryDiscarded() {
        cache = builder().build();
        byte[] value = { 1, 2, 3 };
        cache.put(key("a"), value, value.length);

        value[1] = 42;

        assertThat(cache.get(key("a"))).isEmpty();
        CacheManager.Stats stats = cache.stats();
        assertThat(stats.corruptions).as("corruptions").isEqualTo(1);
        assertThat(stats.entries).as("entries").isZero();
        assertThat(stats.bytes).as("bytes").isZero();
    }

    @Test
    void invalidateAndFlush() {
        cache = builder().build();
        cache.put(key("a"), new byte[1], 1);
        cache.put(key("b"), new byte[1], 1);

        assertThat(cache.invalidate(key("a"))).as("invalidate a").isTrue();
        assertThat(cache.invalidate(key("a"))).as("invalidate again").isFalse();

        cache.flush();
        assertThat(cache.size()).isZero();
        assertThat(cache.stats().bytes).isZero();
    }

    @Test
    void closedCacheIgnoresPut() {
        cache = builder().build();
        cache.put(key("a"), new byte[1], 1);
        cache.close();

        cache.put(key("b"), new byte[1], 1);

        assertThat(cache.size()).isZero();
    }

    @Test
    void backgroundSweepStopsOnClose() throws Exception {
        cache = CacheManager.<byte[]>builder()
                .ttlMillis(1)
                .sweepIntervalMillis(10)
                .build();
        cache.put(key("a"), new byte[1], 1);

        long timeout = System.currentTimeMillis() + 5_000;
        while (cache.size() > 0 && System.currentTimeMillis() < timeout) {
            Thread.sleep(10);
        }

        assertThat(cache.size()).as("size after sweep").isZero();
    }

} // class CacheManagerTest
