/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.cache;

import java.util.Objects;

public final class CacheEntry<V> {

    private final CacheKey key;
    private final V value;
    private final long insertedAt;
    private final long ttlMillis;
    private final long size;
    private final long checksum;

    CacheEntry(CacheKey key, V value, long insertedAt, long ttlMillis, long size, long checksum) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
        this.insertedAt = insertedAt;
        this.ttlMillis = ttlMillis;
        this.size = size;
        this.checksum = checksum;
    }

    public CacheKey key() {
        return key;
    }

    public V value() {
        return value;
    }

    public long insertedAt() {
        return insertedAt;
    }

    public long ttlMillis() {
        return ttlMillis;
    }

    /**
     * {@return the estimated size in bytes}
     */
    public long size() {
        return size;
    }

    public long checksum() {
        return checksum;
    }

    public boolean isExpired(long now) {
        return ttlMillis > 0 && now - insertedAt >= ttlMillis;
    }

    @Override
    public String toString() {
        return "CacheEntry(" + key + ", size=" + size + ", insertedAt=" + insertedAt
                + ", ttl=" + ttlMillis + ")";
    }

}
