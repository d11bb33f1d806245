/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.cache;

import java.io.Closeable;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.ToLongFunction;
import java.util.logging.Logger;

/**
 * Bounded LRU cache of filter execution results.
 * <p>
 * Entries are evicted least-recently-used first once either the entry count
 * or the total size estimate exceeds its limit, and expire after their TTL.
 * Expired entries are dropped on access, and by a background sweep on a
 * daemon thread when a sweep interval is configured.</p>
 * <p>
 * A checksum of each value is recorded on {@code put} and verified on
 * {@code get}.  A mismatch flushes that single entry and reports a
 * miss.</p>
 * <p>
 * All operations are guarded by a single lock; the cache may be shared by
 * concurrently executing chains.</p>
 *
 * @param   <V>  value type
 */
public class CacheManager<V> implements Closeable {

    static final Logger log = Logger.getLogger(CacheManager.class.getName());

    public static final int DEFAULT_MAX_ENTRIES = 512;

    /** 64 MiB */
    public static final long DEFAULT_MAX_BYTES = 64L * 1024 * 1024;

    /** 10 minutes */
    public static final long DEFAULT_TTL_MILLIS = 600_000;


    /**
     * Point-in-time cache counters.
     */
    public static final class Stats {

        public final long hits;
        public final long misses;
        public final long evictions;
        public final long expirations;
        public final long corruptions;
        public final int entries;
        public final long bytes;

        Stats(long hits, long misses, long evictions, long expirations,
              long corruptions, int entries, long bytes) {
            this.hits = hits;
            this.misses = misses;
            this.evictions = evictions;
            this.expirations = expirations;
            this.corruptions = corruptions;
            this.entries = entries;
            this.bytes = bytes;
        }

        public double hitRate() {
            long total = hits + misses;
            return (total == 0) ? 0 : (double) hits / total;
        }

        @Override
        public String toString() {
            return "Stats(hits=" + hits + ", misses=" + misses
                    + ", evictions=" + evictions + ", expirations=" + expirations
                    + ", corruptions=" + corruptions
                    + ", entries=" + entries + ", bytes=" + bytes + ")";
        }

    } // class Stats


    private final int maxEntries;
    private final long maxBytes;
    private final long ttlMillis;
    private final ToLongFunction<? super V> checksum;
    private final LongSupplier clock;

    private final LinkedHashMap<CacheKey, CacheEntry<V>> entries =
            new LinkedHashMap<>(16, 0.75f, true); // access-order

    private final Lock lock = new ReentrantLock();

    private final ScheduledExecutorService sweeper;

    private long totalBytes;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;
    private long corruptions;

    private boolean closed;

    CacheManager(Builder<V> builder) {
        this.maxEntries = builder.maxEntries;
        this.maxBytes = builder.maxBytes;
        this.ttlMillis = builder.ttlMillis;
        this.checksum = builder.checksum;
        this.clock = builder.clock;

        if (builder.sweepIntervalMillis > 0) {
            sweeper = Executors.newSingleThreadScheduledExecutor(daemonThreadFactory());
            sweeper.scheduleWithFixedDelay(this::sweep,
                                           builder.sweepIntervalMillis,
                                           builder.sweepIntervalMillis,
                                           TimeUnit.MILLISECONDS);
        } else {
            sweeper = null;
        }
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    private static ThreadFactory daemonThreadFactory() {
        ThreadFactory dtf = Executors.defaultThreadFactory();
        return r -> {
            Thread th = dtf.newThread(r);
            th.setName("svgfx-cache-sweep");
            th.setDaemon(true);
            return th;
        };
    }

    public Optional<V> get(CacheKey key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }

            if (entry.isExpired(clock.getAsLong())) {
                remove(key);
                expirations++;
                misses++;
                return Optional.empty();
            }

            try {
                verify(entry);
            } catch (CacheCorruptionException e) {
                log.warning(e.getMessage());
                remove(key);
                corruptions++;
                misses++;
                return Optional.empty();
            }

            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    private void verify(CacheEntry<V> entry) throws CacheCorruptionException {
        long actual = checksum.applyAsLong(entry.value());
        if (actual != entry.checksum()) {
            throw new CacheCorruptionException(entry.key(), entry.checksum(), actual);
        }
    }

    public void put(CacheKey key, V value, long sizeHint) {
        put(key, value, sizeHint, ttlMillis);
    }

    /**
     * Stores a value, replacing any existing entry for the key.  Values
     * larger than the total size limit are not stored and drop any previous
     * entry for the key.
     *
     * @param   key  cache key
     * @param   value  value to store
     * @param   sizeHint  estimated value size in bytes
     * @param   ttlMillis  time to live, or {@code 0} for no expiry
     */
    public void put(CacheKey key, V value, long sizeHint, long ttlMillis) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (sizeHint < 0)
            throw new IllegalArgumentException("Negative size: " + sizeHint);

        if (sizeHint > maxBytes) {
            log.fine(() -> "Not caching " + key + ": " + sizeHint
                    + " bytes exceeds the cache size of " + maxBytes);
            // The previous value is stale now.
            invalidate(key);
            return;
        }

        CacheEntry<V> entry = new CacheEntry<>(key, value, clock.getAsLong(),
                ttlMillis, sizeHint, checksum.applyAsLong(value));
        lock.lock();
        try {
            if (closed)
                return;

            remove(key);
            entries.put(key, entry);
            totalBytes += sizeHint;
            evictOverflow();
        } finally {
            lock.unlock();
        }
    }

    private void evictOverflow() {
        Iterator<CacheEntry<V>> iter = entries.values().iterator();
        while ((entries.size() > maxEntries || totalBytes > maxBytes) && iter.hasNext()) {
            CacheEntry<V> eldest = iter.next();
            iter.remove();
            totalBytes -= eldest.size();
            evictions++;
            log.finer(() -> "Evicted " + eldest.key());
        }
    }

    private boolean remove(CacheKey key) {
        CacheEntry<V> removed = entries.remove(key);
        if (removed == null)
            return false;

        totalBytes -= removed.size();
        return true;
    }

    public boolean invalidate(CacheKey key) {
        lock.lock();
        try {
            return remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void flush() {
        lock.lock();
        try {
            entries.clear();
            totalBytes = 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops expired entries.
     *
     * @return  the number of entries dropped
     */
    public int sweep() {
        lock.lock();
        try {
            long now = clock.getAsLong();
            int count = 0;
            Iterator<CacheEntry<V>> iter = entries.values().iterator();
            while (iter.hasNext()) {
                CacheEntry<V> entry = iter.next();
                if (entry.isExpired(now)) {
                    iter.remove();
                    totalBytes -= entry.size();
                    count++;
                }
            }
            expirations += count;
            if (count > 0) {
                int swept = count;
                log.fine(() -> "Swept " + swept + " expired entries");
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public Stats stats() {
        lock.lock();
        try {
            return new Stats(hits, misses, evictions, expirations,
                             corruptions, entries.size(), totalBytes);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the background sweep and drops all entries.  Subsequent {@code
     * put}s are ignored.
     */
    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        lock.lock();
        try {
            closed = true;
            entries.clear();
            totalBytes = 0;
        } finally {
            lock.unlock();
        }
    }


    public static final class Builder<V> {

        int maxEntries = DEFAULT_MAX_ENTRIES;
        long maxBytes = DEFAULT_MAX_BYTES;
        long ttlMillis = DEFAULT_TTL_MILLIS;
        long sweepIntervalMillis;
        ToLongFunction<? super V> checksum = value -> value.hashCode();
        LongSupplier clock = System::currentTimeMillis;

        Builder() {}

        public Builder<V> maxEntries(int maxEntries) {
            if (maxEntries < 1)
                throw new IllegalArgumentException("maxEntries: " + maxEntries);

            this.maxEntries = maxEntries;
            return this;
        }

        public Builder<V> maxBytes(long maxBytes) {
            if (maxBytes < 1)
                throw new IllegalArgumentException("maxBytes: " + maxBytes);

            this.maxBytes = maxBytes;
            return this;
        }

        /**
         * @param   ttlMillis  default time to live, or {@code 0} for no
         *          expiry
         */
        public Builder<V> ttlMillis(long ttlMillis) {
            if (ttlMillis < 0)
                throw new IllegalArgumentException("ttlMillis: " + ttlMillis);

            this.ttlMillis = ttlMillis;
            return this;
        }

        /**
         * @param   intervalMillis  background sweep interval, or {@code 0}
         *          for no background sweep
         */
        public Builder<V> sweepIntervalMillis(long intervalMillis) {
            if (intervalMillis < 0)
                throw new IllegalArgumentException("sweepIntervalMillis: " + intervalMillis);

            this.sweepIntervalMillis = intervalMillis;
            return this;
        }

        public Builder<V> checksum(ToLongFunction<? super V> checksum) {
            this.checksum = Objects.requireNonNull(checksum, "checksum");
            return this;
        }

        /**
         * @param   clock  current time in milliseconds
         */
        public Builder<V> clock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public CacheManager<V> build() {
            return new CacheManager<>(this);
        }

    } // class Builder


}
