/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * Maps primitive kinds to {@code Filter} implementations.  Registration is
 * last-write-wins.  Thread-safe: lookups from concurrently executing chains
 * don't block each other.
 */
public class FilterRegistry {

    static final Logger log = Logger.getLogger(FilterRegistry.class.getName());

    private final Map<PrimitiveKind, Supplier<? extends Filter>> factories =
            new EnumMap<>(PrimitiveKind.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FilterRegistry() {
        // empty
    }

    /**
     * {@return a registry with all built-in primitives registered}
     */
    public static FilterRegistry withDefaults() {
        FilterRegistry registry = new FilterRegistry();
        registry.register(new GaussianBlurFilter());
        registry.register(new OffsetFilter());
        registry.register(new FloodFilter());
        registry.register(new MergeFilter());
        registry.register(new ColorMatrixFilter());
        registry.register(new ComponentTransferFilter());
        registry.register(new CompositeFilter());
        registry.register(new BlendFilter());
        registry.register(new ConvolveMatrixFilter());
        registry.register(new MorphologyFilter());
        registry.register(new DiffuseLightingFilter());
        registry.register(new SpecularLightingFilter());
        registry.register(new DisplacementMapFilter());
        registry.register(new TileFilter());
        return registry;
    }

    public void register(PrimitiveKind kind, Supplier<? extends Filter> factory) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(factory, "factory");
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Supplier<? extends Filter> previous = factories.put(kind, factory);
            if (previous != null) {
                log.fine(() -> "Replaced filter for " + kind.elementName());
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Registers a stateless filter instance under its own kind.
     */
    public void register(Filter filter) {
        register(filter.kind(), () -> filter);
    }

    /**
     * Registers {@code Filter} implementations available through {@code
     * ServiceLoader}, replacing existing registrations of the same kinds.
     *
     * @return  the number of filters registered
     */
    public int loadProviders() {
        return loadProviders(Thread.currentThread().getContextClassLoader());
    }

    public int loadProviders(ClassLoader classLoader) {
        int count = 0;
        for (Filter filter : ServiceLoader.load(Filter.class, classLoader)) {
            register(filter);
            count++;
        }
        int total = count;
        log.fine(() -> "Loaded " + total + " filter providers");
        return count;
    }

    public Filter resolve(PrimitiveKind kind) throws FilterNotFoundException {
        Supplier<? extends Filter> factory;
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            factory = factories.get(kind);
        } finally {
            readLock.unlock();
        }
        if (factory == null)
            throw new FilterNotFoundException(kind);

        return factory.get();
    }

    public boolean isRegistered(PrimitiveKind kind) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return factories.containsKey(kind);
        } finally {
            readLock.unlock();
        }
    }

    public Set<PrimitiveKind> kinds() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return factories.isEmpty() ? EnumSet.noneOf(PrimitiveKind.class)
                                       : EnumSet.copyOf(factories.keySet());
        } finally {
            readLock.unlock();
        }
    }

    /**
     * {@return the vector approximation of the filter registered for the
     * given kind, or empty if none is registered, or it has none}
     *
     * @param   kind  primitive kind
     */
    public Optional<VectorApproximation> vectorApproximation(PrimitiveKind kind) {
        try {
            return resolve(kind).vectorApproximation();
        } catch (FilterNotFoundException e) {
            log.finer(e::getMessage);
            return Optional.empty();
        }
    }

    public boolean unregister(PrimitiveKind kind) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return factories.remove(kind) != null;
        } finally {
            writeLock.unlock();
        }
    }

    public void clear() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            factories.clear();
        } finally {
            writeLock.unlock();
        }
    }

}
