/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.logging.Logger;

import io.github.stanio.svgfx.cache.CacheManager;
import io.github.stanio.svgfx.chain.DiagnosticsSink;
import io.github.stanio.svgfx.chain.FilterChain;
import io.github.stanio.svgfx.chain.FilterExecutionResult;
import io.github.stanio.svgfx.chain.WorkerPool;
import io.github.stanio.svgfx.config.FilterConfig;
import io.github.stanio.svgfx.emf.EMFEncoder;
import io.github.stanio.svgfx.emf.RasterRenderer;
import io.github.stanio.svgfx.graph.FilterGraph;
import io.github.stanio.svgfx.policy.FallbackPolicyEngine;
import io.github.stanio.svgfx.primitive.FilterRegistry;
import io.github.stanio.svgfx.primitive.SourceGraphic;

/**
 * Shared services for converting filter effects: the primitive registry,
 * the policy engine, the result cache, and the worker pool.  Chains
 * created by a runtime share these; closing the runtime stops the workers
 * and drops the cache.
 * <pre>
 * try (FilterRuntime runtime = FilterRuntime.start(FilterConfig.defaults())) {
 *     FilterExecutionResult result = runtime.execute(graph, source);
 *     ...
 * }</pre>
 */
public class FilterRuntime implements Closeable {

    static final Logger log = Logger.getLogger(FilterRuntime.class.getName());

    private final FilterConfig config;
    private final FilterRegistry registry;
    private final FallbackPolicyEngine policy;
    private final CacheManager<FilterExecutionResult> cache;
    private final WorkerPool workerPool;
    private final EMFEncoder emfEncoder;
    private final RasterRenderer rasterRenderer;
    private final DiagnosticsSink diagnostics;

    private volatile boolean closed;

    FilterRuntime(FilterConfig config,
                  FilterRegistry registry,
                  FallbackPolicyEngine policy,
                  DiagnosticsSink diagnostics) {
        this.config = config;
        this.registry = registry;
        this.policy = policy;
        this.diagnostics = diagnostics;
        this.cache = CacheManager.<FilterExecutionResult>builder()
                .maxEntries(config.cacheCapacity())
                .maxBytes(config.cacheMaxBytes())
                .ttlMillis(config.cacheTtlMillis())
                .sweepIntervalMillis(config.cacheSweepMillis())
                .checksum(FilterExecutionResult::checksum)
                .build();
        this.workerPool = new WorkerPool(config.workerPoolSize());
        this.emfEncoder = new EMFEncoder(config.emfSizeCap());
        this.rasterRenderer = new RasterRenderer();
        log.fine(() -> "Started " + config);
    }

    /**
     * Starts a runtime with the built-in primitives, and the configured
     * native effect table.
     *
     * @param   config  runtime settings
     * @return  a new runtime
     * @throws  IOException  if loading the native effect table fails
     */
    public static FilterRuntime start(FilterConfig config) throws IOException {
        return start(config, FilterRegistry.withDefaults(), DiagnosticsSink.logging());
    }

    public static FilterRuntime start(FilterConfig config,
                                      FilterRegistry registry,
                                      DiagnosticsSink diagnostics)
            throws IOException {
        FallbackPolicyEngine policy = new FallbackPolicyEngine(
                config.loadNativeEffects(), registry::vectorApproximation);
        return new FilterRuntime(Objects.requireNonNull(config, "config"),
                                 registry, policy,
                                 Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public FilterConfig config() {
        return config;
    }

    public FilterRegistry registry() {
        return registry;
    }

    public FallbackPolicyEngine policy() {
        return policy;
    }

    public CacheManager<FilterExecutionResult> cache() {
        return cache;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    /**
     * {@return a chain builder for the given graph, preconfigured with this
     * runtime's services and settings}
     *
     * @param   graph  the filter to execute
     * @throws  IllegalStateException  if this runtime has been closed
     */
    public FilterChain.Builder newChain(FilterGraph graph) {
        if (closed)
            throw new IllegalStateException("Runtime closed");

        return FilterChain.builder(graph, registry, policy)
                .cache(cache)
                .workerPool(workerPool)
                .mode(config.executionMode())
                .failFast(config.failFast())
                .primitiveTimeoutMillis(config.primitiveTimeoutMillis())
                .chainTimeoutMillis(config.chainTimeoutMillis())
                .emuPerUnit(config.emuPerUnit())
                .emfEncoder(emfEncoder)
                .rasterRenderer(rasterRenderer)
                .diagnostics(diagnostics);
    }

    public FilterExecutionResult execute(FilterGraph graph, SourceGraphic source)
            throws FilterException {
        return newChain(graph).build().execute(source);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed)
            return;

        closed = true;
        workerPool.close();
        cache.close();
        log.fine("Closed");
    }

}
