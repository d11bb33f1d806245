/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.cache.CacheKey;
import io.github.stanio.svgfx.emf.EMFDocument;
import io.github.stanio.svgfx.policy.RenderStrategy;

/**
 * The converted filter effect.  Depending on the overall strategy the
 * payload is a DrawingML fragment ({@code NATIVE_EFFECT}, {@code
 * VECTOR_APPROX}), an EMF blob ({@code EMF_FALLBACK}), or PNG image data
 * ({@code RASTER_FALLBACK}).  Immutable.
 */
public final class FilterExecutionResult {

    private final RenderStrategy strategy;
    private final String fragment;
    private final EMFDocument emf;
    private final byte[] png;
    private final Rectangle2D bounds;
    private final CacheKey cacheKey;
    private final List<NodeResult> nodeResults;
    private final List<Diagnostic> diagnostics;
    private final boolean cacheHit;

    private FilterExecutionResult(RenderStrategy strategy,
                                  String fragment,
                                  EMFDocument emf,
                                  byte[] png,
                                  Rectangle2D bounds,
                                  CacheKey cacheKey,
                                  List<NodeResult> nodeResults,
                                  List<Diagnostic> diagnostics,
                                  boolean cacheHit) {
        this.strategy = strategy;
        this.fragment = fragment;
        this.emf = emf;
        this.png = png;
        this.bounds = bounds;
        this.cacheKey = cacheKey;
        this.nodeResults = nodeResults;
        this.diagnostics = diagnostics;
        this.cacheHit = cacheHit;
    }

    static FilterExecutionResult ofFragment(RenderStrategy strategy,
                                            String fragment,
                                            Rectangle2D bounds,
                                            CacheKey cacheKey,
                                            List<NodeResult> nodeResults,
                                            List<Diagnostic> diagnostics) {
        if (strategy.compareTo(RenderStrategy.VECTOR_APPROX) > 0)
            throw new IllegalArgumentException("Not a markup strategy: " + strategy);

        return new FilterExecutionResult(strategy,
                Objects.requireNonNull(fragment, "fragment"), null, null,
                (Rectangle2D) bounds.clone(), cacheKey,
                copy(nodeResults), copy(diagnostics), false);
    }

    static FilterExecutionResult ofEMF(EMFDocument emf,
                                       Rectangle2D bounds,
                                       CacheKey cacheKey,
                                       List<NodeResult> nodeResults,
                                       List<Diagnostic> diagnostics) {
        return new FilterExecutionResult(RenderStrategy.EMF_FALLBACK,
                null, Objects.requireNonNull(emf, "emf"), null,
                (Rectangle2D) bounds.clone(), cacheKey,
                copy(nodeResults), copy(diagnostics), false);
    }

    static FilterExecutionResult ofPNG(byte[] png,
                                       Rectangle2D bounds,
                                       CacheKey cacheKey,
                                       List<NodeResult> nodeResults,
                                       List<Diagnostic> diagnostics) {
        return new FilterExecutionResult(RenderStrategy.RASTER_FALLBACK,
                null, null, png.clone(),
                (Rectangle2D) bounds.clone(), cacheKey,
                copy(nodeResults), copy(diagnostics), false);
    }

    private static <T> List<T> copy(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    FilterExecutionResult asCacheHit() {
        return new FilterExecutionResult(strategy, fragment, emf, png, bounds,
                cacheKey, nodeResults, diagnostics, true);
    }

    public RenderStrategy strategy() {
        return strategy;
    }

    /**
     * {@return the DrawingML effect markup, for native and vector strategies}
     */
    public Optional<String> fragment() {
        return Optional.ofNullable(fragment);
    }

    /**
     * {@return the metafile, for the {@code EMF_FALLBACK} strategy}
     */
    public Optional<EMFDocument> emf() {
        return Optional.ofNullable(emf);
    }

    /**
     * {@return the PNG image data, for the {@code RASTER_FALLBACK} strategy}
     */
    public Optional<byte[]> png() {
        return Optional.ofNullable(png).map(byte[]::clone);
    }

    /**
     * {@return the payload bytes: the UTF-8 encoded fragment, the EMF or
     * PNG data}
     */
    public byte[] payload() {
        if (fragment != null)
            return fragment.getBytes(StandardCharsets.UTF_8);

        return (emf != null) ? emf.toByteArray() : png.clone();
    }

    public Rectangle2D bounds() {
        return (Rectangle2D) bounds.clone();
    }

    public CacheKey cacheKey() {
        return cacheKey;
    }

    /**
     * {@return the per-primitive results, in execution order}
     */
    public List<NodeResult> nodeResults() {
        return nodeResults;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * {@return whether this result was served from the cache}
     */
    public boolean isCacheHit() {
        return cacheHit;
    }

    /**
     * {@return the payload size estimate, for cache accounting}
     */
    public long sizeEstimate() {
        if (fragment != null)
            return 2L * fragment.length();

        return (emf != null) ? emf.size() : png.length;
    }

    /**
     * {@return a CRC-32 of the strategy and the payload}
     */
    public long checksum() {
        CRC32 crc = new CRC32();
        crc.update(strategy.ordinal());
        crc.update(payload());
        return crc.getValue();
    }

    @Override
    public String toString() {
        return "FilterExecutionResult(" + strategy + ", " + sizeEstimate()
                + " bytes, bounds=" + bounds
                + (cacheHit ? ", cached" : "") + ")";
    }

}
