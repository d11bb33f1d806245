/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.policy;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;

/**
 * Picks the most native representation a filter primitive supports.
 * <ol>
 * <li>{@link RenderStrategy#NATIVE_EFFECT NATIVE_EFFECT}, if the native
 * effect table lists the primitive, its parameters are within the listed
 * ranges, and the complexity is within the entry's limit;</li>
 * <li>{@link RenderStrategy#VECTOR_APPROX VECTOR_APPROX}, if the primitive
 * has a vector approximation accepting the parameters and the
 * complexity;</li>
 * <li>{@link RenderStrategy#EMF_FALLBACK EMF_FALLBACK} otherwise.</li>
 * </ol>
 * <p>
 * {@code RASTER_FALLBACK} is never chosen here; it results only from a
 * failed metafile encoding.  Decisions are pure: for given kind and
 * parameters, a higher complexity never yields a more native strategy.</p>
 */
public class FallbackPolicyEngine {

    static final Logger log = Logger.getLogger(FallbackPolicyEngine.class.getName());

    private final NativeEffectTable nativeEffects;

    private final Function<PrimitiveKind, Optional<VectorApproximation>> approximations;

    public FallbackPolicyEngine(NativeEffectTable nativeEffects,
            Function<PrimitiveKind, Optional<VectorApproximation>> approximations) {
        this.nativeEffects = Objects.requireNonNull(nativeEffects, "nativeEffects");
        this.approximations = Objects.requireNonNull(approximations, "approximations");
    }

    public NativeEffectTable nativeEffects() {
        return nativeEffects;
    }

    /**
     * {@return the version of the native effect table, identifying the
     * decisions this engine makes}
     */
    public String version() {
        return nativeEffects.version();
    }

    public RenderStrategy decide(PrimitiveKind kind, Parameters params, double complexity) {
        RenderStrategy strategy = decide0(kind, params, complexity);
        log.finer(() -> kind.elementName() + " (complexity " + complexity + "): " + strategy);
        return strategy;
    }

    private RenderStrategy decide0(PrimitiveKind kind, Parameters params, double complexity) {
        if (Double.isNaN(complexity))
            return RenderStrategy.EMF_FALLBACK;

        Optional<NativeEffectTable.Entry> entry = nativeEffects.entry(kind);
        if (entry.isPresent()
                && complexity <= entry.get().maxComplexity
                && entry.get().accepts(params)) {
            return RenderStrategy.NATIVE_EFFECT;
        }

        Optional<VectorApproximation> approximation = approximations.apply(kind);
        if (approximation.isPresent()
                && complexity <= approximation.get().maxComplexity()
                && approximation.get().accepts(params)) {
            return RenderStrategy.VECTOR_APPROX;
        }

        return RenderStrategy.EMF_FALLBACK;
    }

}
