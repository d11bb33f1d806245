/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.List;
import java.util.Optional;

import io.github.stanio.svgfx.FilterException;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * Implementation of a filter primitive kind.
 * <p>
 * Implementations must be stateless: {@code apply()} may be invoked
 * concurrently for different nodes, and must not retain or modify its
 * arguments.  Built-in implementations are discovered through {@code
 * ServiceLoader} as well, so they provide a public no-argument
 * constructor.</p>
 *
 * @see  FilterRegistry
 */
public interface Filter {

    PrimitiveKind kind();

    /**
     * Applies this primitive.  The representation produced follows {@link
     * FilterContext#strategy()}: native and vector strategies fill in the
     * DrawingML fragment, all strategies supply the result geometry.
     *
     * @param   params  primitive attributes
     * @param   inputs  resolved inputs, in {@code in}, {@code in2}, ...
     *          order
     * @param   context  per-node execution context
     * @return  the primitive result
     * @throws  FilterException  if the primitive can't be applied, is
     *          cancelled, or runs out of time
     */
    PrimitiveOutput apply(Parameters params, List<PrimitiveOutput> inputs, FilterContext context)
            throws FilterException;

    /**
     * Estimates the fidelity loss of the simpler representations, used
     * solely by the fallback policy.  0 means trivial; scores above 1 are
     * not representable but by a metafile.
     *
     * @param   params  primitive attributes
     * @return  complexity score
     */
    double complexityScore(Parameters params);

    default Optional<VectorApproximation> vectorApproximation() {
        return Optional.empty();
    }

}
