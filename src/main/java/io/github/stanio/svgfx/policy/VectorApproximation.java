/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.policy;

import java.util.Objects;
import java.util.function.Predicate;

import io.github.stanio.svgfx.graph.Parameters;

/**
 * A primitive's ability to approximate its effect with vector DrawingML.
 *
 * @see  FallbackPolicyEngine
 */
public interface VectorApproximation {

    /**
     * Tests whether the approximation error for the given parameters stays
     * within the acceptable bound.
     *
     * @param   params  primitive parameters
     * @return  {@code true} if the parameters can be approximated
     */
    boolean accepts(Parameters params);

    /**
     * {@return the maximum complexity score the approximation handles}
     */
    double maxComplexity();

    static VectorApproximation of(Predicate<Parameters> accepts, double maxComplexity) {
        Objects.requireNonNull(accepts, "accepts");
        return new VectorApproximation() {
            @Override public boolean accepts(Parameters params) {
                return accepts.test(params);
            }
            @Override public double maxComplexity() {
                return maxComplexity;
            }
            @Override public String toString() {
                return "VectorApproximation(maxComplexity=" + maxComplexity + ")";
            }
        };
    }

}
