/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.policy;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;

class FallbackPolicyEngineTest {

    private static final VectorApproximation ANY = VectorApproximation.of(params -> true, 1.0);

    private final FallbackPolicyEngine policy =
            new FallbackPolicyEngine(NativeEffectTable.loadDefault(), kind -> {
                switch (kind) {
                case OFFSET:
                case CONVOLVE_MATRIX:
                    return Optional.of(ANY);
                default:
                    return Optional.empty();
                }
            });

    private static Parameters blur(double stdDeviation) {
        return Parameters.builder().put("stdDeviation", stdDeviation).build();
    }

    @Test
    void simpleBlurIsNative() {
        assertThat(policy.decide(PrimitiveKind.GAUSSIAN_BLUR, blur(2), 0.04))
                .isEqualTo(RenderStrategy.NATIVE_EFFECT);
    }

    @Test
    void parameterOutOfRangeIsNotNative() {
        assertThat(policy.decide(PrimitiveKind.GAUSSIAN_BLUR, blur(300), 0.04))
                .as("no approximation").isEqualTo(RenderStrategy.EMF_FALLBACK);

        Parameters farOffset = Parameters.builder().put("dx", 200).build();
        assertThat(policy.decide(PrimitiveKind.OFFSET, farOffset, 0.1))
                .as("approximated").isEqualTo(RenderStrategy.VECTOR_APPROX);
    }

    @Test
    void enumeratedValueNotListed() {
        Parameters params = Parameters.builder().put("operator", "arithmetic").build();

        assertThat(policy.decide(PrimitiveKind.COMPOSITE, params, 0.1))
                .isEqualTo(RenderStrategy.EMF_FALLBACK);
    }

    @Test
    void complexityAboveNativeBound() {
        assertThat(policy.decide(PrimitiveKind.CONVOLVE_MATRIX, Parameters.EMPTY, 0.4))
                .as("below approximation bound").isEqualTo(RenderStrategy.VECTOR_APPROX);
        assertThat(policy.decide(PrimitiveKind.CONVOLVE_MATRIX, Parameters.EMPTY, 1.2))
                .as("above approximation bound").isEqualTo(RenderStrategy.EMF_FALLBACK);
    }

    @Test
    void unknownComplexityFallsBack() {
        assertThat(policy.decide(PrimitiveKind.GAUSSIAN_BLUR, blur(1), Double.NaN))
                .isEqualTo(RenderStrategy.EMF_FALLBACK);
    }

    @Test
    void unlistedKindWithoutApproximation() {
        assertThat(policy.decide(PrimitiveKind.DISPLACEMENT_MAP, Parameters.EMPTY, 0))
                .isEqualTo(RenderStrategy.EMF_FALLBACK);
    }

    @Test
    void customTableEntry() {
        NativeEffectTable.Entry entry = new NativeEffectTable.Entry();
        entry.maxComplexity = 0.9;
        entry.params = Map.of("scale", new NativeEffectTable.Range(0.0, 5.0));
        FallbackPolicyEngine custom = new FallbackPolicyEngine(NativeEffectTable.empty()
                .with(PrimitiveKind.DISPLACEMENT_MAP, entry), kind -> Optional.empty());

        Parameters params = Parameters.builder().put("scale", 3).build();
        assertThat(custom.decide(PrimitiveKind.DISPLACEMENT_MAP, params, 0.8))
                .isEqualTo(RenderStrategy.NATIVE_EFFECT);
        assertThat(custom.version()).isEqualTo("0");
    }

    @ParameterizedTest
    @EnumSource(PrimitiveKind.class)
    void moreComplexNeverMoreNative(PrimitiveKind kind) {
        Parameters params = blur(2);
        RenderStrategy previous = RenderStrategy.NATIVE_EFFECT;
        for (double complexity = 0; complexity <= 2; complexity += 0.05) {
            RenderStrategy strategy = policy.decide(kind, params, complexity);
            assertThat(strategy).as("complexity %.2f", complexity)
                    .isGreaterThanOrEqualTo(previous)
                    .isNotEqualTo(RenderStrategy.RASTER_FALLBACK);
            previous = strategy;
        }
    }

    @Test
    void leastNativeWins() {
        assertThat(RenderStrategy.NATIVE_EFFECT.leastNative(RenderStrategy.EMF_FALLBACK))
                .isEqualTo(RenderStrategy.EMF_FALLBACK);
        assertThat(RenderStrategy.RASTER_FALLBACK.leastNative(RenderStrategy.VECTOR_APPROX))
                .isEqualTo(RenderStrategy.RASTER_FALLBACK);
    }

}
