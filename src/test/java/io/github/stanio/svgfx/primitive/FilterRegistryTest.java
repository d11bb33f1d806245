/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;

import org.junit.jupiter.api.Test;

import io.github.stanio.svgfx.graph.PrimitiveKind;

class FilterRegistryTest {

    @Test
    void defaultsCoverAllKinds() {
        FilterRegistry registry = FilterRegistry.withDefaults();

        assertThat(registry.kinds()).isEqualTo(EnumSet.allOf(PrimitiveKind.class));
    }

    @Test
    void serviceProvidersDiscovered() {
        FilterRegistry registry = new FilterRegistry();

        assertThat(registry.loadProviders(getClass().getClassLoader()))
                .as("providers loaded").isEqualTo(14);
        assertThat(registry.isRegistered(PrimitiveKind.TILE)).as("feTile").isTrue();
    }

    @Test
    void lastRegistrationWins() throws Exception {
        FilterRegistry registry = new FilterRegistry();
        OffsetFilter first = new OffsetFilter();
        OffsetFilter second = new OffsetFilter();

        registry.register(first);
        registry.register(second);

        assertThat(registry.resolve(PrimitiveKind.OFFSET)).isSameAs(second);
    }

    @Test
    void factoryRegistration() throws Exception {
        FilterRegistry registry = new FilterRegistry();
        registry.register(PrimitiveKind.GAUSSIAN_BLUR, GaussianBlurFilter::new);

        Filter filter1 = registry.resolve(PrimitiveKind.GAUSSIAN_BLUR);
        Filter filter2 = registry.resolve(PrimitiveKind.GAUSSIAN_BLUR);

        assertThat(filter1).isInstanceOf(GaussianBlurFilter.class)
                           .isNotSameAs(filter2);
    }

    @Test
    void unregisteredKindNotFound() {
        FilterRegistry registry = FilterRegistry.withDefaults();

        assertThat(registry.unregister(PrimitiveKind.MORPHOLOGY)).as("unregister").isTrue();
        assertThat(registry.unregister(PrimitiveKind.MORPHOLOGY)).as("unregister again").isFalse();
        assertThatThrownBy(() -> registry.resolve(PrimitiveKind.MORPHOLOGY))
                .isInstanceOf(FilterNotFoundException.class)
                .hasMessage("No filter registered for feMorphology");
        assertThat(registry.vectorApproximation(PrimitiveKind.MORPHOLOGY)).isEmpty();
    }

    @Test
    void clearRemovesAll() {
        FilterRegistry registry = FilterRegistry.withDefaults();
        registry.clear();

        assertThat(registry.kinds()).isEmpty();
    }

}
