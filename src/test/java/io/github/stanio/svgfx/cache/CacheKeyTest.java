/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.github.stanio.svgfx.graph.FilterGraph;
import io.github.stanio.svgfx.graph.FilterPrimitiveSpec;
import io.github.stanio.svgfx.graph.PrimitiveKind;

class CacheKeyTest {

    static FilterGraph shadow(String id, double dx, double dy, boolean dyFirst) {
        FilterPrimitiveSpec.Builder offset = FilterPrimitiveSpec.builder(id, PrimitiveKind.OFFSET);
        if (dyFirst) {
            offset.param("dy", dy).param("dx", dx);
        } else {
            offset.param("dx", dx).param("dy", dy);
        }
        return FilterGraph.of(offset.build());
    }

    @Test
    void attributeOrderIrrelevant() {
        CacheKey key1 = CacheKey.of(shadow("s", 2, 3, false), "src", "v1");
        CacheKey key2 = CacheKey.of(shadow("s", 2, 3, true), "src", "v1");

        assertThat(key1).isEqualTo(key2).hasSameHashCodeAs(key2);
    }

    @Test
    void valuesDistinguishKeys() {
        CacheKey key1 = CacheKey.of(shadow("s", 2, 3, false), "src", "v1");

        assertThat(CacheKey.of(shadow("s", 2, 4, false), "src", "v1"))
                .as("parameter").isNotEqualTo(key1);
        assertThat(CacheKey.of(shadow("s", 2, 3, false), "other", "v1"))
                .as("input").isNotEqualTo(key1);
        assertThat(CacheKey.of(shadow("s", 2, 3, false), "src", "v2"))
                .as("salt").isNotEqualTo(key1);
    }

    @Test
    void partBoundariesMatter() {
        assertThat(CacheKey.of("ab", "c")).isNotEqualTo(CacheKey.of("a", "bc"));
    }

    @Test
    void digestIsHex() {
        assertThat(CacheKey.of("x").digest()).hasSize(64).matches("[0-9a-f]+");
    }

}
