/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class FilterGraphTest {

    @Test
    void duplicateIdRejected() {
        FilterGraph.Builder builder = FilterGraph.builder("shadow")
                .add(FilterPrimitiveSpec.builder("a", PrimitiveKind.OFFSET));

        assertThatThrownBy(() -> builder.add(FilterPrimitiveSpec
                        .builder("a", PrimitiveKind.GAUSSIAN_BLUR)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate primitive id: a");
    }

    @Test
    void tooManyInputsRejected() {
        assertThatThrownBy(() -> FilterPrimitiveSpec.builder("blur", PrimitiveKind.GAUSSIAN_BLUR)
                        .in("SourceGraphic").in("SourceAlpha").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("blur: feGaussianBlur takes at most 1 input(s)");
    }

    @Test
    void wellKnownInputs() {
        assertThat(InputRef.of("SourceGraphic")).isSameAs(InputRef.SOURCE_GRAPHIC);
        assertThat(InputRef.of(" SourceAlpha ")).isSameAs(InputRef.SOURCE_ALPHA);
        assertThat(InputRef.of("BackgroundImage")).isSameAs(InputRef.BACKGROUND_IMAGE);

        InputRef named = InputRef.of("blurred");
        assertThat(named.isWellKnown()).as("isWellKnown").isFalse();
        assertThat(named.resultName()).isEqualTo("blurred");
        assertThat(named).isEqualTo(InputRef.result("blurred"));
    }

    @Test
    void emptyInputRejected() {
        assertThatThrownBy(() -> InputRef.of("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void elementNameLookup() {
        assertThat(PrimitiveKind.forElementName("feConvolveMatrix"))
                .isEqualTo(PrimitiveKind.CONVOLVE_MATRIX);
        assertThatThrownBy(() -> PrimitiveKind.forElementName("feImage"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("feImage");
    }

    @Test
    void attributeOrderIrrelevant() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("dx", 3);
        forward.put("dy", 4.0);
        Map<String, Object> reverse = new LinkedHashMap<>();
        reverse.put("dy", 4);
        reverse.put("dx", 3.0);

        Parameters p1 = Parameters.of(forward);
        Parameters p2 = Parameters.of(reverse);

        assertThat(p1).isEqualTo(p2);
        assertThat(p1.hashCode()).isEqualTo(p2.hashCode());
        assertThat(p1.canonicalForm())
                .isEqualTo(p2.canonicalForm())
                .isEqualTo("dx=3.0;dy=4.0;");
    }

    @Test
    void canonicalStringsEscaped() {
        Parameters params = Parameters.builder()
                .put("in", "a\\\"b")
                .build();

        assertThat(params.canonicalForm()).isEqualTo("in=\"a\\\\\\\"b\";");
    }

    @Test
    void typedAccessors() {
        Parameters params = Parameters.builder()
                .put("stdDeviation", 2, 3)
                .put("edgeMode", "wrap")
                .put("scale", 5)
                .build();

        assertThat(params.numberPair("stdDeviation", 0)).containsExactly(2, 3);
        assertThat(params.numberPair("radius", 1)).containsExactly(1, 1);
        assertThat(params.number("scale", 0)).isEqualTo(5);
        assertThat(params.string("edgeMode", "none")).isEqualTo("wrap");
        assertThat(params.string("operator", "over")).isEqualTo("over");
        assertThatThrownBy(() -> params.number("edgeMode", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void structuralFormIgnoresValuesAndIds() {
        FilterGraph g1 = FilterGraph.of(
                FilterPrimitiveSpec.builder("a", PrimitiveKind.GAUSSIAN_BLUR)
                        .param("stdDeviation", 2).result("blur").build(),
                FilterPrimitiveSpec.builder("b", PrimitiveKind.OFFSET)
                        .in("blur").param("dx", 1).build());
        FilterGraph g2 = FilterGraph.of(
                FilterPrimitiveSpec.builder("x", PrimitiveKind.GAUSSIAN_BLUR)
                        .param("stdDeviation", 7).result("blur").build(),
                FilterPrimitiveSpec.builder("y", PrimitiveKind.OFFSET)
                        .in("blur").param("dx", 1).build());

        assertThat(g1.structuralForm()).isEqualTo(g2.structuralForm());
        assertThat(g1.parameterForm()).isNotEqualTo(g2.parameterForm());
    }

}
