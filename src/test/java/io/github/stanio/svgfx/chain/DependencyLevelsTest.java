/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import io.github.stanio.svgfx.chain.DependencyLevels.Edge;
import io.github.stanio.svgfx.chain.DependencyLevels.Node;
import io.github.stanio.svgfx.graph.CyclicFilterGraphException;
import io.github.stanio.svgfx.graph.FilterGraph;
import io.github.stanio.svgfx.graph.FilterGraphException;
import io.github.stanio.svgfx.graph.FilterPrimitiveSpec;
import io.github.stanio.svgfx.graph.InputRef;
import io.github.stanio.svgfx.graph.PrimitiveKind;

class DependencyLevelsTest {

    private static FilterPrimitiveSpec.Builder offset(String id) {
        return FilterPrimitiveSpec.builder(id, PrimitiveKind.OFFSET);
    }

    private static List<List<String>> ids(DependencyLevels levels) {
        return levels.levels().stream()
                .map(level -> level.stream().map(Node::id).collect(Collectors.toList()))
                .collect(Collectors.toList());
    }

    @Test
    void implicitInputsChainSequentially() throws Exception {
        DependencyLevels levels = DependencyLevels.resolve(FilterGraph.of(
                offset("a").build(),
                offset("b").build(),
                FilterPrimitiveSpec.builder("c", PrimitiveKind.COMPOSITE).build()));

        assertThat(ids(levels)).containsExactly(List.of("a"), List.of("b"), List.of("c"));

        Node first = levels.node(0);
        assertThat(first.inputs()).hasSize(1);
        assertThat(first.inputs().get(0).source()).isEqualTo(InputRef.Source.SOURCE_GRAPHIC);

        Node composite = levels.node(2);
        Edge in = composite.inputs().get(0);
        Edge in2 = composite.inputs().get(1);
        assertThat(in.node()).as("in").isEqualTo(1);
        assertThat(in2.source()).as("in2").isEqualTo(InputRef.Source.SOURCE_GRAPHIC);
        assertThat(levels.outputNode().id()).isEqualTo("c");
    }

    @Test
    void independentBranchesShareLevel() throws Exception {
        DependencyLevels levels = DependencyLevels.resolve(FilterGraph.of(
                offset("left").in("SourceGraphic").result("l").build(),
                offset("right").in("SourceAlpha").result("r").build(),
                FilterPrimitiveSpec.builder("merge", PrimitiveKind.MERGE)
                        .in("l").in("r").build()));

        assertThat(ids(levels)).containsExactly(List.of("left", "right"), List.of("merge"));
        assertThat(levels.node(2).inputs())
                .extracting(Edge::node)
                .containsExactly(0, 1);
    }

    @Test
    void nearestPrecedingProducerWins() throws Exception {
        DependencyLevels levels = DependencyLevels.resolve(FilterGraph.of(
                offset("a").result("x").build(),
                offset("b").result("x").build(),
                offset("c").in("x").build()));

        assertThat(levels.node(2).inputs().get(0).node()).isEqualTo(1);
    }

    @Test
    void forwardReferenceResolves() throws Exception {
        DependencyLevels levels = DependencyLevels.resolve(FilterGraph.of(
                offset("a").in("later").build(),
                FilterPrimitiveSpec.builder("flood", PrimitiveKind.FLOOD)
                        .result("later").build()));

        assertThat(levels.node(0).inputs().get(0).node()).isEqualTo(1);
        assertThat(ids(levels)).containsExactly(List.of("flood"), List.of("a"));
    }

    @Test
    void unresolvedReference() {
        FilterGraph graph = FilterGraph.of(offset("a").in("missing").build());

        assertThatThrownBy(() -> DependencyLevels.resolve(graph))
                .isExactlyInstanceOf(FilterGraphException.class)
                .hasMessage("a: Unresolved input reference: missing")
                .extracting(e -> ((FilterGraphException) e).primitiveId())
                .isEqualTo("a");
    }

    @Test
    void selfReferenceIsCycle() {
        FilterGraph graph = FilterGraph.of(offset("a").in("me").result("me").build());

        assertThatThrownBy(() -> DependencyLevels.resolve(graph))
                .isInstanceOf(CyclicFilterGraphException.class)
                .extracting(e -> ((CyclicFilterGraphException) e).cycle())
                .isEqualTo(List.of("a", "a"));
    }

    @Test
    void mutualReferenceIsCycle() {
        FilterGraph graph = FilterGraph.of(
                offset("a").in("y").result("x").build(),
                offset("b").in("x").result("y").build());

        assertThatThrownBy(() -> DependencyLevels.resolve(graph))
                .isInstanceOf(CyclicFilterGraphException.class)
                .hasMessageContaining("Dependency cycle")
                .extracting(e -> ((CyclicFilterGraphException) e).cycle())
                .asList()
                .hasSize(3)
                .containsOnly("a", "b");
    }

    @Test
    void emptyGraphRejected() {
        FilterGraph graph = FilterGraph.builder("empty").build();

        assertThatThrownBy(() -> DependencyLevels.resolve(graph))
                .isInstanceOf(FilterGraphException.class)
                .hasMessageContaining("No filter primitives");
    }

}
