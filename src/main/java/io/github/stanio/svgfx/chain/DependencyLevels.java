/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import io.github.stanio.svgfx.graph.CyclicFilterGraphException;
import io.github.stanio.svgfx.graph.FilterGraph;
import io.github.stanio.svgfx.graph.FilterGraphException;
import io.github.stanio.svgfx.graph.FilterPrimitiveSpec;
import io.github.stanio.svgfx.graph.InputRef;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;

/**
 * A resolved {@code FilterGraph}: every input bound to either a well-known
 * source or another primitive, and the primitives grouped into dependency
 * levels.  Level 0 holds the primitives consuming only well-known sources;
 * any other primitive is on the level one above its deepest predecessor.
 * <p>
 * Input resolution:</p>
 * <ul>
 * <li>a missing {@code in} refers to the previous primitive, or to {@code
 * SourceGraphic} for the first one;</li>
 * <li>a missing {@code in2} refers to {@code SourceGraphic};</li>
 * <li>a result name refers to the nearest preceding primitive producing it,
 * otherwise the first one at or after the referencing primitive.</li>
 * </ul>
 */
public final class DependencyLevels {

    static final Logger log = Logger.getLogger(DependencyLevels.class.getName());


    /**
     * A resolved input: a well-known source, or the output of another node.
     */
    public static final class Edge {

        private final InputRef.Source source;
        private final int node;

        private Edge(InputRef.Source source, int node) {
            this.source = source;
            this.node = node;
        }

        static Edge source(InputRef.Source source) {
            return new Edge(Objects.requireNonNull(source), -1);
        }

        static Edge node(int index) {
            return new Edge(null, index);
        }

        public boolean isSource() {
            return source != null;
        }

        /**
         * {@return the well-known source, or {@code null} for node edges}
         */
        public InputRef.Source source() {
            return source;
        }

        /**
         * {@return the producing node index, or {@code -1} for source edges}
         */
        public int node() {
            return node;
        }

        @Override
        public String toString() {
            return isSource() ? source.keyword() : "#" + node;
        }

    } // class Edge


    public static final class Node {

        private final int index;
        private final FilterPrimitiveSpec spec;
        private final List<Edge> inputs;
        int level = -1;

        Node(int index, FilterPrimitiveSpec spec, List<Edge> inputs) {
            this.index = index;
            this.spec = spec;
            this.inputs = Collections.unmodifiableList(inputs);
        }

        /**
         * {@return the position of the primitive in the graph}
         */
        public int index() {
            return index;
        }

        public String id() {
            return spec.id();
        }

        public PrimitiveKind kind() {
            return spec.kind();
        }

        public Parameters params() {
            return spec.params();
        }

        public FilterPrimitiveSpec spec() {
            return spec;
        }

        public List<Edge> inputs() {
            return inputs;
        }

        public int level() {
            return level;
        }

        @Override
        public String toString() {
            return id() + inputs + "@" + level;
        }

    } // class Node


    private final FilterGraph graph;
    private final List<Node> nodes;
    private final List<List<Node>> levels;

    private DependencyLevels(FilterGraph graph, List<Node> nodes, List<List<Node>> levels) {
        this.graph = graph;
        this.nodes = Collections.unmodifiableList(nodes);
        this.levels = Collections.unmodifiableList(levels);
    }

    /**
     * Resolves the given graph.
     *
     * @param   graph  the graph to resolve
     * @return  the resolved graph
     * @throws  FilterGraphException  if the graph is empty, or an input
     *          refers to a result no primitive produces
     * @throws  CyclicFilterGraphException  if input references form a cycle
     */
    public static DependencyLevels resolve(FilterGraph graph) throws FilterGraphException {
        if (graph.isEmpty())
            throw new FilterGraphException(graph.id(), "No filter primitives");

        List<FilterPrimitiveSpec> specs = graph.primitives();
        List<Node> nodes = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            FilterPrimitiveSpec spec = specs.get(i);
            nodes.add(new Node(i, spec, resolveInputs(specs, i)));
        }

        assignLevels(nodes);

        int depth = 0;
        for (Node n : nodes) {
            depth = Math.max(depth, n.level + 1);
        }
        List<List<Node>> levels = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            levels.add(new ArrayList<>());
        }
        for (Node n : nodes) {
            levels.get(n.level).add(n);
        }
        for (int i = 0; i < depth; i++) {
            levels.set(i, Collections.unmodifiableList(levels.get(i)));
        }

        DependencyLevels resolved = new DependencyLevels(graph, nodes, levels);
        log.fine(() -> graph.id() + ": " + nodes.size() + " primitives in "
                + levels.size() + " levels");
        return resolved;
    }

    private static List<Edge> resolveInputs(List<FilterPrimitiveSpec> specs, int index)
            throws FilterGraphException {
        FilterPrimitiveSpec spec = specs.get(index);
        int arity = spec.kind().arity();
        int count = (arity < 0) ? Math.max(spec.inputs().size(), 1)
                                : arity;
        List<Edge> edges = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            InputRef ref = (i < spec.inputs().size()) ? spec.inputs().get(i) : null;
            if (ref == null) {
                if (i == 0 && index > 0) {
                    edges.add(Edge.node(index - 1));
                } else {
                    edges.add(Edge.source(InputRef.Source.SOURCE_GRAPHIC));
                }
            } else if (ref.isWellKnown()) {
                edges.add(Edge.source(ref.source()));
            } else {
                edges.add(Edge.node(producer(specs, index, ref.resultName())));
            }
        }
        return edges;
    }

    private static int producer(List<FilterPrimitiveSpec> specs, int index, String name)
            throws FilterGraphException {
        for (int j = index - 1; j >= 0; j--) {
            if (name.equals(specs.get(j).result()))
                return j;
        }
        for (int j = index; j < specs.size(); j++) {
            if (name.equals(specs.get(j).result()))
                return j;
        }
        throw new FilterGraphException(specs.get(index).id(),
                "Unresolved input reference: " + name);
    }

    private static final int UNVISITED = 0, VISITING = 1, DONE = 2;

    /*
     * Iterative depth-first traversal; a back edge to a node still being
     * visited closes a cycle.
     */
    private static void assignLevels(List<Node> nodes) throws CyclicFilterGraphException {
        int[] state = new int[nodes.size()];
        Deque<Node> path = new ArrayDeque<>();
        Deque<Integer> nextInput = new ArrayDeque<>();

        for (Node root : nodes) {
            if (state[root.index] != UNVISITED)
                continue;

            path.push(root);
            nextInput.push(0);
            state[root.index] = VISITING;
            while (!path.isEmpty()) {
                Node current = path.peek();
                int k = nextInput.pop();
                if (k < current.inputs.size()) {
                    nextInput.push(k + 1);
                    Edge edge = current.inputs.get(k);
                    if (edge.isSource())
                        continue;

                    Node pred = nodes.get(edge.node);
                    if (state[pred.index] == VISITING) {
                        throw new CyclicFilterGraphException(cycle(path, pred));
                    }
                    if (state[pred.index] == UNVISITED) {
                        state[pred.index] = VISITING;
                        path.push(pred);
                        nextInput.push(0);
                    }
                } else {
                    int level = 0;
                    for (Edge edge : current.inputs) {
                        if (!edge.isSource()) {
                            level = Math.max(level, nodes.get(edge.node).level + 1);
                        }
                    }
                    current.level = level;
                    state[current.index] = DONE;
                    path.pop();
                }
            }
        }
    }

    private static List<String> cycle(Deque<Node> path, Node start) {
        // path is a stack: the most recent node first
        List<String> ids = new ArrayList<>();
        for (Node n : path) {
            ids.add(n.id());
            if (n == start)
                break;
        }
        Collections.reverse(ids);
        ids.add(start.id());
        return ids;
    }

    public FilterGraph graph() {
        return graph;
    }

    /**
     * {@return all nodes, in graph order}
     */
    public List<Node> nodes() {
        return nodes;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    /**
     * {@return the nodes grouped by level, each level in graph order}
     */
    public List<List<Node>> levels() {
        return levels;
    }

    public int depth() {
        return levels.size();
    }

    /**
     * {@return the node producing the filter result: the last primitive}
     */
    public Node outputNode() {
        return nodes.get(nodes.size() - 1);
    }

    @Override
    public String toString() {
        return "DependencyLevels(" + graph.id() + ", " + levels + ")";
    }

}
