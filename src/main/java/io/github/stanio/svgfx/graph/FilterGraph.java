/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import java.awt.geom.Rectangle2D;

/**
 * An ordered collection of filter primitives connected through named
 * results, as found in a single SVG {@code <filter>} element.  The last
 * primitive produces the filter output.  Immutable.
 * <p>
 * A graph is constructed once per filtered element and conversion pass.
 * Reference validity and acyclicity are verified when a chain resolves
 * the graph, before any primitive executes.</p>
 */
public final class FilterGraph implements Iterable<FilterPrimitiveSpec> {

    private final String id;
    private final List<FilterPrimitiveSpec> primitives;

    private FilterGraph(String id, List<FilterPrimitiveSpec> primitives) {
        this.id = id;
        this.primitives = Collections.unmodifiableList(primitives);
    }

    public static Builder builder() {
        return builder("filter");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static FilterGraph of(FilterPrimitiveSpec... primitives) {
        Builder builder = builder();
        for (FilterPrimitiveSpec item : primitives) {
            builder.add(item);
        }
        return builder.build();
    }

    public String id() {
        return id;
    }

    public int size() {
        return primitives.size();
    }

    public boolean isEmpty() {
        return primitives.isEmpty();
    }

    public FilterPrimitiveSpec get(int index) {
        return primitives.get(index);
    }

    public List<FilterPrimitiveSpec> primitives() {
        return primitives;
    }

    @Override
    public Iterator<FilterPrimitiveSpec> iterator() {
        return primitives.iterator();
    }

    /**
     * {@return the textual form of the graph shape: primitive kinds, input
     * references, and result names, in document order}  Primitive ids and
     * parameter values are not part of it.
     */
    public String structuralForm() {
        StringBuilder buf = new StringBuilder();
        for (FilterPrimitiveSpec item : primitives) {
            buf.append(item.kind().elementName())
               .append(item.inputs())
               .append("->").append(item.result() == null ? "" : item.result())
               .append('\n');
        }
        return buf.toString();
    }

    /**
     * {@return the canonical parameter values of all primitives, in document
     * order}
     *
     * @see  Parameters#canonicalForm()
     */
    public String parameterForm() {
        StringBuilder buf = new StringBuilder();
        for (FilterPrimitiveSpec item : primitives) {
            buf.append(item.params().canonicalForm());
            if (item.region() != null) {
                Rectangle2D r = item.region();
                buf.append("@[").append(r.getX()).append(',').append(r.getY())
                   .append(',').append(r.getWidth()).append(',').append(r.getHeight())
                   .append(']');
            }
            buf.append('\n');
        }
        return buf.toString();
    }

    @Override
    public String toString() {
        return "FilterGraph(" + id + ", " + primitives.size() + " primitives)";
    }


    public static final class Builder {

        private final String id;
        private final List<FilterPrimitiveSpec> primitives = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();

        Builder(String id) {
            this.id = Objects.requireNonNull(id);
        }

        /**
         * Appends a primitive.
         *
         * @param   primitive  the primitive to append
         * @return  this builder
         * @throws  IllegalArgumentException  if a primitive with the same id
         *          has been added already
         */
        public Builder add(FilterPrimitiveSpec primitive) {
            if (!ids.add(primitive.id())) {
                throw new IllegalArgumentException("Duplicate primitive id: " + primitive.id());
            }
            primitives.add(primitive);
            return this;
        }

        public Builder add(FilterPrimitiveSpec.Builder primitive) {
            return add(primitive.build());
        }

        public FilterGraph build() {
            return new FilterGraph(id, new ArrayList<>(primitives));
        }

    } // class Builder


}
