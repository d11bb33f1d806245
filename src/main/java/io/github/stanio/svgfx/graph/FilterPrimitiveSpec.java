/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import java.awt.geom.Rectangle2D;

/**
 * A single filter primitive element of a {@code FilterGraph}: its kind,
 * parameters, input references, result name, and effect region.
 * Immutable.
 */
public final class FilterPrimitiveSpec {

    private final String id;
    private final PrimitiveKind kind;
    private final Parameters params;
    private final List<InputRef> inputs;
    private final String result;
    private final Rectangle2D region;

    FilterPrimitiveSpec(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.params = builder.params.build();
        this.inputs = Collections.unmodifiableList(new ArrayList<>(builder.inputs));
        this.result = builder.result;
        this.region = (builder.region == null) ? null : copy(builder.region);
        if (kind.arity() >= 0 && inputs.size() > Math.max(kind.arity(), 1)) {
            throw new IllegalArgumentException(id + ": " + kind.elementName()
                    + " takes at most " + Math.max(kind.arity(), 1)
                    + " input(s): " + inputs);
        }
    }

    public static Builder builder(String id, PrimitiveKind kind) {
        return new Builder(id, kind);
    }

    public String id() {
        return id;
    }

    public PrimitiveKind kind() {
        return kind;
    }

    public Parameters params() {
        return params;
    }

    /**
     * {@return the explicitly specified inputs, in order}  May be fewer than
     * the kind's arity: a missing {@code in} defaults to the previous
     * primitive's result (see {@code FilterGraph}), a missing {@code in2}
     * to {@code SourceGraphic}.
     */
    public List<InputRef> inputs() {
        return inputs;
    }

    /**
     * {@return the {@code in} reference, or {@code null} if not specified}
     */
    public InputRef in() {
        return inputs.isEmpty() ? null : inputs.get(0);
    }

    /**
     * {@return the {@code in2} reference, or {@code null} if not specified}
     */
    public InputRef in2() {
        return inputs.size() < 2 ? null : inputs.get(1);
    }

    /**
     * {@return the {@code result} name, or {@code null} if not specified}
     */
    public String result() {
        return result;
    }

    /**
     * {@return a copy of the effect region, or {@code null} if unspecified}
     */
    public Rectangle2D region() {
        return (region == null) ? null : copy(region);
    }

    static Rectangle2D copy(Rectangle2D rect) {
        return new Rectangle2D.Double(rect.getX(), rect.getY(),
                                      rect.getWidth(), rect.getHeight());
    }

    @Override
    public String toString() {
        return kind.elementName() + "(id=" + id + ", in=" + inputs
                + ", result=" + result + ", " + params + ")";
    }


    public static final class Builder {

        final String id;
        final PrimitiveKind kind;
        final Parameters.Builder params = Parameters.builder();
        final List<InputRef> inputs = new ArrayList<>();
        String result;
        Rectangle2D region;

        Builder(String id, PrimitiveKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder param(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public Builder param(String name, double value) {
            params.put(name, value);
            return this;
        }

        public Builder param(String name, double... values) {
            params.put(name, values);
            return this;
        }

        public Builder params(Parameters values) {
            values.names().forEach(name -> params.put(name, values.get(name)));
            return this;
        }

        public Builder in(String ref) {
            return input(InputRef.of(ref));
        }

        public Builder in(InputRef ref) {
            return input(ref);
        }

        public Builder input(InputRef ref) {
            inputs.add(Objects.requireNonNull(ref));
            return this;
        }

        public Builder result(String name) {
            this.result = name;
            return this;
        }

        public Builder region(double x, double y, double width, double height) {
            this.region = new Rectangle2D.Double(x, y, width, height);
            return this;
        }

        public FilterPrimitiveSpec build() {
            return new FilterPrimitiveSpec(this);
        }

    } // class Builder


}
