/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.graph.PrimitiveKind;

/**
 * Base of the built-in primitives.
 */
abstract class AbstractFilter implements Filter {

    private final PrimitiveKind kind;

    AbstractFilter(PrimitiveKind kind) {
        this.kind = Objects.requireNonNull(kind);
    }

    @Override
    public final PrimitiveKind kind() {
        return kind;
    }

    static PrimitiveOutput input(List<PrimitiveOutput> inputs, int index, FilterContext context)
            throws FilterPrimitiveException {
        if (index >= inputs.size())
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Missing input #" + (index + 1));

        return inputs.get(index);
    }

    static List<DrawingCommand> concat(List<DrawingCommand> first, List<DrawingCommand> second) {
        List<DrawingCommand> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + kind.elementName() + ")";
    }

}
