/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;

/**
 * {@code feComposite}: Porter-Duff compositing of {@code in} over {@code
 * in2}.  Only {@code over} has a DrawingML blend equivalent; the other
 * operators need per-pixel arithmetic, which marks their output as raster
 * preferred.
 */
public class CompositeFilter extends AbstractFilter {

    /** Composite operator to DrawingML blend mode */
    static final Map<String, String> BLEND_MODES = Map.of("over", "over");

    public CompositeFilter() {
        super(PrimitiveKind.COMPOSITE);
    }

    private static String operator(Parameters params) {
        return params.string("operator", "over").toLowerCase(Locale.ROOT);
    }

    @Override
    public double complexityScore(Parameters params) {
        switch (operator(params)) {
        case "over":
            return 0.1;
        case "in":
        case "out":
        case "atop":
        case "xor":
            return 0.8;
        case "arithmetic":
            return 0.95;
        default:
            return 1.0;
        }
    }

    @Override
    public PrimitiveOutput apply(Parameters params,
                                 List<PrimitiveOutput> inputs,
                                 FilterContext context)
            throws FilterPrimitiveException {
        PrimitiveOutput in = input(inputs, 0, context);
        PrimitiveOutput in2 = input(inputs, 1, context);
        String operator = operator(params);
        context.checkpoint();

        List<DrawingCommand> commands;
        Rectangle2D bounds;
        switch (operator) {
        case "over":
        case "xor":
            commands = concat(in2.commands(), in.commands());
            bounds = in2.bounds();
            bounds.add(in.bounds());
            break;
        case "in":
            commands = in.commands();
            bounds = in.bounds().createIntersection(in2.bounds());
            if (bounds.isEmpty()) {
                bounds = new Rectangle2D.Double();
            }
            break;
        case "out":
            commands = in.commands();
            bounds = in.bounds();
            break;
        case "atop":
            commands = concat(in2.commands(), in.commands());
            bounds = in2.bounds();
            break;
        case "arithmetic":
            return arithmetic(params, in, in2);
        default:
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Unsupported composite operator: " + operator);
        }

        String blendMode = BLEND_MODES.get(operator);
        if (blendMode != null) {
            String fragment = (context.strategy() == RenderStrategy.NATIVE_EFFECT)
                              ? BlendFilter.blend(blendMode)
                              : "";
            return PrimitiveOutput.of(fragment, commands, bounds);
        }
        return PrimitiveOutput.of("", commands, bounds).withRasterPreferred();
    }

    /*
     * result = k1*i1*i2 + k2*i1 + k3*i2 + k4: the geometry covers the
     * inputs with a non-zero contribution.
     */
    private static PrimitiveOutput arithmetic(Parameters params,
                                              PrimitiveOutput in,
                                              PrimitiveOutput in2) {
        double k1 = params.number("k1", 0);
        double k2 = params.number("k2", 0);
        double k3 = params.number("k3", 0);
        boolean useIn = k1 != 0 || k2 != 0;
        boolean useIn2 = k1 != 0 || k3 != 0;

        List<DrawingCommand> commands = List.of();
        Rectangle2D bounds = null;
        if (useIn2) {
            commands = in2.commands();
            bounds = in2.bounds();
        }
        if (useIn) {
            commands = concat(commands, in.commands());
            if (bounds == null) {
                bounds = in.bounds();
            } else {
                bounds.add(in.bounds());
            }
        }
        if (bounds == null) {
            bounds = in.bounds();
            bounds.add(in2.bounds());
        }
        return PrimitiveOutput.of("", commands, bounds).withRasterPreferred();
    }

}
