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
 * {@code feBlend}: {@code in} blended over {@code in2}.
 */
public class BlendFilter extends AbstractFilter {

    /** SVG blend mode to DrawingML blend mode */
    static final Map<String, String> BLEND_MODES = Map.of(
            "normal", "over",
            "multiply", "mult",
            "screen", "screen",
            "darken", "darken",
            "lighten", "lighten");

    public BlendFilter() {
        super(PrimitiveKind.BLEND);
    }

    private static String mode(Parameters params) {
        return params.string("mode", "normal").toLowerCase(Locale.ROOT);
    }

    @Override
    public double complexityScore(Parameters params) {
        return BLEND_MODES.containsKey(mode(params)) ? 0.2 : 0.9;
    }

    @Override
    public PrimitiveOutput apply(Parameters params,
                                 List<PrimitiveOutput> inputs,
                                 FilterContext context)
            throws FilterPrimitiveException {
        PrimitiveOutput in = input(inputs, 0, context);
        PrimitiveOutput in2 = input(inputs, 1, context);
        context.checkpoint();

        List<DrawingCommand> commands = concat(in2.commands(), in.commands());
        Rectangle2D bounds = in2.bounds();
        bounds.add(in.bounds());

        String blendMode = BLEND_MODES.get(mode(params));
        if (blendMode == null)
            return PrimitiveOutput.of("", commands, bounds).withRasterPreferred();

        String fragment = (context.strategy() == RenderStrategy.NATIVE_EFFECT)
                          ? blend(blendMode)
                          : "";
        return PrimitiveOutput.of(fragment, commands, bounds);
    }

    static String blend(String mode) {
        return "<a:blend blend=\"" + mode + "\"><a:cont/></a:blend>";
    }

}
