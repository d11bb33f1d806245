/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.List;
import java.util.Optional;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.Brush;
import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feFlood}: fills the primitive subregion with {@code flood-color}
 * at {@code flood-opacity}.  Takes no input.
 */
public class FloodFilter extends AbstractFilter {

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> true, 1.0);

    public FloodFilter() {
        super(PrimitiveKind.FLOOD);
    }

    @Override
    public double complexityScore(Parameters params) {
        return 0.05;
    }

    @Override
    public Optional<VectorApproximation> vectorApproximation() {
        return Optional.of(approximation);
    }

    @Override
    public PrimitiveOutput apply(Parameters params,
                                 List<PrimitiveOutput> inputs,
                                 FilterContext context)
            throws FilterPrimitiveException {
        int color;
        try {
            color = Colors.parse(params.string("flood-color", "black"));
        } catch (IllegalArgumentException e) {
            throw new FilterPrimitiveException(context.primitiveId(), e.getMessage(), e);
        }
        double opacity = clamp(params.number("flood-opacity", 1), 0, 1);

        Rectangle2D region = context.region(List.of());
        List<DrawingCommand> fill = List.of(DrawingCommand.fillRect(region, Brush.solid(color)));
        String fragment = (context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0)
                          ? DrawingML.solidFill(color, opacity)
                          : "";
        return PrimitiveOutput.of(fragment, fill, region);
    }

}
