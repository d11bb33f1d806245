/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.Brush;
import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.emf.DrawingCommand.Polygon;
import io.github.stanio.svgfx.emf.DrawingCommand.Polyline;
import io.github.stanio.svgfx.emf.FillPattern;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feDisplacementMap}.  Small displacements are approximated by
 * jittering the outline of {@code in} by half the scale, along the axes
 * with a channel selector.  Metafile output overlays a hexagonal pattern.
 */
public class DisplacementMapFilter extends AbstractFilter {

    static final double MAX_APPROXIMATED_SCALE = 10;

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> Math.abs(params.number("scale", 0))
                                             <= MAX_APPROXIMATED_SCALE, 0.6);

    public DisplacementMapFilter() {
        super(PrimitiveKind.DISPLACEMENT_MAP);
    }

    @Override
    public double complexityScore(Parameters params) {
        return 0.3 + Math.min(Math.abs(params.number("scale", 0)) / 50, 0.6);
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
        PrimitiveOutput source = input(inputs, 0, context);
        input(inputs, 1, context);
        double scale = params.number("scale", 0);
        if (scale == 0)
            return source.withFragment("");

        double jitterX = isChannel(params.string("xChannelSelector", "A")) ? scale / 2 : 0;
        double jitterY = isChannel(params.string("yChannelSelector", "A")) ? scale / 2 : 0;

        Rectangle2D bounds = source.bounds();
        double grow = Math.abs(scale) / 2;
        bounds.setRect(bounds.getX() - grow, bounds.getY() - grow,
                       bounds.getWidth() + 2 * grow, bounds.getHeight() + 2 * grow);

        if (context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
            List<DrawingCommand> jittered = new ArrayList<>(source.commands().size());
            for (DrawingCommand cmd : source.commands()) {
                context.checkpoint();
                jittered.add(jitter(cmd, jitterX, jitterY));
            }
            return PrimitiveOutput.of(DrawingML.customGeometry(jittered, bounds, context),
                                      jittered, bounds);
        }

        context.checkpoint();
        int color = source.commands().isEmpty() ? 0x000000
                                                : source.commands().get(0).color();
        List<DrawingCommand> patterned = concat(source.commands(),
                List.of(DrawingCommand.fillRect(bounds,
                        Brush.pattern(FillPattern.HEXAGONAL, color, 0xFFFFFF))));
        return PrimitiveOutput.of("", patterned, bounds);
    }

    private static boolean isChannel(String selector) {
        switch (selector) {
        case "R":
        case "G":
        case "B":
        case "A":
            return true;
        default:
            return false;
        }
    }

    /**
     * Displaces alternate vertices in opposite directions.
     */
    static DrawingCommand jitter(DrawingCommand cmd, double dx, double dy) {
        double[] xy;
        if (cmd instanceof Polygon) {
            xy = ((Polygon) cmd).coordinates();
        } else if (cmd instanceof Polyline) {
            xy = ((Polyline) cmd).coordinates();
        } else {
            return cmd;
        }

        for (int i = 0; i < xy.length; i += 2) {
            double sign = (i / 2 % 2 == 0) ? 1 : -1;
            xy[i] += sign * dx;
            xy[i + 1] += sign * dy;
        }

        if (cmd instanceof Polyline) {
            Polyline line = (Polyline) cmd;
            return DrawingCommand.polyline(xy, line.color(), line.width());
        }
        Polygon polygon = (Polygon) cmd;
        Polygon result = DrawingCommand.polygon(xy, polygon.fill());
        return polygon.isNonZero() ? result.withNonZeroFill() : result;
    }

}
