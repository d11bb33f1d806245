/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.emf.DrawingCommand.FillRect;
import io.github.stanio.svgfx.emf.DrawingCommand.Polygon;
import io.github.stanio.svgfx.emf.DrawingCommand.Polyline;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feMorphology}.  {@code dilate} expands the outline outward and is
 * expressed as a line of twice the radius; {@code erode} offsets it inward,
 * expressed as a soft edge.
 */
public class MorphologyFilter extends AbstractFilter {

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> {
                double[] radius = params.numberPair("radius", 0);
                return radius[0] >= 0 && radius[1] >= 0;
            }, 1.0);

    public MorphologyFilter() {
        super(PrimitiveKind.MORPHOLOGY);
    }

    @Override
    public double complexityScore(Parameters params) {
        double[] radius = params.numberPair("radius", 0);
        double score = 0.1 + Math.min(Math.max(radius[0], radius[1]) / 100 * 0.4, 0.4);
        if (radius[0] != radius[1]) {
            score += 0.2;
        }
        return score;
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
        String operator = params.string("operator", "erode");
        double[] radius = params.numberPair("radius", 0);
        if (radius[0] < 0 || radius[1] < 0)
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Negative radius: " + radius[0] + " " + radius[1]);

        double sign;
        switch (operator) {
        case "dilate":
            sign = 1;
            break;
        case "erode":
            sign = -1;
            break;
        default:
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Unsupported morphology operator: " + operator);
        }

        PrimitiveOutput source = input(inputs, 0, context);
        if (radius[0] == 0 && radius[1] == 0)
            return source.withFragment("");

        double rx = sign * radius[0];
        double ry = sign * radius[1];
        List<DrawingCommand> offset = new ArrayList<>(source.commands().size());
        for (DrawingCommand cmd : source.commands()) {
            context.checkpoint();
            DrawingCommand moved = offset(cmd, rx, ry);
            if (moved != null) {
                offset.add(moved);
            }
        }

        Rectangle2D bounds = source.bounds();
        bounds = grow(bounds, rx, ry);

        String fragment = "";
        if (context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
            double r = Math.max(radius[0], radius[1]);
            if (sign > 0) {
                int color = source.commands().isEmpty()
                            ? 0x000000
                            : source.commands().get(0).color();
                fragment = "<a:ln w=\"" + context.toEmu(2 * r) + "\">"
                        + DrawingML.solidFill(color, 1) + "</a:ln>";
            } else {
                fragment = "<a:softEdge rad=\"" + context.toEmu(r) + "\"/>";
            }
        }
        return PrimitiveOutput.of(fragment, offset, bounds);
    }

    private static Rectangle2D grow(Rectangle2D box, double rx, double ry) {
        double width = Math.max(0, box.getWidth() + 2 * rx);
        double height = Math.max(0, box.getHeight() + 2 * ry);
        return new Rectangle2D.Double(box.getCenterX() - width / 2,
                                      box.getCenterY() - height / 2,
                                      width, height);
    }

    /**
     * Scales the shape about its center so its bounds grow (or shrink) by
     * the given amounts on each side.  Shapes eroded away yield {@code null}.
     */
    static DrawingCommand offset(DrawingCommand cmd, double rx, double ry) {
        if (cmd instanceof Polyline) {
            Polyline line = (Polyline) cmd;
            double width = line.width() + rx + ry;
            return (width <= 0) ? null
                                : DrawingCommand.polyline(line.coordinates(),
                                                          line.color(), width);
        }

        Rectangle2D box = cmd.bounds();
        Rectangle2D grown = grow(box, rx, ry);
        if (grown.isEmpty())
            return null;

        if (cmd instanceof FillRect)
            return DrawingCommand.fillRect(grown, ((FillRect) cmd).fill());

        Polygon polygon = (Polygon) cmd;
        double sx = (box.getWidth() == 0) ? 1 : grown.getWidth() / box.getWidth();
        double sy = (box.getHeight() == 0) ? 1 : grown.getHeight() / box.getHeight();
        double[] xy = polygon.coordinates();
        for (int i = 0; i < xy.length; i += 2) {
            xy[i] = box.getCenterX() + (xy[i] - box.getCenterX()) * sx;
            xy[i + 1] = box.getCenterY() + (xy[i + 1] - box.getCenterY()) * sy;
        }
        Polygon result = DrawingCommand.polygon(xy, polygon.fill());
        return polygon.isNonZero() ? result.withNonZeroFill() : result;
    }

}
