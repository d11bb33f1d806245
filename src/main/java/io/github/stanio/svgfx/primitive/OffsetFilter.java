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
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feOffset}: moves the input geometry.  Natively expressed as an
 * outer shadow at the given distance and direction; otherwise as a
 * transform offset.
 */
public class OffsetFilter extends AbstractFilter {

    /** ~96 px */
    static final long MAX_SHADOW_DISTANCE_EMU = 914400;

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> true, 1.0);

    public OffsetFilter() {
        super(PrimitiveKind.OFFSET);
    }

    @Override
    public double complexityScore(Parameters params) {
        return 0.1;
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
        double dx = params.number("dx", 0);
        double dy = params.number("dy", 0);
        PrimitiveOutput source = input(inputs, 0, context);

        List<DrawingCommand> moved = new ArrayList<>(source.commands().size());
        for (DrawingCommand cmd : source.commands()) {
            moved.add(cmd.translate(dx, dy));
        }
        context.checkpoint();

        Rectangle2D bounds = source.bounds();
        bounds.setRect(bounds.getX() + dx, bounds.getY() + dy,
                       bounds.getWidth(), bounds.getHeight());

        String fragment;
        if (dx == 0 && dy == 0) {
            fragment = "";
        } else if (context.strategy() == RenderStrategy.NATIVE_EFFECT) {
            fragment = shadow(dx, dy, context);
        } else if (context.strategy() == RenderStrategy.VECTOR_APPROX) {
            fragment = "<a:xfrm><a:off x=\"" + context.toEmu(dx)
                    + "\" y=\"" + context.toEmu(dy) + "\"/></a:xfrm>";
        } else {
            fragment = "";
        }
        return PrimitiveOutput.of(fragment, moved, bounds);
    }

    static String shadow(double dx, double dy, FilterContext context) {
        long dxEmu = context.toEmu(dx);
        long dyEmu = context.toEmu(dy);
        long distance = Math.min(Math.round(Math.hypot(dxEmu, dyEmu)), MAX_SHADOW_DISTANCE_EMU);
        long direction = DrawingML.angle(Math.toDegrees(Math.atan2(dyEmu, dxEmu)));
        return "<a:outerShdw blurRad=\"0\" dist=\"" + distance + "\" dir=\"" + direction
                + "\" algn=\"ctr\">" + DrawingML.srgbColor(0x000000, 0.5) + "</a:outerShdw>";
    }

}
