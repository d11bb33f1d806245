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
import io.github.stanio.svgfx.emf.FillPattern;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feDiffuseLighting} and {@code feSpecularLighting} approximated as
 * a bevel lit by a light rig.  The light source is given by the {@code
 * light} parameter ({@code distant}, {@code point}, or {@code spot}) with
 * the attributes of the corresponding light source element ({@code
 * azimuth}, {@code elevation}, {@code x}, {@code y}, {@code z}).  Metafile
 * output shades the lit area with a crosshatch pattern.
 */
public abstract class LightingFilter extends AbstractFilter {

    /** Rig directions for azimuths 0, 45, ... 315 (y axis pointing down). */
    private static final String[] DIRECTIONS = { "r", "br", "b", "bl", "l", "tl", "t", "tr" };

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> !lightType(params).equals("spot"), 0.7);

    LightingFilter(PrimitiveKind kind) {
        super(kind);
    }

    static String lightType(Parameters params) {
        return params.string("light", "distant");
    }

    @Override
    public double complexityScore(Parameters params) {
        switch (lightType(params)) {
        case "distant":
            return 0.3;
        case "point":
            return 0.6;
        default:
            return 0.8;
        }
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
        int lightColor;
        try {
            lightColor = Colors.parse(params.string("lighting-color", "white"));
        } catch (IllegalArgumentException e) {
            throw new FilterPrimitiveException(context.primitiveId(), e.getMessage(), e);
        }
        String light = lightType(params);
        if (!light.equals("distant") && !light.equals("point") && !light.equals("spot"))
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Unsupported light source: " + light);

        Rectangle2D bounds = source.bounds();
        context.checkpoint();
        List<DrawingCommand> shaded = concat(source.commands(),
                List.of(DrawingCommand.fillRect(bounds,
                        Brush.pattern(FillPattern.CROSSHATCH, lightColor, 0x000000))));

        String fragment = "";
        if (context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
            double surfaceScale = Math.abs(params.number("surfaceScale", 1));
            fragment = "<a:scene3d><a:camera prst=\"orthographicFront\"/>"
                    + "<a:lightRig rig=\"" + rig(params) + "\" dir=\""
                    + direction(params, bounds) + "\"/></a:scene3d>"
                    + "<a:sp3d><a:bevelT w=\"" + context.toEmu(2 * surfaceScale)
                    + "\" h=\"" + context.toEmu(surfaceScale) + "\"/></a:sp3d>"
                    + highlight(params, lightColor, context);
        }
        return PrimitiveOutput.of(fragment, shaded, bounds);
    }

    abstract String rig(Parameters params);

    abstract String highlight(Parameters params, int lightColor, FilterContext context);

    static String direction(Parameters params, Rectangle2D bounds) {
        double azimuth;
        if (lightType(params).equals("distant")) {
            azimuth = params.number("azimuth", 0);
        } else {
            double x = params.number("x", bounds.getCenterX());
            double y = params.number("y", bounds.getCenterY());
            azimuth = Math.toDegrees(Math.atan2(y - bounds.getCenterY(),
                                                x - bounds.getCenterX()));
        }
        int index = (int) Math.floorMod(Math.round(azimuth / 45), (long) DIRECTIONS.length);
        return DIRECTIONS[index];
    }

}
