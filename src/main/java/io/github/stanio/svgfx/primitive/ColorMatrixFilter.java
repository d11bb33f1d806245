/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feColorMatrix}.  {@code saturate} and {@code hueRotate} map to
 * {@code <a:satMod>} and {@code <a:hueOff>}; identity and grayscale
 * matrices are recognized.  {@code luminanceToAlpha} is approximated.
 * Other matrices have no DrawingML equivalent.
 * <p>
 * The result geometry gets recolored through the matrix.</p>
 */
public class ColorMatrixFilter extends AbstractFilter {

    enum Form {
        IDENTITY(0),
        SATURATE(0.1),
        HUE_ROTATE(0.1),
        GRAYSCALE(0.2),
        LUMINANCE_TO_ALPHA(0.6),
        GENERAL(0.9);

        final double complexity;

        private Form(double complexity) {
            this.complexity = complexity;
        }
    }

    private static final double[] IDENTITY = {
        1, 0, 0, 0, 0,
        0, 1, 0, 0, 0,
        0, 0, 1, 0, 0,
        0, 0, 0, 1, 0
    };

    private static final double TOLERANCE = 1e-6;

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> classify(params) != Form.GENERAL, 0.7);

    public ColorMatrixFilter() {
        super(PrimitiveKind.COLOR_MATRIX);
    }

    static Form classify(Parameters params) {
        switch (params.string("type", "matrix")) {
        case "saturate":
            return (params.number("values", 1) == 1) ? Form.IDENTITY
                                                     : Form.SATURATE;
        case "hueRotate":
            return (params.number("values", 0) % 360 == 0) ? Form.IDENTITY
                                                           : Form.HUE_ROTATE;
        case "luminanceToAlpha":
            return Form.LUMINANCE_TO_ALPHA;
        case "matrix":
            double[] values = params.numbers("values");
            if (values.length == 0 || matches(values, IDENTITY))
                return Form.IDENTITY;
            if (isGrayscale(values))
                return Form.GRAYSCALE;
            return Form.GENERAL;
        default:
            return Form.GENERAL;
        }
    }

    private static boolean matches(double[] values, double[] expected) {
        if (values.length != expected.length)
            return false;

        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i] - expected[i]) > TOLERANCE)
                return false;
        }
        return true;
    }

    /*
     * Equal R, G, B rows with weights summing to 1, no offsets, alpha
     * row unchanged.
     */
    private static boolean isGrayscale(double[] m) {
        if (m.length != 20)
            return false;

        for (int row = 1; row < 3; row++) {
            for (int col = 0; col < 5; col++) {
                if (Math.abs(m[row * 5 + col] - m[col]) > TOLERANCE)
                    return false;
            }
        }
        return Math.abs(m[0] + m[1] + m[2] - 1) <= TOLERANCE
                && Math.abs(m[3]) <= TOLERANCE
                && Math.abs(m[4]) <= TOLERANCE
                && matches(Arrays.copyOfRange(m, 15, 20),
                           Arrays.copyOfRange(IDENTITY, 15, 20));
    }

    @Override
    public double complexityScore(Parameters params) {
        return classify(params).complexity;
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
        Form form = classify(params);
        double[] matrix = matrix(params, form, context);

        List<DrawingCommand> recolored = new ArrayList<>(source.commands().size());
        for (DrawingCommand cmd : source.commands()) {
            recolored.add(form == Form.IDENTITY ? cmd
                                                : cmd.recolor(transform(cmd.color(), matrix)));
        }
        context.checkpoint();

        String fragment = "";
        if (context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
            fragment = fragment(params, form);
        }
        return PrimitiveOutput.of(fragment, recolored, source.bounds());
    }

    private static String fragment(Parameters params, Form form) {
        switch (form) {
        case SATURATE:
            return "<a:satMod val=\"" + DrawingML.percent(params.number("values", 1)) + "\"/>";
        case HUE_ROTATE:
            return "<a:hueOff val=\"" + DrawingML.angle(params.number("values", 0)) + "\"/>";
        case GRAYSCALE:
            return "<a:grayscl/>";
        case LUMINANCE_TO_ALPHA:
            return "<a:grayscl/><a:alphaModFix amt=\"50000\"/>";
        default:
            return "";
        }
    }

    static double[] matrix(Parameters params, Form form, FilterContext context)
            throws FilterPrimitiveException {
        switch (params.string("type", "matrix")) {
        case "saturate":
            return saturate(params.number("values", 1));
        case "hueRotate":
            return hueRotate(params.number("values", 0));
        case "luminanceToAlpha":
            return new double[] {
                0, 0, 0, 0, 0,
                0, 0, 0, 0, 0,
                0, 0, 0, 0, 0,
                0.2125, 0.7154, 0.0721, 0, 0
            };
        case "matrix":
            if (form == Form.IDENTITY)
                return IDENTITY;

            double[] values = params.numbers("values");
            if (values.length != 20)
                throw new FilterPrimitiveException(context.primitiveId(),
                        "Color matrix needs 20 values, got " + values.length);
            return values;
        default:
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Unsupported color matrix type: " + params.string("type", ""));
        }
    }

    static double[] saturate(double s) {
        return new double[] {
            0.213 + 0.787 * s, 0.715 - 0.715 * s, 0.072 - 0.072 * s, 0, 0,
            0.213 - 0.213 * s, 0.715 + 0.285 * s, 0.072 - 0.072 * s, 0, 0,
            0.213 - 0.213 * s, 0.715 - 0.715 * s, 0.072 + 0.928 * s, 0, 0,
            0, 0, 0, 1, 0
        };
    }

    static double[] hueRotate(double degrees) {
        double cos = Math.cos(Math.toRadians(degrees));
        double sin = Math.sin(Math.toRadians(degrees));
        return new double[] {
            0.213 + cos * 0.787 - sin * 0.213,
            0.715 - cos * 0.715 - sin * 0.715,
            0.072 - cos * 0.072 + sin * 0.928, 0, 0,
            0.213 - cos * 0.213 + sin * 0.143,
            0.715 + cos * 0.285 + sin * 0.140,
            0.072 - cos * 0.072 - sin * 0.283, 0, 0,
            0.213 - cos * 0.213 - sin * 0.787,
            0.715 - cos * 0.715 + sin * 0.715,
            0.072 + cos * 0.928 + sin * 0.072, 0, 0,
            0, 0, 0, 1, 0
        };
    }

    /**
     * Applies the RGB rows of a 4x5 color matrix to an opaque color.
     */
    static int transform(int rgb, double[] m) {
        double r = ((rgb >> 16) & 0xFF) / 255.0;
        double g = ((rgb >> 8) & 0xFF) / 255.0;
        double b = (rgb & 0xFF) / 255.0;
        int result = 0;
        for (int row = 0; row < 3; row++) {
            int i = row * 5;
            double value = m[i] * r + m[i + 1] * g + m[i + 2] * b + m[i + 3] + m[i + 4];
            result = (result << 8) | (int) Math.round(clamp(value, 0, 1) * 255);
        }
        return result;
    }

}
