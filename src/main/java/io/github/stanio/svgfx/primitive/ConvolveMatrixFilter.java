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
 * {@code feConvolveMatrix}.  3x3 Sobel (either direction and sign) and
 * Laplacian (4- and 8-neighbour) kernels are recognized, at any scale, so
 * also after normalization by {@code divisor}.  Those get approximated by
 * an edge outline.  Other kernels have no vector equivalent.
 */
public class ConvolveMatrixFilter extends AbstractFilter {

    enum Kernel {
        IDENTITY(null, 0, 0, 0, 0, 1, 0, 0, 0, 0),
        SOBEL_HORIZONTAL("dash", -1, 0, 1, -2, 0, 2, -1, 0, 1),
        SOBEL_VERTICAL("dash", -1, -2, -1, 0, 0, 0, 1, 2, 1),
        LAPLACIAN("dashDot", 0, -1, 0, -1, 4, -1, 0, -1, 0),
        LAPLACIAN_DIAGONAL("dashDot", -1, -1, -1, -1, 8, -1, -1, -1, -1),
        OTHER(null);

        final String dash;
        final double[] values;

        private Kernel(String dash, double... values) {
            this.dash = dash;
            this.values = values;
        }

        boolean isEdgeDetection() {
            return dash != null;
        }
    }

    /** 1 pt */
    static final long OUTLINE_WIDTH_EMU = 12700;

    private static final double TOLERANCE = 1e-6;

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> classify(params) != Kernel.OTHER, 1.0);

    public ConvolveMatrixFilter() {
        super(PrimitiveKind.CONVOLVE_MATRIX);
    }

    static Kernel classify(Parameters params) {
        double[] order = params.numberPair("order", 3);
        double[] matrix = params.numbers("kernelMatrix");
        if (order[0] != 3 || order[1] != 3 || matrix.length != 9)
            return Kernel.OTHER;

        double divisor = divisor(params, matrix);
        double[] normalized = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            normalized[i] = matrix[i] / divisor;
        }

        if (scaleOf(normalized, Kernel.IDENTITY.values) == 1)
            return Kernel.IDENTITY;

        for (Kernel kernel : Kernel.values()) {
            if (kernel.isEdgeDetection()
                    && !Double.isNaN(scaleOf(normalized, kernel.values)))
                return kernel;
        }
        return Kernel.OTHER;
    }

    static double divisor(Parameters params, double[] matrix) {
        double divisor = params.number("divisor", 0);
        if (divisor == 0) {
            for (double value : matrix) {
                divisor += value;
            }
        }
        return (divisor == 0) ? 1 : divisor;
    }

    /**
     * {@return {@code s} such that {@code matrix == s * pattern}, or NaN if
     * there's no such non-zero {@code s}}
     */
    private static double scaleOf(double[] matrix, double[] pattern) {
        double scale = Double.NaN;
        for (int i = 0; i < pattern.length; i++) {
            if (pattern[i] != 0) {
                scale = matrix[i] / pattern[i];
                break;
            }
        }
        if (Double.isNaN(scale) || Math.abs(scale) <= TOLERANCE)
            return Double.NaN;

        for (int i = 0; i < pattern.length; i++) {
            if (Math.abs(matrix[i] - scale * pattern[i]) > TOLERANCE)
                return Double.NaN;
        }
        return (Math.abs(scale - 1) <= TOLERANCE) ? 1 : scale;
    }

    /**
     * Weighs the share of non-zero elements, the value variation, and the
     * kernel size.
     */
    @Override
    public double complexityScore(Parameters params) {
        double[] matrix = params.numbers("kernelMatrix");
        if (matrix.length == 0)
            return 1.0;

        int nonZero = 0;
        double sum = 0;
        for (double value : matrix) {
            if (Math.abs(value) > TOLERANCE) {
                nonZero++;
                sum += value;
            }
        }
        double variation = 0;
        if (nonZero > 0) {
            double mean = sum / nonZero;
            for (double value : matrix) {
                if (Math.abs(value) > TOLERANCE) {
                    variation += Math.abs(value - mean);
                }
            }
            variation /= nonZero;
        }
        double[] order = params.numberPair("order", 3);
        double orderComplexity = Math.min(Math.max(order[0], order[1]) / 5, 1);

        return Math.min(0.3 * nonZero / matrix.length
                        + 0.4 * Math.min(variation / 10, 1)
                        + 0.3 * orderComplexity, 1);
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
        double[] order = params.numberPair("order", 3);
        double[] matrix = params.numbers("kernelMatrix");
        if (order[0] < 1 || order[1] < 1 || order[0] != Math.rint(order[0])
                || order[1] != Math.rint(order[1]))
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Invalid order: " + order[0] + " " + order[1]);
        if (matrix.length != (int) (order[0] * order[1]))
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Kernel matrix needs " + (int) (order[0] * order[1])
                    + " values, got " + matrix.length);

        PrimitiveOutput source = input(inputs, 0, context);
        Kernel kernel = classify(params);
        if (kernel == Kernel.IDENTITY)
            return source.withFragment("");

        List<DrawingCommand> outline = outline(source.commands(), context);
        List<DrawingCommand> commands = kernel.isEdgeDetection()
                                        ? outline
                                        : concat(source.commands(), outline);

        String fragment = "";
        if (kernel.isEdgeDetection()
                && context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
            fragment = edgeLine(kernel.dash);
        }
        return PrimitiveOutput.of(fragment, commands, source.bounds());
    }

    static String edgeLine(String dash) {
        return "<a:ln w=\"" + OUTLINE_WIDTH_EMU + "\" cap=\"rnd\" cmpd=\"sng\" algn=\"ctr\">"
                + "<a:solidFill><a:schemeClr val=\"tx1\"><a:alpha val=\"75000\"/>"
                + "</a:schemeClr></a:solidFill>"
                + "<a:prstDash val=\"" + dash + "\"/><a:round/></a:ln>";
    }

    /**
     * Traces the outlines of the given shapes with 1-unit black lines.
     */
    static List<DrawingCommand> outline(List<DrawingCommand> commands, FilterContext context)
            throws FilterPrimitiveException {
        List<DrawingCommand> lines = new ArrayList<>(commands.size());
        for (DrawingCommand cmd : commands) {
            context.checkpoint();
            double[] xy;
            if (cmd instanceof Polygon) {
                double[] points = ((Polygon) cmd).coordinates();
                xy = new double[points.length + 2];
                System.arraycopy(points, 0, xy, 0, points.length);
                if (points.length >= 2) {
                    xy[points.length] = points[0];
                    xy[points.length + 1] = points[1];
                }
            } else if (cmd instanceof FillRect) {
                Rectangle2D box = cmd.bounds();
                xy = new double[] {
                    box.getMinX(), box.getMinY(), box.getMaxX(), box.getMinY(),
                    box.getMaxX(), box.getMaxY(), box.getMinX(), box.getMaxY(),
                    box.getMinX(), box.getMinY()
                };
            } else if (cmd instanceof Polyline) {
                xy = ((Polyline) cmd).coordinates();
            } else {
                continue;
            }
            if (xy.length >= 4) {
                lines.add(DrawingCommand.polyline(xy, 0x000000, 1));
            }
        }
        return lines;
    }

}
