/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.List;
import java.util.Optional;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feGaussianBlur} as {@code <a:blur rad="..."/>}.  The radius is the
 * mean standard deviation in EMU, clamped to 2540000 (100 px).  Anisotropic
 * blurs are approximated using the larger deviation.
 */
public class GaussianBlurFilter extends AbstractFilter {

    static final long MAX_RADIUS_EMU = 2540000;

    static final double MAX_ANISOTROPY = 4;

    private static final VectorApproximation approximation =
            VectorApproximation.of(GaussianBlurFilter::approximable, 1.0);

    public GaussianBlurFilter() {
        super(PrimitiveKind.GAUSSIAN_BLUR);
    }

    private static boolean approximable(Parameters params) {
        if ("wrap".equals(params.string("edgeMode", "none")))
            return false;

        double[] stdDev = params.numberPair("stdDeviation", 0);
        double min = Math.min(stdDev[0], stdDev[1]);
        double max = Math.max(stdDev[0], stdDev[1]);
        if (min < 0)
            return false;

        return max == 0 || (min > 0 && max / min <= MAX_ANISOTROPY);
    }

    @Override
    public double complexityScore(Parameters params) {
        double[] stdDev = params.numberPair("stdDeviation", 0);
        double score = Math.min((stdDev[0] + stdDev[1]) / 2 / 500, 0.5);
        if (stdDev[0] != stdDev[1]) {
            score += 0.5;
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
        double[] stdDev = params.numberPair("stdDeviation", 0);
        if (stdDev[0] < 0 || stdDev[1] < 0)
            throw new FilterPrimitiveException(context.primitiveId(),
                    "Negative stdDeviation: " + stdDev[0] + " " + stdDev[1]);

        PrimitiveOutput source = input(inputs, 0, context);
        context.checkpoint();

        // Visible extent of a Gaussian kernel ~ 3 sigma
        Rectangle2D bounds = source.bounds();
        double growX = 3 * stdDev[0];
        double growY = 3 * stdDev[1];
        bounds.setRect(bounds.getX() - growX, bounds.getY() - growY,
                       bounds.getWidth() + 2 * growX, bounds.getHeight() + 2 * growY);

        String fragment;
        switch (context.strategy()) {
        case NATIVE_EFFECT:
            fragment = blur((stdDev[0] + stdDev[1]) / 2, context);
            break;
        case VECTOR_APPROX:
            fragment = blur(Math.max(stdDev[0], stdDev[1]), context);
            break;
        default:
            fragment = "";
        }
        return PrimitiveOutput.of(fragment, source.commands(), bounds);
    }

    static String blur(double stdDeviation, FilterContext context) {
        if (stdDeviation == 0)
            return "";

        long radius = Math.max(0, Math.min(context.toEmu(stdDeviation), MAX_RADIUS_EMU));
        return "<a:blur rad=\"" + radius + "\"/>";
    }

}
