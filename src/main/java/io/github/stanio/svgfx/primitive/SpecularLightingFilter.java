/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;

/**
 * Adds an outer glow-like shadow in the light color for the specular
 * highlight; sharper for higher {@code specularExponent}.
 */
public class SpecularLightingFilter extends LightingFilter {

    public SpecularLightingFilter() {
        super(PrimitiveKind.SPECULAR_LIGHTING);
    }

    @Override
    public double complexityScore(Parameters params) {
        double score = super.complexityScore(params);
        return params.number("specularExponent", 1) > 64 ? score + 0.1 : score;
    }

    @Override
    String rig(Parameters params) {
        return "harsh";
    }

    @Override
    String highlight(Parameters params, int lightColor, FilterContext context) {
        double exponent = clamp(params.number("specularExponent", 1), 1, 128);
        double strength = clamp(params.number("specularConstant", 1) / 2, 0, 1);
        long blur = context.toEmu(8 / Math.sqrt(exponent));
        return "<a:outerShdw blurRad=\"" + blur + "\" dist=\"0\" dir=\"0\" algn=\"ctr\">"
                + DrawingML.srgbColor(lightColor, strength) + "</a:outerShdw>";
    }

}
