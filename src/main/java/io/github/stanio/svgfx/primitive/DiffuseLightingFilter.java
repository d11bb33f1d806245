/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;

public class DiffuseLightingFilter extends LightingFilter {

    public DiffuseLightingFilter() {
        super(PrimitiveKind.DIFFUSE_LIGHTING);
    }

    @Override
    String rig(Parameters params) {
        return params.number("diffuseConstant", 1) > 1 ? "bright" : "threePt";
    }

    @Override
    String highlight(Parameters params, int lightColor, FilterContext context) {
        return "";
    }

}
