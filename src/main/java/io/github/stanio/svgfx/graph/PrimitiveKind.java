/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of filter primitive kinds.  Each kind is resolved to its
 * implementation through a {@code FilterRegistry}.
 *
 * @see  <a href="https://www.w3.org/TR/filter-effects-1/#FilterPrimitivesOverview"
 *              >Filter Primitives Overview</a> <i>(Filter Effects Module Level 1)</i>
 */
public enum PrimitiveKind {

    GAUSSIAN_BLUR("feGaussianBlur", 1),
    OFFSET("feOffset", 1),
    FLOOD("feFlood", 0),
    MERGE("feMerge", -1),
    COLOR_MATRIX("feColorMatrix", 1),
    COMPONENT_TRANSFER("feComponentTransfer", 1),
    COMPOSITE("feComposite", 2),
    BLEND("feBlend", 2),
    CONVOLVE_MATRIX("feConvolveMatrix", 1),
    MORPHOLOGY("feMorphology", 1),
    DIFFUSE_LIGHTING("feDiffuseLighting", 1),
    SPECULAR_LIGHTING("feSpecularLighting", 1),
    DISPLACEMENT_MAP("feDisplacementMap", 2),
    TILE("feTile", 1);

    private static final Map<String, PrimitiveKind> byElementName = new HashMap<>();
    static {
        for (PrimitiveKind kind : values()) {
            byElementName.put(kind.elementName, kind);
        }
    }

    private final String elementName;
    private final int arity;

    private PrimitiveKind(String elementName, int arity) {
        this.elementName = elementName;
        this.arity = arity;
    }

    /**
     * {@return the SVG element name of this primitive kind}
     */
    public String elementName() {
        return elementName;
    }

    /**
     * {@return the number of inputs this kind consumes, or {@code -1} for
     * a variable number of inputs}
     */
    public int arity() {
        return arity;
    }

    public static PrimitiveKind forElementName(String name) {
        PrimitiveKind kind = byElementName.get(name);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown filter primitive: " + name);
        }
        return kind;
    }

}
