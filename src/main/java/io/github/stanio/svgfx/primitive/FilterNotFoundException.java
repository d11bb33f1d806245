/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import io.github.stanio.svgfx.FilterException;
import io.github.stanio.svgfx.graph.PrimitiveKind;

/**
 * Thrown when no implementation is registered for a primitive kind.
 */
public class FilterNotFoundException extends FilterException {

    private static final long serialVersionUID = 8407123465617750932L;

    private final PrimitiveKind kind;

    public FilterNotFoundException(PrimitiveKind kind) {
        super("No filter registered for " + kind.elementName());
        this.kind = kind;
    }

    public PrimitiveKind kind() {
        return kind;
    }

}
