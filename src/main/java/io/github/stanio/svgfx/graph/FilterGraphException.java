/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import io.github.stanio.svgfx.FilterException;

/**
 * Signals a structurally invalid filter graph, like an input reference
 * that doesn't resolve to any result or well-known source.  Fatal for the
 * whole chain, raised before any primitive executes.
 */
public class FilterGraphException extends FilterException {

    private static final long serialVersionUID = 4101871279350233717L;

    private final String primitiveId;

    public FilterGraphException(String primitiveId, String message) {
        super(primitiveId + ": " + message);
        this.primitiveId = primitiveId;
    }

    /**
     * {@return the id of the offending primitive}
     */
    public String primitiveId() {
        return primitiveId;
    }

}
