/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import io.github.stanio.svgfx.FilterException;

/**
 * Failure applying a single filter primitive.
 */
public class FilterPrimitiveException extends FilterException {

    private static final long serialVersionUID = -1877250317380962585L;

    private final String primitiveId;

    public FilterPrimitiveException(String primitiveId, String message) {
        super(primitiveId + ": " + message);
        this.primitiveId = primitiveId;
    }

    public FilterPrimitiveException(String primitiveId, String message, Throwable cause) {
        super(primitiveId + ": " + message, cause);
        this.primitiveId = primitiveId;
    }

    public String primitiveId() {
        return primitiveId;
    }

}
