/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import io.github.stanio.svgfx.FilterException;

/**
 * Aborts a chain execution: the first primitive failure when failing fast,
 * a chain timeout, or cancellation.
 */
public class FilterChainException extends FilterException {

    private static final long serialVersionUID = 7713640532851903617L;

    private final String primitiveId;

    public FilterChainException(String primitiveId, String message) {
        super(primitiveId + ": " + message);
        this.primitiveId = primitiveId;
    }

    public FilterChainException(String primitiveId, Throwable cause) {
        super(primitiveId + ": " + cause.getMessage(), cause);
        this.primitiveId = primitiveId;
    }

    /**
     * {@return the id of the failing primitive, or of the filter graph if
     * the failure isn't specific to a primitive}
     */
    public String primitiveId() {
        return primitiveId;
    }

}
