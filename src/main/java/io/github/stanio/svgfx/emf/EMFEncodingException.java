/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import io.github.stanio.svgfx.FilterException;

/**
 * Signals the metafile encoding was aborted.  Callers escalate to a raster
 * fallback rather than failing the filter primitive outright.
 */
public class EMFEncodingException extends FilterException {

    public enum Reason {
        /** Encoded size would exceed the configured cap. */
        SIZE_EXCEEDED,
        /** A command can't be represented by the supported records. */
        UNSUPPORTED_RECORD,
        /** Malformed record data (reading). */
        INVALID_RECORD
    }

    private static final long serialVersionUID = 2958016426610345577L;

    private final Reason reason;

    public EMFEncodingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

}
