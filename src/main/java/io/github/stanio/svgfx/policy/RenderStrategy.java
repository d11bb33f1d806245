/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.policy;

/**
 * How a filter primitive gets represented in the output document.
 * Constants are declared from the most to the least native, so
 * {@code compareTo()} orders by fidelity loss.
 */
public enum RenderStrategy {

    /** Direct DrawingML effect equivalent. */
    NATIVE_EFFECT,

    /** DrawingML approximation within an error bound. */
    VECTOR_APPROX,

    /** Self-contained vector metafile. */
    EMF_FALLBACK,

    /** Bitmap, when metafile encoding fails. */
    RASTER_FALLBACK;

    /**
     * {@return the less native of this and the given strategy}
     *
     * @param   other  strategy to compare with
     */
    public RenderStrategy leastNative(RenderStrategy other) {
        return compareTo(other) >= 0 ? this : other;
    }

}
