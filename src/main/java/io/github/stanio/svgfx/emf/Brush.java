/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import java.util.Objects;

/**
 * Fill paint of a {@code DrawingCommand}: a solid color, or a pattern with
 * foreground and background colors.  Colors are {@code 0xRRGGBB}.
 */
public final class Brush {

    private final int color;
    private final int background;
    private final FillPattern pattern;

    private Brush(int color, int background, FillPattern pattern) {
        this.color = color & 0xFFFFFF;
        this.background = background & 0xFFFFFF;
        this.pattern = pattern;
    }

    public static Brush solid(int rgb) {
        return new Brush(rgb, 0, null);
    }

    public static Brush pattern(FillPattern pattern, int foreground, int background) {
        return new Brush(foreground, background, Objects.requireNonNull(pattern));
    }

    public int color() {
        return color;
    }

    public int background() {
        return background;
    }

    /**
     * {@return the fill pattern, or {@code null} for a solid brush}
     */
    public FillPattern pattern() {
        return pattern;
    }

    public boolean isSolid() {
        return pattern == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Brush))
            return false;

        Brush other = (Brush) obj;
        return color == other.color
                && background == other.background
                && pattern == other.pattern;
    }

    @Override
    public int hashCode() {
        return Objects.hash(color, background, pattern);
    }

    @Override
    public String toString() {
        return isSolid() ? String.format("solid(#%06X)", color)
                         : String.format("%s(#%06X/#%06X)", pattern, color, background);
    }

}
