/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of procedural pattern fills the metafile encoder
 * supports.  Hatch patterns map to GDI hatched brushes, the rest to 8×8
 * monochrome pattern brushes.
 *
 * @see  <a href="https://learn.microsoft.com/openspecs/windows_protocols/ms-wmf/8eba6a9b-bd42-4ab8-8bbb-2a8f5b2a73a4"
 *              >HatchStyle Enumeration</a> <i>(MS-WMF)</i>
 */
public enum FillPattern {

    HATCH(EMFConstants.HS_HORIZONTAL,
          0xFF, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00),

    CROSSHATCH(EMFConstants.HS_CROSS,
               0xFF, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80),

    HEXAGONAL(-1,
              0x88, 0x00, 0x22, 0x00, 0x88, 0x00, 0x22, 0x00),

    GRID(-1,
         0xFF, 0x81, 0x81, 0x81, 0x81, 0x81, 0x81, 0xFF),

    BRICK(-1,
          0xFF, 0x80, 0x80, 0x80, 0xFF, 0x08, 0x08, 0x08);

    private static final Map<String, FillPattern> semantics = new HashMap<>();
    static {
        for (String name : new String[] { "hatch", "lines", "horizontal", "stripes" })
            semantics.put(name, HATCH);
        for (String name : new String[] { "crosshatch", "cross", "mesh" })
            semantics.put(name, CROSSHATCH);
        for (String name : new String[] { "hexagonal", "hex", "dots", "honeycomb" })
            semantics.put(name, HEXAGONAL);
        for (String name : new String[] { "grid", "cells" })
            semantics.put(name, GRID);
        for (String name : new String[] { "brick", "masonry" })
            semantics.put(name, BRICK);
    }

    private final int hatchStyle;
    private final byte[] rows;

    private FillPattern(int hatchStyle, int... rows) {
        this.hatchStyle = hatchStyle;
        this.rows = new byte[rows.length];
        for (int i = 0; i < rows.length; i++) {
            this.rows[i] = (byte) rows[i];
        }
    }

    /**
     * Selects a pattern for the given fill semantics, like {@code "hatch"},
     * {@code "crosshatch"}, {@code "dots"}, {@code "grid"}, {@code "brick"}.
     *
     * @param   name  requested fill semantics (case-insensitive)
     * @return  the matching pattern, or empty if none
     */
    public static Optional<FillPattern> forSemantics(String name) {
        if (name == null)
            return Optional.empty();

        return Optional.ofNullable(semantics.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * {@return whether this pattern is drawn as a GDI hatched brush}
     */
    public boolean isHatched() {
        return hatchStyle >= 0;
    }

    int hatchStyle() {
        return hatchStyle;
    }

    /**
     * {@return the 8×8 pattern bits, one byte per row, top row first, most
     * significant bit leftmost; set bits denote the foreground}
     */
    public byte[] rows() {
        return rows.clone();
    }

}
