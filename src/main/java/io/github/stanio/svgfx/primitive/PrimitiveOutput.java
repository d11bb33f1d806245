/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.DrawingCommand;

/**
 * Result of a filter primitive: a DrawingML fragment (empty for metafile
 * strategies, or when the effect is a no-op), the result geometry as
 * drawing commands, and the result bounds.  Immutable.
 */
public final class PrimitiveOutput {

    private final String fragment;
    private final List<DrawingCommand> commands;
    private final Rectangle2D bounds;
    private final boolean rasterPreferred;

    private PrimitiveOutput(String fragment,
                            List<DrawingCommand> commands,
                            Rectangle2D bounds,
                            boolean rasterPreferred) {
        this.fragment = Objects.requireNonNull(fragment, "fragment");
        this.commands = commands;
        this.bounds = (Rectangle2D) bounds.clone();
        this.rasterPreferred = rasterPreferred;
    }

    public static PrimitiveOutput of(String fragment,
                                     List<? extends DrawingCommand> commands,
                                     Rectangle2D bounds) {
        return new PrimitiveOutput(fragment,
                Collections.unmodifiableList(new ArrayList<>(commands)),
                Objects.requireNonNull(bounds, "bounds"), false);
    }

    /**
     * Creates an output with bounds covering the given commands.
     */
    public static PrimitiveOutput of(String fragment, List<? extends DrawingCommand> commands) {
        return of(fragment, commands, union(commands));
    }

    public static PrimitiveOutput empty() {
        return of("", Collections.emptyList(), new Rectangle2D.Double());
    }

    static Rectangle2D union(List<? extends DrawingCommand> commands) {
        Rectangle2D union = null;
        for (DrawingCommand cmd : commands) {
            if (union == null) {
                union = cmd.bounds();
            } else {
                union.add(cmd.bounds());
            }
        }
        return (union == null) ? new Rectangle2D.Double() : union;
    }

    public String fragment() {
        return fragment;
    }

    public boolean hasFragment() {
        return !fragment.isEmpty();
    }

    public List<DrawingCommand> commands() {
        return commands;
    }

    public Rectangle2D bounds() {
        return (Rectangle2D) bounds.clone();
    }

    /**
     * {@return whether the effect needs per-pixel arithmetic, which only a
     * bitmap reproduces faithfully}
     */
    public boolean isRasterPreferred() {
        return rasterPreferred;
    }

    public PrimitiveOutput withFragment(String fragment) {
        return new PrimitiveOutput(fragment, commands, bounds, rasterPreferred);
    }

    public PrimitiveOutput withRasterPreferred() {
        return new PrimitiveOutput(fragment, commands, bounds, true);
    }

    @Override
    public String toString() {
        return "PrimitiveOutput(" + commands.size() + " commands, bounds=" + bounds
                + (fragment.isEmpty() ? "" : ", fragment=" + fragment) + ")";
    }

}
