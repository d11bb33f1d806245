/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.DrawingCommand;

/**
 * The filtered element: its bounds and vector drawing, and a content
 * fingerprint identifying it in the result cache.  Immutable.
 */
public final class SourceGraphic {

    private final Rectangle2D bounds;
    private final List<DrawingCommand> commands;
    private final String fingerprint;

    private SourceGraphic(Rectangle2D bounds, List<DrawingCommand> commands, String fingerprint) {
        this.bounds = bounds;
        this.commands = commands;
        this.fingerprint = fingerprint;
    }

    public static SourceGraphic of(Rectangle2D bounds, List<? extends DrawingCommand> commands) {
        List<DrawingCommand> copy = Collections.unmodifiableList(new ArrayList<>(commands));
        Rectangle2D box = (Rectangle2D) bounds.clone();
        return new SourceGraphic(box, copy, digest(box, copy));
    }

    public static SourceGraphic of(List<? extends DrawingCommand> commands) {
        return of(PrimitiveOutput.union(commands), commands);
    }

    /**
     * Creates a source graphic with a caller-supplied fingerprint, for
     * elements already identified by the embedding converter.
     */
    public static SourceGraphic of(Rectangle2D bounds,
                                   List<? extends DrawingCommand> commands,
                                   String fingerprint) {
        return new SourceGraphic((Rectangle2D) bounds.clone(),
                Collections.unmodifiableList(new ArrayList<>(commands)),
                Objects.requireNonNull(fingerprint, "fingerprint"));
    }

    private static String digest(Rectangle2D bounds, List<DrawingCommand> commands) {
        MessageDigest sha256;
        try {
            sha256 = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        sha256.update(bounds.toString().getBytes(StandardCharsets.UTF_8));
        for (DrawingCommand cmd : commands) {
            sha256.update((byte) '\n');
            sha256.update(cmd.toString().getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(sha256.digest());
    }

    public Rectangle2D bounds() {
        return (Rectangle2D) bounds.clone();
    }

    public List<DrawingCommand> commands() {
        return commands;
    }

    public String fingerprint() {
        return fingerprint;
    }

    /**
     * {@return the {@code SourceGraphic} input}
     */
    public PrimitiveOutput asOutput() {
        return PrimitiveOutput.of("", commands, bounds);
    }

    /**
     * {@return the {@code SourceAlpha} input: the source geometry painted
     * black}
     */
    public PrimitiveOutput alpha() {
        List<DrawingCommand> black = new ArrayList<>(commands.size());
        for (DrawingCommand cmd : commands) {
            black.add(cmd.recolor(0x000000));
        }
        return PrimitiveOutput.of("", black, bounds);
    }

    @Override
    public String toString() {
        return "SourceGraphic(" + commands.size() + " commands, bounds=" + bounds + ")";
    }

}
