/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.util.Objects;
import java.util.logging.Level;

/**
 * A degradation recorded during chain execution: an isolated primitive
 * failure, or a fallback the caller may want to know about.
 */
public final class Diagnostic {

    private final Level level;
    private final String primitiveId;
    private final String message;
    private final Throwable cause;

    public Diagnostic(Level level, String primitiveId, String message, Throwable cause) {
        this.level = Objects.requireNonNull(level, "level");
        this.primitiveId = Objects.requireNonNull(primitiveId, "primitiveId");
        this.message = Objects.requireNonNull(message, "message");
        this.cause = cause;
    }

    public static Diagnostic warning(String primitiveId, String message, Throwable cause) {
        return new Diagnostic(Level.WARNING, primitiveId, message, cause);
    }

    public static Diagnostic info(String primitiveId, String message) {
        return new Diagnostic(Level.INFO, primitiveId, message, null);
    }

    public Level level() {
        return level;
    }

    public String primitiveId() {
        return primitiveId;
    }

    public String message() {
        return message;
    }

    /**
     * {@return the underlying failure, or {@code null}}
     */
    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return level + " " + primitiveId + ": " + message;
    }

}
