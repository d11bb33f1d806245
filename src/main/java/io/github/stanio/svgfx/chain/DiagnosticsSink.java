/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.util.logging.Logger;

/**
 * Receives the diagnostics of chain executions.  Reports may arrive from
 * worker threads.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    void report(Diagnostic diagnostic);

    static DiagnosticsSink none() {
        return diagnostic -> { /* discard */ };
    }

    /**
     * {@return a sink logging to the {@code io.github.stanio.svgfx.chain}
     * logger}
     */
    static DiagnosticsSink logging() {
        return logging(Logger.getLogger(DiagnosticsSink.class.getPackageName()));
    }

    static DiagnosticsSink logging(Logger logger) {
        return diagnostic -> {
            if (logger.isLoggable(diagnostic.level())) {
                logger.log(diagnostic.level(), diagnostic.primitiveId()
                        + ": " + diagnostic.message(), diagnostic.cause());
            }
        };
    }

}
