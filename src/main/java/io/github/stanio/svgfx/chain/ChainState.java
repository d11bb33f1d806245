/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

/**
 * {@code FilterChain} lifecycle.  A chain moves forward only:
 * <pre>
 * PENDING &rarr; RESOLVING &rarr; EXECUTING &rarr; COMPLETED | FAILED</pre>
 * Resolution failures go straight to {@code FAILED}.
 */
public enum ChainState {

    PENDING,
    RESOLVING,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

}
