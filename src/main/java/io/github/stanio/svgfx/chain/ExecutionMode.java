/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

/**
 * How a {@code FilterChain} schedules its primitives.
 */
public enum ExecutionMode {

    /** One primitive at a time, on the calling thread, in dependency order. */
    SEQUENTIAL,

    /**
     * Primitives of the same dependency level run concurrently on the
     * worker pool; a level starts once the previous one has completed.
     */
    PARALLEL,

    /** One dependency level per iteration step, on the consuming thread. */
    LAZY

}
