/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx;

import java.util.Objects;

/**
 * Wraps a {@code FilterException} where checked exceptions can't be
 * thrown, like from an {@code Iterator} or a worker task.
 */
public class UncheckedFilterException extends RuntimeException {

    private static final long serialVersionUID = 6240377581935519864L;

    public UncheckedFilterException(FilterException cause) {
        super(Objects.requireNonNull(cause));
    }

    @Override
    public synchronized FilterException getCause() {
        return (FilterException) super.getCause();
    }

}
