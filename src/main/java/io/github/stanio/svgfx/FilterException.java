/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx;

/**
 * Base of the checked filter pipeline exceptions.
 */
public class FilterException extends Exception {

    private static final long serialVersionUID = -3194862738519027631L;

    public FilterException(String message) {
        super(message);
    }

    public FilterException(String message, Throwable cause) {
        super(message, cause);
    }

}
