/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.config;

import java.io.IOException;

/**
 * Signals malformed configuration data vs. an error reading the data
 * (device error).
 */
public class ConfigException extends IOException {

    private static final long serialVersionUID = -4360781572954871236L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

}
