/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.cache;

import io.github.stanio.svgfx.FilterException;

/**
 * A cached value no longer matches the checksum recorded when it was
 * stored.
 */
public class CacheCorruptionException extends FilterException {

    private static final long serialVersionUID = 3318937047525185120L;

    private final CacheKey key;

    public CacheCorruptionException(CacheKey key, long expected, long actual) {
        super("Checksum mismatch for " + key + ": expected "
                + Long.toHexString(expected) + ", got " + Long.toHexString(actual));
        this.key = key;
    }

    public CacheKey key() {
        return key;
    }

}
