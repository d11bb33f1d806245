/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.cache;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

import io.github.stanio.svgfx.graph.FilterGraph;

/**
 * SHA-256 digest identifying a filter execution: the graph structure, the
 * parameter values, the input fingerprint, and a salt (the policy
 * version).  Parameters are stored name-sorted, so attribute order doesn't
 * affect the key.
 */
public final class CacheKey {

    private final String digest;

    private CacheKey(String digest) {
        this.digest = digest;
    }

    public static CacheKey of(FilterGraph graph, String inputFingerprint, String salt) {
        return of(graph.structuralForm(), graph.parameterForm(), inputFingerprint, salt);
    }

    /**
     * Digests the given parts.  Each part is length-prefixed, so distinct
     * part lists never produce the same input to the digest.
     */
    public static CacheKey of(String... parts) {
        MessageDigest sha256;
        try {
            sha256 = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        for (String item : parts) {
            byte[] bytes = Objects.requireNonNull(item, "part").getBytes(StandardCharsets.UTF_8);
            sha256.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
            sha256.update(bytes);
        }
        return new CacheKey(HexFormat.of().formatHex(sha256.digest()));
    }

    public String digest() {
        return digest;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        return (obj instanceof CacheKey)
                && digest.equals(((CacheKey) obj).digest);
    }

    @Override
    public int hashCode() {
        return digest.hashCode();
    }

    @Override
    public String toString() {
        return "CacheKey(" + digest.substring(0, 12) + ")";
    }

}
