/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.util.Objects;
import java.util.Optional;

import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.primitive.PrimitiveOutput;

/**
 * The outcome of executing a single primitive.
 */
public final class NodeResult {

    private final String primitiveId;
    private final PrimitiveKind kind;
    private final int level;
    private final RenderStrategy strategy;
    private final PrimitiveOutput output;
    private final Diagnostic failure;
    private final long elapsedNanos;

    private NodeResult(String primitiveId,
                       PrimitiveKind kind,
                       int level,
                       RenderStrategy strategy,
                       PrimitiveOutput output,
                       Diagnostic failure,
                       long elapsedNanos) {
        this.primitiveId = primitiveId;
        this.kind = kind;
        this.level = level;
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.output = Objects.requireNonNull(output, "output");
        this.failure = failure;
        this.elapsedNanos = elapsedNanos;
    }

    static NodeResult success(DependencyLevels.Node node,
                              RenderStrategy strategy,
                              PrimitiveOutput output,
                              long elapsedNanos) {
        return new NodeResult(node.id(), node.kind(), node.level(),
                              strategy, output, null, elapsedNanos);
    }

    /**
     * A failed primitive passes its primary input through unchanged.  The
     * pass-through drops the effect, so it counts as a vector approximation.
     */
    static NodeResult failure(DependencyLevels.Node node,
                              PrimitiveOutput passThrough,
                              Diagnostic failure,
                              long elapsedNanos) {
        return new NodeResult(node.id(), node.kind(), node.level(),
                RenderStrategy.VECTOR_APPROX, passThrough.withFragment(""),
                Objects.requireNonNull(failure, "failure"), elapsedNanos);
    }

    public String primitiveId() {
        return primitiveId;
    }

    public PrimitiveKind kind() {
        return kind;
    }

    public int level() {
        return level;
    }

    public RenderStrategy strategy() {
        return strategy;
    }

    public PrimitiveOutput output() {
        return output;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public Optional<Diagnostic> failure() {
        return Optional.ofNullable(failure);
    }

    public long elapsedNanos() {
        return elapsedNanos;
    }

    @Override
    public String toString() {
        return "NodeResult(" + primitiveId + ", level " + level + ", " + strategy
                + (isFailed() ? ", failed: " + failure.message() : "") + ")";
    }

}
