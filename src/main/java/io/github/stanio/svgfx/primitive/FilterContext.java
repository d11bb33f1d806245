/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.policy.RenderStrategy;

/**
 * Per-node execution context: the chosen strategy, unit conversion, the
 * filtered element, and the cancellation/timeout checkpoint.
 */
public final class FilterContext {

    /** EMU per CSS pixel */
    public static final double DEFAULT_EMU_PER_UNIT = 9525;

    private final String primitiveId;
    private final RenderStrategy strategy;
    private final double emuPerUnit;
    private final SourceGraphic source;
    private final Rectangle2D region;
    private final BooleanSupplier cancelled;
    private final long deadline;
    private final boolean hasDeadline;

    FilterContext(Builder builder) {
        this.primitiveId = builder.primitiveId;
        this.strategy = builder.strategy;
        this.emuPerUnit = builder.emuPerUnit;
        this.source = builder.source;
        this.region = builder.region;
        this.cancelled = builder.cancelled;
        this.deadline = builder.deadline;
        this.hasDeadline = builder.hasDeadline;
    }

    public static Builder builder(String primitiveId) {
        return new Builder(primitiveId);
    }

    public String primitiveId() {
        return primitiveId;
    }

    public RenderStrategy strategy() {
        return strategy;
    }

    public double emuPerUnit() {
        return emuPerUnit;
    }

    /**
     * Converts a length in user units to EMU.
     */
    public long toEmu(double userUnits) {
        return Math.round(userUnits * emuPerUnit);
    }

    public SourceGraphic source() {
        return source;
    }

    /**
     * {@return the primitive subregion if specified, otherwise the union of
     * the input bounds, or the source bounds if there are no inputs}
     *
     * @param   inputs  the primitive inputs
     */
    public Rectangle2D region(List<PrimitiveOutput> inputs) {
        if (region != null)
            return (Rectangle2D) region.clone();

        Rectangle2D union = null;
        for (PrimitiveOutput item : inputs) {
            if (union == null) {
                union = item.bounds();
            } else {
                union.add(item.bounds());
            }
        }
        return (union == null) ? source.bounds() : union;
    }

    /**
     * Primitives call this between internal steps.
     *
     * @throws  FilterPrimitiveException  if the execution got cancelled, or
     *          the primitive ran out of time
     */
    public void checkpoint() throws FilterPrimitiveException {
        if (cancelled.getAsBoolean())
            throw new FilterPrimitiveException(primitiveId, "Cancelled");

        if (hasDeadline && System.nanoTime() - deadline > 0)
            throw new FilterPrimitiveException(primitiveId, "Timed out");
    }

    @Override
    public String toString() {
        return "FilterContext(" + primitiveId + ", " + strategy + ")";
    }


    public static final class Builder {

        final String primitiveId;
        RenderStrategy strategy = RenderStrategy.NATIVE_EFFECT;
        double emuPerUnit = DEFAULT_EMU_PER_UNIT;
        SourceGraphic source = SourceGraphic.of(List.of());
        Rectangle2D region;
        BooleanSupplier cancelled = () -> false;
        long deadline;
        boolean hasDeadline;

        Builder(String primitiveId) {
            this.primitiveId = Objects.requireNonNull(primitiveId, "primitiveId");
        }

        public Builder strategy(RenderStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder emuPerUnit(double emuPerUnit) {
            if (!(emuPerUnit > 0))
                throw new IllegalArgumentException("emuPerUnit: " + emuPerUnit);

            this.emuPerUnit = emuPerUnit;
            return this;
        }

        public Builder source(SourceGraphic source) {
            this.source = Objects.requireNonNull(source, "source");
            return this;
        }

        public Builder region(Rectangle2D region) {
            this.region = (region == null) ? null : (Rectangle2D) region.clone();
            return this;
        }

        public Builder cancelled(BooleanSupplier cancelled) {
            this.cancelled = Objects.requireNonNull(cancelled, "cancelled");
            return this;
        }

        /**
         * @param   nanoTime  {@code System.nanoTime()} value after which
         *          {@code checkpoint()} fails
         */
        public Builder deadline(long nanoTime) {
            this.deadline = nanoTime;
            this.hasDeadline = true;
            return this;
        }

        public FilterContext build() {
            return new FilterContext(this);
        }

    } // class Builder


}
