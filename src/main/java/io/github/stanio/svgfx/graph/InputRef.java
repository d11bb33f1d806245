/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import java.util.Objects;

/**
 * A filter primitive input: a well-known source or a named result of another
 * primitive.
 */
public final class InputRef {

    public enum Source {
        SOURCE_GRAPHIC("SourceGraphic"),
        SOURCE_ALPHA("SourceAlpha"),
        BACKGROUND_IMAGE("BackgroundImage");

        final String keyword;

        private Source(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public static final InputRef SOURCE_GRAPHIC = new InputRef(Source.SOURCE_GRAPHIC, null);
    public static final InputRef SOURCE_ALPHA = new InputRef(Source.SOURCE_ALPHA, null);
    public static final InputRef BACKGROUND_IMAGE = new InputRef(Source.BACKGROUND_IMAGE, null);

    private final Source source;
    private final String resultName;

    private InputRef(Source source, String resultName) {
        this.source = source;
        this.resultName = resultName;
    }

    /**
     * Parses an {@code in}/{@code in2} attribute value.  Well-known source
     * keywords map to the corresponding constants, anything else is taken
     * as a result name reference.
     *
     * @param   value  the attribute value
     * @return  the input reference
     */
    public static InputRef of(String value) {
        String name = value.trim();
        if (name.isEmpty())
            throw new IllegalArgumentException("Empty input reference");

        for (Source src : Source.values()) {
            if (src.keyword.equals(name)) {
                return wellKnown(src);
            }
        }
        return new InputRef(null, name);
    }

    public static InputRef result(String name) {
        return new InputRef(null, Objects.requireNonNull(name));
    }

    public static InputRef wellKnown(Source source) {
        switch (source) {
        case SOURCE_GRAPHIC:
            return SOURCE_GRAPHIC;
        case SOURCE_ALPHA:
            return SOURCE_ALPHA;
        case BACKGROUND_IMAGE:
            return BACKGROUND_IMAGE;
        default:
            throw new IllegalArgumentException(String.valueOf(source));
        }
    }

    public boolean isWellKnown() {
        return source != null;
    }

    /**
     * {@return the well-known source, or {@code null} for result references}
     */
    public Source source() {
        return source;
    }

    /**
     * {@return the referenced result name, or {@code null} for well-known
     * sources}
     */
    public String resultName() {
        return resultName;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof InputRef))
            return false;

        InputRef other = (InputRef) obj;
        return source == other.source
                && Objects.equals(resultName, other.resultName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, resultName);
    }

    @Override
    public String toString() {
        return isWellKnown() ? source.keyword : resultName;
    }

}
