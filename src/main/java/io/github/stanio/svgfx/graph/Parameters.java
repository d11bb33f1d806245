/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, unit-normalized primitive parameters.  Values are numbers,
 * strings, or number lists.  Entries are kept sorted by name, so the
 * order parameters were supplied in affects neither equality nor the
 * {@linkplain #canonicalForm() canonical form}.
 */
public final class Parameters {

    public static final Parameters EMPTY = new Parameters(new TreeMap<>());

    private final SortedMap<String, Object> values;

    private Parameters(SortedMap<String, Object> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Parameters of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public NavigableSet<String> names() {
        return Collections.unmodifiableNavigableSet(new TreeMap<>(values).navigableKeySet());
    }

    public Object get(String name) {
        return values.get(name);
    }

    public double number(String name, double defaultValue) {
        Object value = values.get(name);
        if (value == null)
            return defaultValue;

        if (value instanceof Double)
            return (Double) value;

        if (value instanceof List) {
            List<?> list = (List<?>) value;
            if (!list.isEmpty())
                return (Double) list.get(0);
        }
        throw new IllegalArgumentException(name + ": not a number: " + value);
    }

    public String string(String name, String defaultValue) {
        Object value = values.get(name);
        if (value == null)
            return defaultValue;

        if (value instanceof String)
            return (String) value;

        throw new IllegalArgumentException(name + ": not a string: " + value);
    }

    /**
     * {@return the given number list parameter, or an empty array if absent}
     * A single number value is returned as a one-element array.
     *
     * @param   name  the parameter name
     */
    public double[] numbers(String name) {
        Object value = values.get(name);
        if (value == null)
            return new double[0];

        if (value instanceof Double)
            return new double[] { (Double) value };

        if (value instanceof List) {
            List<?> list = (List<?>) value;
            double[] array = new double[list.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = (Double) list.get(i);
            }
            return array;
        }
        throw new IllegalArgumentException(name + ": not a number list: " + value);
    }

    /**
     * Number pair as used by {@code stdDeviation}, {@code radius}, etc.:
     * one value applies to both axes.
     *
     * @param   name  the parameter name
     * @param   defaultValue  value for both axes if the parameter is absent
     * @return  two-element array
     */
    public double[] numberPair(String name, double defaultValue) {
        double[] values = numbers(name);
        switch (values.length) {
        case 0:
            return new double[] { defaultValue, defaultValue };
        case 1:
            return new double[] { values[0], values[0] };
        default:
            return new double[] { values[0], values[1] };
        }
    }

    /**
     * {@return a stable textual form of all entries, independent of the
     * insertion order, suitable for hashing}
     */
    public String canonicalForm() {
        StringBuilder buf = new StringBuilder();
        values.forEach((name, value) -> {
            buf.append(name).append('=');
            appendValue(buf, value);
            buf.append(';');
        });
        return buf.toString();
    }

    private static void appendValue(StringBuilder buf, Object value) {
        if (value instanceof List) {
            buf.append('[');
            List<?> list = (List<?>) value;
            for (int i = 0, len = list.size(); i < len; i++) {
                if (i > 0) buf.append(',');
                buf.append(list.get(i));
            }
            buf.append(']');
        } else if (value instanceof String) {
            String str = (String) value;
            buf.append('"').append(str.replace("\\", "\\\\")
                                      .replace("\"", "\\\"")).append('"');
        } else {
            buf.append(value);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        return (obj instanceof Parameters)
                && values.equals(((Parameters) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Parameters" + values;
    }


    public static final class Builder {

        private final SortedMap<String, Object> values = new TreeMap<>();

        Builder() {}

        public Builder put(String name, Object value) {
            values.put(Objects.requireNonNull(name, "name"), normalize(name, value));
            return this;
        }

        public Builder put(String name, double value) {
            values.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder put(String name, double... values) {
            List<Double> list = new ArrayList<>(values.length);
            for (double val : values) {
                list.add(val);
            }
            this.values.put(Objects.requireNonNull(name, "name"),
                            Collections.unmodifiableList(list));
            return this;
        }

        private static Object normalize(String name, Object value) {
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            } else if (value instanceof String) {
                return value;
            } else if (value instanceof double[]) {
                double[] array = (double[]) value;
                List<Double> list = new ArrayList<>(array.length);
                for (double val : array) {
                    list.add(val);
                }
                return Collections.unmodifiableList(list);
            } else if (value instanceof List) {
                List<?> source = (List<?>) value;
                List<Double> list = new ArrayList<>(source.size());
                for (Object item : source) {
                    if (!(item instanceof Number))
                        throw new IllegalArgumentException(name + ": not a number list: " + value);
                    list.add(((Number) item).doubleValue());
                }
                return Collections.unmodifiableList(list);
            }
            throw new IllegalArgumentException(name + ": unsupported value type: "
                    + (value == null ? "null" : value.getClass().getName()));
        }

        public Parameters build() {
            return values.isEmpty() ? EMPTY : new Parameters(new TreeMap<>(values));
        }

    } // class Builder


}
