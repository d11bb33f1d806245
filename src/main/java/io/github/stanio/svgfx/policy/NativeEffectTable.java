/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.policy;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import io.github.stanio.svgfx.config.ConfigException;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;

/**
 * Versioned table of the filter primitives with a direct DrawingML
 * equivalent, and the parameter ranges that equivalent supports.
 * <pre>
 * {
 *   "version": "1",
 *   "effects": {
 *     "feGaussianBlur": {
 *       "maxComplexity": 0.5,
 *       "params": { "stdDeviation": { "min": 0, "max": 250 } }
 *     },
 *     "feBlend": {
 *       "params": { "mode": { "values": ["normal", "multiply"] } }
 *     }
 *   }
 * }</pre>
 * <p>
 * Effects are keyed by primitive element name.  Parameters not listed are
 * unconstrained; listed parameters absent from a primitive are accepted.
 * A number list parameter is in range when all of its items are.</p>
 */
public class NativeEffectTable {

    public static final String DEFAULT_RESOURCE = "native-effects.json";

    static final Logger log = Logger.getLogger(NativeEffectTable.class.getName());


    public static class Range {
        public Double min;
        public Double max;
        public List<String> values;

        public Range() {
            // empty
        }

        public Range(Double min, Double max) {
            this.min = min;
            this.max = max;
        }

        boolean contains(Object value) {
            if (value instanceof Double) {
                return contains((double) (Double) value);
            } else if (value instanceof List) {
                for (Object item : (List<?>) value) {
                    if (!contains(item))
                        return false;
                }
                return true;
            } else if (value instanceof String) {
                return values == null || values.contains(value);
            }
            return false;
        }

        private boolean contains(double value) {
            return (min == null || value >= min)
                    && (max == null || value <= max);
        }
    }


    public static class Entry {
        public double maxComplexity = 1.0;
        public Map<String, Range> params;

        public Entry() {
            params = new LinkedHashMap<>();
        }

        public boolean accepts(Parameters parameters) {
            if (params == null)
                return true;

            for (Map.Entry<String, Range> constraint : params.entrySet()) {
                Object value = parameters.get(constraint.getKey());
                if (value != null && !constraint.getValue().contains(value))
                    return false;
            }
            return true;
        }
    }


    String version;
    Map<String, Entry> effects;

    NativeEffectTable() {
        version = "0";
        effects = new LinkedHashMap<>();
    }

    public static NativeEffectTable empty() {
        return new NativeEffectTable();
    }

    /**
     * {@return the table bundled with the library}
     *
     * @throws  UncheckedIOException  if the bundled table can't be read
     */
    public static NativeEffectTable loadDefault() {
        URL resource = NativeEffectTable.class.getResource(DEFAULT_RESOURCE);
        if (resource == null)
            throw new IllegalStateException("Resource not found: " + DEFAULT_RESOURCE);

        try {
            return loadFrom(resource);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static NativeEffectTable loadFrom(URL resource) throws IOException {
        try (InputStream in = resource.openStream();
                Reader json = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return loadFrom(json);
        }
    }

    public static NativeEffectTable loadFrom(Reader json) throws IOException {
        NativeEffectTable table;
        try {
            table = new Gson().fromJson(json, NativeEffectTable.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(e);
        } catch (JsonParseException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        if (table == null)
            throw new ConfigException("Empty native effect table");

        table.validate();
        log.fine(() -> "Loaded native effect table version " + table.version
                + " (" + table.effects.size() + " effects)");
        return table;
    }

    private void validate() throws ConfigException {
        if (version == null || version.isBlank())
            throw new ConfigException("Native effect table has no version");

        if (effects == null) {
            effects = new LinkedHashMap<>();
        }
        for (Map.Entry<String, Entry> item : effects.entrySet()) {
            try {
                PrimitiveKind.forElementName(item.getKey());
            } catch (IllegalArgumentException e) {
                throw new ConfigException(e.getMessage(), e);
            }
            if (item.getValue() == null)
                throw new ConfigException("No entry for " + item.getKey());
        }
    }

    public String version() {
        return version;
    }

    public Optional<Entry> entry(PrimitiveKind kind) {
        return Optional.ofNullable(effects.get(kind.elementName()));
    }

    public Map<String, Entry> effects() {
        return Collections.unmodifiableMap(effects);
    }

    public NativeEffectTable with(PrimitiveKind kind, Entry entry) {
        NativeEffectTable copy = new NativeEffectTable();
        copy.version = version;
        copy.effects.putAll(effects);
        copy.effects.put(kind.elementName(), Objects.requireNonNull(entry));
        return copy;
    }

    @Override
    public String toString() {
        return "NativeEffectTable(version=" + version + ", " + effects.keySet() + ")";
    }

}
