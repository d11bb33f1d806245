/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import io.github.stanio.svgfx.chain.ExecutionMode;
import io.github.stanio.svgfx.policy.NativeEffectTable;

/**
 * Runtime settings.  Loaded from JSON:
 * <pre>
 * {
 *   "emfSizeCap": 1048576,
 *   "workerPoolSize": 8,
 *   "cacheCapacity": 512,
 *   "cacheMaxBytes": 67108864,
 *   "cacheTtlMillis": 600000,
 *   "cacheSweepMillis": 60000,
 *   "failFast": false,
 *   "primitiveTimeoutMillis": 5000,
 *   "chainTimeoutMillis": 30000,
 *   "executionMode": "SEQUENTIAL",
 *   "emuPerUnit": 9525,
 *   "nativeEffectTable": "/io/github/stanio/svgfx/policy/native-effects.json"
 * }</pre>
 * <p>
 * Absent properties take the values shown (the worker pool defaults to the
 * number of available processors).  {@code svgfx.<name>} system properties
 * override both.</p>
 */
public class FilterConfig {

    public static final String PROPERTY_PREFIX = "svgfx.";

    static final Logger log = Logger.getLogger(FilterConfig.class.getName());

    private long emfSizeCap = 1024 * 1024;
    private int workerPoolSize = Runtime.getRuntime().availableProcessors();
    private int cacheCapacity = 512;
    private long cacheMaxBytes = 64L * 1024 * 1024;
    private long cacheTtlMillis = 600_000;
    private long cacheSweepMillis = 60_000;
    private boolean failFast;
    private long primitiveTimeoutMillis = 5_000;
    private long chainTimeoutMillis = 30_000;
    private ExecutionMode executionMode = ExecutionMode.SEQUENTIAL;
    private double emuPerUnit = 9525;
    private String nativeEffectTable;

    public FilterConfig() {
        // defaults
    }

    /**
     * {@return the default configuration with system property overrides}
     */
    public static FilterConfig defaults() {
        FilterConfig config = new FilterConfig();
        config.applyOverrides(System.getProperties());
        return config;
    }

    public static FilterConfig loadFrom(URL resource) throws IOException {
        try (InputStream in = resource.openStream();
                Reader json = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return loadFrom(json);
        }
    }

    /**
     * Parses the given JSON and applies system property overrides.
     *
     * @param   json  configuration source
     * @return  the loaded configuration
     * @throws  ConfigException  if the source is malformed, or specifies
     *          invalid values
     * @throws  IOException  if reading the source fails
     */
    public static FilterConfig loadFrom(Reader json) throws IOException {
        FilterConfig config;
        try {
            config = new Gson().fromJson(json, FilterConfig.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(e);
        } catch (JsonParseException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        if (config == null) {
            config = new FilterConfig();
        }
        config.validate();
        config.applyOverrides(System.getProperties());
        return config;
    }

    void validate() throws ConfigException {
        if (executionMode == null)
            throw new ConfigException("Unknown executionMode"
                    + " (expected one of SEQUENTIAL, PARALLEL, LAZY)");

        requirePositive("emfSizeCap", emfSizeCap);
        requirePositive("workerPoolSize", workerPoolSize);
        requirePositive("cacheCapacity", cacheCapacity);
        requirePositive("cacheMaxBytes", cacheMaxBytes);
        requireNonNegative("cacheTtlMillis", cacheTtlMillis);
        requireNonNegative("cacheSweepMillis", cacheSweepMillis);
        requirePositive("primitiveTimeoutMillis", primitiveTimeoutMillis);
        requirePositive("chainTimeoutMillis", chainTimeoutMillis);
        if (!(emuPerUnit > 0))
            throw new ConfigException("emuPerUnit must be positive: " + emuPerUnit);
    }

    private static void requirePositive(String name, long value) throws ConfigException {
        if (value <= 0)
            throw new ConfigException(name + " must be positive: " + value);
    }

    private static void requireNonNegative(String name, long value) throws ConfigException {
        if (value < 0)
            throw new ConfigException(name + " must not be negative: " + value);
    }

    /**
     * Applies {@code svgfx.<name>} entries of the given properties.  Values
     * that don't parse, or aren't valid, are logged and ignored.
     *
     * @param   props  properties to look up
     * @return  this config
     */
    public FilterConfig applyOverrides(Properties props) {
        override(props, "emfSizeCap", Long::valueOf, v -> emfSizeCap = positive(v));
        override(props, "workerPoolSize", Integer::valueOf, v -> workerPoolSize = (int) positive(v));
        override(props, "cacheCapacity", Integer::valueOf, v -> cacheCapacity = (int) positive(v));
        override(props, "cacheMaxBytes", Long::valueOf, v -> cacheMaxBytes = positive(v));
        override(props, "cacheTtlMillis", Long::valueOf, v -> cacheTtlMillis = nonNegative(v));
        override(props, "cacheSweepMillis", Long::valueOf, v -> cacheSweepMillis = nonNegative(v));
        override(props, "failFast", FilterConfig::parseBoolean, v -> failFast = v);
        override(props, "primitiveTimeoutMillis", Long::valueOf, v -> primitiveTimeoutMillis = positive(v));
        override(props, "chainTimeoutMillis", Long::valueOf, v -> chainTimeoutMillis = positive(v));
        override(props, "executionMode",
                v -> ExecutionMode.valueOf(v.toUpperCase(Locale.ROOT)), v -> executionMode = v);
        override(props, "emuPerUnit", Double::valueOf, v -> {
            if (!(v > 0))
                throw new IllegalArgumentException("must be positive");
            emuPerUnit = v;
        });
        override(props, "nativeEffectTable", Function.identity(), v -> nativeEffectTable = v);
        return this;
    }

    private static <T> void override(Properties props, String name,
                                     Function<String, T> parser, Consumer<T> setter) {
        String value = props.getProperty(PROPERTY_PREFIX + name, "").strip();
        if (value.isEmpty())
            return;

        try {
            setter.accept(parser.apply(value));
        } catch (IllegalArgumentException e) {
            log.warning(() -> PROPERTY_PREFIX + name + "=" + value + ": " + e.getMessage());
        }
    }

    private static boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true"))
            return true;
        if (value.equalsIgnoreCase("false"))
            return false;

        throw new IllegalArgumentException("not a boolean");
    }

    private static long positive(Number value) {
        if (value.longValue() <= 0)
            throw new IllegalArgumentException("must be positive");
        return value.longValue();
    }

    private static long nonNegative(Number value) {
        if (value.longValue() < 0)
            throw new IllegalArgumentException("must not be negative");
        return value.longValue();
    }

    /**
     * Loads the configured native effect table, or the built-in one if none
     * is configured.  The location is either a URL, or a class path
     * resource name.
     *
     * @return  the native effect table
     * @throws  ConfigException  if the table is malformed, or the resource
     *          is not found
     * @throws  IOException  if reading the table fails
     */
    public NativeEffectTable loadNativeEffects() throws IOException {
        if (nativeEffectTable == null || nativeEffectTable.isBlank())
            return NativeEffectTable.loadDefault();

        return NativeEffectTable.loadFrom(resolve(nativeEffectTable));
    }

    private static URL resolve(String location) throws ConfigException {
        if (location.indexOf(':') > 1) {
            try {
                return new URL(location);
            } catch (MalformedURLException e) {
                log.fine(() -> location + ": " + e.getMessage());
            }
        }
        String name = location.startsWith("/") ? location : "/" + location;
        URL resource = FilterConfig.class.getResource(name);
        if (resource == null)
            throw new ConfigException("Native effect table not found: " + location);

        return resource;
    }

    public long emfSizeCap() {
        return emfSizeCap;
    }

    public FilterConfig emfSizeCap(long sizeCap) {
        this.emfSizeCap = positive(sizeCap);
        return this;
    }

    public int workerPoolSize() {
        return workerPoolSize;
    }

    public FilterConfig workerPoolSize(int size) {
        this.workerPoolSize = (int) positive(size);
        return this;
    }

    public int cacheCapacity() {
        return cacheCapacity;
    }

    public FilterConfig cacheCapacity(int capacity) {
        this.cacheCapacity = (int) positive(capacity);
        return this;
    }

    public long cacheMaxBytes() {
        return cacheMaxBytes;
    }

    public FilterConfig cacheMaxBytes(long maxBytes) {
        this.cacheMaxBytes = positive(maxBytes);
        return this;
    }

    public long cacheTtlMillis() {
        return cacheTtlMillis;
    }

    public FilterConfig cacheTtlMillis(long ttl) {
        this.cacheTtlMillis = nonNegative(ttl);
        return this;
    }

    /**
     * {@return the background cache sweep interval, {@code 0} if disabled}
     */
    public long cacheSweepMillis() {
        return cacheSweepMillis;
    }

    public FilterConfig cacheSweepMillis(long interval) {
        this.cacheSweepMillis = nonNegative(interval);
        return this;
    }

    public boolean failFast() {
        return failFast;
    }

    public FilterConfig failFast(boolean failFast) {
        this.failFast = failFast;
        return this;
    }

    public long primitiveTimeoutMillis() {
        return primitiveTimeoutMillis;
    }

    public FilterConfig primitiveTimeoutMillis(long timeout) {
        this.primitiveTimeoutMillis = positive(timeout);
        return this;
    }

    public long chainTimeoutMillis() {
        return chainTimeoutMillis;
    }

    public FilterConfig chainTimeoutMillis(long timeout) {
        this.chainTimeoutMillis = positive(timeout);
        return this;
    }

    public ExecutionMode executionMode() {
        return executionMode;
    }

    public FilterConfig executionMode(ExecutionMode mode) {
        if (mode == null)
            throw new NullPointerException("mode");

        this.executionMode = mode;
        return this;
    }

    public double emuPerUnit() {
        return emuPerUnit;
    }

    public FilterConfig emuPerUnit(double emuPerUnit) {
        if (!(emuPerUnit > 0))
            throw new IllegalArgumentException("emuPerUnit must be positive: " + emuPerUnit);

        this.emuPerUnit = emuPerUnit;
        return this;
    }

    /**
     * {@return the native effect table location, or {@code null} for the
     * built-in table}
     */
    public String nativeEffectTable() {
        return nativeEffectTable;
    }

    public FilterConfig nativeEffectTable(String location) {
        this.nativeEffectTable = location;
        return this;
    }

    @Override
    public String toString() {
        return "FilterConfig(emfSizeCap=" + emfSizeCap
                + ", workerPoolSize=" + workerPoolSize
                + ", cacheCapacity=" + cacheCapacity
                + ", cacheMaxBytes=" + cacheMaxBytes
                + ", cacheTtlMillis=" + cacheTtlMillis
                + ", cacheSweepMillis=" + cacheSweepMillis
                + ", failFast=" + failFast
                + ", primitiveTimeoutMillis=" + primitiveTimeoutMillis
                + ", chainTimeoutMillis=" + chainTimeoutMillis
                + ", executionMode=" + executionMode
                + ", emuPerUnit=" + emuPerUnit
                + ", nativeEffectTable=" + nativeEffectTable + ")";
    }

}
