package com.ttennebkram.stylize.config;

import com.ttennebkram.stylize.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, nested key/value section of a configuration document.
 * Values are Number, Boolean, String, List or nested ConfigSection.
 *
 * Typed getters return the supplied default when the key is missing or holds
 * a value of another type, so stages and effects can read loosely-specified
 * parameters the same way they read their own defaults.
 */
public final class ConfigSection {

    public static final ConfigSection EMPTY = new ConfigSection(Collections.emptyMap());

    private final Map<String, Object> values;

    private ConfigSection(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Build a section from a plain map. Nested maps become nested sections.
     */
    public static ConfigSection of(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            copy.put(entry.getKey(), freeze(entry.getKey(), entry.getValue()));
        }
        return new ConfigSection(Collections.unmodifiableMap(copy));
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(String key, Object value) {
        if (value instanceof Number) {
            return normalizeNumber((Number) value);
        }
        if (value == null || value instanceof Boolean
                || value instanceof String || value instanceof ConfigSection) {
            return value;
        }
        if (value instanceof Map) {
            return of((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> frozen = new ArrayList<>();
            for (Object item : (List<?>) value) {
                frozen.add(freeze(key, item));
            }
            return Collections.unmodifiableList(frozen);
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name().toLowerCase();
        }
        throw new ConfigurationException("Unsupported value type for '" + key + "': "
                + value.getClass().getSimpleName());
    }

    // Integral values are stored as Long, everything else as Double
    private static Number normalizeNumber(Number number) {
        if (number instanceof Long || number instanceof Double) {
            return number;
        }
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (number instanceof Float) {
            return number.doubleValue();
        }
        String text = number.toString();
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return number.doubleValue();
            }
        }
        return number.doubleValue();
    }

    public boolean has(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int getInt(String key, int defaultValue) {
        Object val = values.get(key);
        if (val instanceof Number) {
            return ((Number) val).intValue();
        }
        return defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        Object val = values.get(key);
        if (val instanceof Number) {
            return ((Number) val).longValue();
        }
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object val = values.get(key);
        if (val instanceof Number) {
            return ((Number) val).doubleValue();
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object val = values.get(key);
        if (val instanceof Boolean) {
            return (Boolean) val;
        }
        return defaultValue;
    }

    public String getString(String key, String defaultValue) {
        Object val = values.get(key);
        if (val instanceof String) {
            return (String) val;
        }
        return defaultValue;
    }

    /**
     * Nested section, or EMPTY if absent.
     */
    public ConfigSection getSection(String key) {
        Object val = values.get(key);
        if (val instanceof ConfigSection) {
            return (ConfigSection) val;
        }
        return EMPTY;
    }

    /**
     * Strict numeric read used during validation: missing keys yield null,
     * present keys of the wrong type are rejected.
     */
    public Number requireNumber(String key) {
        Object val = values.get(key);
        if (val == null) {
            return null;
        }
        if (!(val instanceof Number)) {
            throw new ConfigurationException("'" + key + "' must be a number, got '" + val + "'");
        }
        return (Number) val;
    }

    /**
     * Strict whole-number read: fractional values and values outside the int range are rejected.
     */
    public Integer requireInt(String key) {
        Long value = requireLong(key);
        if (value == null) {
            return null;
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigurationException("'" + key + "' is out of range for an integer: " + value);
        }
        return value.intValue();
    }

    /**
     * Strict whole-number read: fractional values and values outside the long range are rejected.
     */
    public Long requireLong(String key) {
        Number n = requireNumber(key);
        if (n == null) {
            return null;
        }
        if (n instanceof Long) {
            return (Long) n;
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)
                || d < Long.MIN_VALUE || d >= 0x1p63) {
            throw new ConfigurationException("'" + key + "' must be a whole number, got " + n);
        }
        return (long) d;
    }

    public Boolean requireBoolean(String key) {
        Object val = values.get(key);
        if (val == null) {
            return null;
        }
        if (!(val instanceof Boolean)) {
            throw new ConfigurationException("'" + key + "' must be true or false, got '" + val + "'");
        }
        return (Boolean) val;
    }

    public String requireString(String key) {
        Object val = values.get(key);
        if (val == null) {
            return null;
        }
        if (!(val instanceof String)) {
            throw new ConfigurationException("'" + key + "' must be a string, got '" + val + "'");
        }
        return (String) val;
    }

    /**
     * Return a new section with one key replaced.
     */
    public ConfigSection with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return of(copy);
    }

    /**
     * Deep merge: keys in {@code overlay} win, nested sections merge recursively.
     */
    public ConfigSection merge(ConfigSection overlay) {
        if (overlay == null || overlay.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return overlay;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        for (Map.Entry<String, Object> entry : overlay.values.entrySet()) {
            Object existing = merged.get(entry.getKey());
            if (existing instanceof ConfigSection && entry.getValue() instanceof ConfigSection) {
                merged.put(entry.getKey(), ((ConfigSection) existing).merge((ConfigSection) entry.getValue()));
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return of(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigSection)) return false;
        return values.equals(((ConfigSection) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
