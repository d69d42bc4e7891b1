package com.cardiorecords.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed key-to-scalar bag attached to an audit entry.
 *
 * <p>Keys are non-blank strings; values are limited to {@link String},
 * {@link Long}, {@link Double} and {@link Boolean} so that stored entries keep
 * a stable, queryable shape. Integral numbers are widened to {@code Long}.
 */
public final class AuditMetadata {

    private static final int MAX_KEYS = 32;
    private static final int MAX_STRING_LENGTH = 512;

    private final Map<String, Object> values;

    private AuditMetadata(Map<String, Object> values) {
        this.values = values;
    }

    public static AuditMetadata empty() {
        return new AuditMetadata(Collections.emptyMap());
    }

    /**
     * Builds a bag from an untyped map, rejecting non-scalar values.
     */
    public static AuditMetadata of(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(validKey(key, copy.size()), scalar(key, value)));
        }
        return new AuditMetadata(Collections.unmodifiableMap(copy));
    }

    public AuditMetadata with(String key, String value) {
        return put(key, value == null ? null : truncate(value));
    }

    public AuditMetadata with(String key, long value) {
        return put(key, value);
    }

    public AuditMetadata with(String key, double value) {
        return put(key, value);
    }

    public AuditMetadata with(String key, boolean value) {
        return put(key, value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private AuditMetadata put(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(validKey(key, copy.containsKey(key) ? 0 : copy.size()), value);
        }
        return new AuditMetadata(Collections.unmodifiableMap(copy));
    }

    private static String validKey(String key, int currentSize) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Audit metadata key must not be blank");
        }
        if (currentSize >= MAX_KEYS) {
            throw new IllegalArgumentException("Audit metadata is limited to " + MAX_KEYS + " keys");
        }
        return key;
    }

    private static Object scalar(String key, Object value) {
        if (value instanceof String) {
            return truncate((String) value);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException("Audit metadata value for '" + key + "' must be a scalar, got "
            + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    private static String truncate(String value) {
        return value.length() > MAX_STRING_LENGTH ? value.substring(0, MAX_STRING_LENGTH) : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuditMetadata)) {
            return false;
        }
        return values.equals(((AuditMetadata) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "AuditMetadata" + values;
    }
}
