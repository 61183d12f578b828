package com.openrangelabs.donpetre.pipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single source-format-agnostic record: an ordered mapping of field name to
 * scalar or nested value.
 *
 * <p>Records carry no schema. Two records are equal when their fields are equal,
 * regardless of insertion order.
 */
public class DataRecord {

    public static final String FINGERPRINT_FIELD = "_fingerprint";

    private final Map<String, Object> fields;

    public DataRecord() {
        this.fields = new LinkedHashMap<>();
    }

    public DataRecord(Map<String, ?> fields) {
        this.fields = new LinkedHashMap<>(fields);
    }

    public static DataRecord of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain an even number of elements");
        }
        DataRecord record = new DataRecord();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return record;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public DataRecord put(String field, Object value) {
        fields.put(Objects.requireNonNull(field, "field"), value);
        return this;
    }

    public Object remove(String field) {
        return fields.remove(field);
    }

    public boolean containsField(String field) {
        return fields.containsKey(field);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Read-only view of the fields in insertion order.
     */
    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public String getFingerprint() {
        Object value = fields.get(FINGERPRINT_FIELD);
        return value != null ? value.toString() : null;
    }

    public DataRecord stampFingerprint(String fingerprint) {
        fields.put(FINGERPRINT_FIELD, fingerprint);
        return this;
    }

    /**
     * Copies nested maps and lists so the copy can be changed without touching this record.
     */
    public DataRecord copy() {
        DataRecord copy = new DataRecord();
        fields.forEach((key, value) -> copy.fields.put(key, deepCopy(value)));
        return copy;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copied = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copied.put(String.valueOf(k), deepCopy(v)));
            return copied;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copied = new ArrayList<>(list.size());
            list.forEach(v -> copied.add(deepCopy(v)));
            return copied;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataRecord)) return false;
        return fields.equals(((DataRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "DataRecord" + fields;
    }
}
