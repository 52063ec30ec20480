// file: core/src/main/java/io/envsync/core/ResourceRecord.java
package io.envsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opaque structured record returned by the backend: field name -> JSON-like value
 * (String, Number, Boolean, null, nested Map or List).
 * <p>
 * Creatable entities carry their identifier in the "id" field. Field order is
 * preserved so a persisted record reads back the way it was written. Immutable
 * all the way down: nested maps and lists are copied on construction.
 */
public final class ResourceRecord {

    public static final String ID_FIELD = "id";

    private static final ResourceRecord EMPTY = new ResourceRecord(Map.of());

    private final Map<String, Object> fields;

    public ResourceRecord(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        this.fields = freezeMap(fields);
    }

    // Deep copy: nested maps and lists become unmodifiable too.
    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : source.entrySet()) {
            copy.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m) {
            return freezeMap(m);
        }
        if (value instanceof List<?> l) {
            List<Object> copy = new ArrayList<>(l.size());
            for (Object item : l) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static ResourceRecord empty() {
        return EMPTY;
    }

    /** Record with a single "id" field. Mostly useful in tests and fakes. */
    public static ResourceRecord withId(String id) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(ID_FIELD, id);
        return new ResourceRecord(m);
    }

    /** Identifier of the record, if it has a non-blank scalar "id" field. */
    public Optional<String> id() {
        return string(ID_FIELD);
    }

    /** Scalar field rendered as a string; empty for missing, null, blank or structured values. */
    public Optional<String> string(String field) {
        Object v = fields.get(field);
        if (v instanceof String s) {
            return s.isBlank() ? Optional.empty() : Optional.of(s);
        }
        if (v instanceof Number || v instanceof Boolean) {
            return Optional.of(v.toString());
        }
        return Optional.empty();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /** Copy of this record with one field replaced or added. */
    public ResourceRecord with(String field, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(fields);
        m.put(field, value);
        return new ResourceRecord(m);
    }

    /** Unmodifiable view of the fields. */
    public Map<String, Object> fields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceRecord other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceRecord" + fields;
    }
}
