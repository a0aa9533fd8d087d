package com.vectorstore.dedup.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stored record: an opaque identifier plus a flat attribute map.
 * Attribute order is preserved as supplied, since canonical serialization depends on it.
 */
public record VectorRecord(String id, Map<String, AttributeValue> attributes) {

    public VectorRecord {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    /**
     * Creates a record from loosely-typed attribute values.
     */
    public static VectorRecord of(String id, Map<String, ?> rawAttributes) {
        Map<String, AttributeValue> converted = new LinkedHashMap<>();
        if (rawAttributes != null) {
            rawAttributes.forEach((key, value) -> converted.put(key, AttributeValue.fromObject(value)));
        }
        return new VectorRecord(id, converted);
    }

    /**
     * Returns the attribute value for a key, or {@link AttributeValue#NULL} if absent.
     */
    public AttributeValue attribute(String key) {
        return attributes.getOrDefault(key, AttributeValue.NULL);
    }
}
