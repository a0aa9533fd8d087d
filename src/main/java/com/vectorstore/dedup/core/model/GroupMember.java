package com.vectorstore.dedup.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A record as it appears inside a duplicate group.
 *
 * @param id           the record identifier
 * @param attributes   the record's attributes at analysis time
 * @param lastModified the record's {@code lastModified} (or {@code timestamp}) attribute, if any
 */
public record GroupMember(String id, Map<String, AttributeValue> attributes, String lastModified) {

    private static final List<String> LAST_MODIFIED_KEYS = List.of("lastModified", "timestamp");

    public GroupMember {
        Objects.requireNonNull(id, "id is required");
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    /**
     * Builds a member from a record, lifting its modification timestamp when present.
     */
    public static GroupMember from(VectorRecord record) {
        return new GroupMember(record.id(), record.attributes(), extractLastModified(record.attributes()));
    }

    public AttributeValue attribute(String key) {
        return attributes.getOrDefault(key, AttributeValue.NULL);
    }

    private static String extractLastModified(Map<String, AttributeValue> attributes) {
        for (String key : LAST_MODIFIED_KEYS) {
            AttributeValue value = attributes.get(key);
            if (value == null) {
                continue;
            }
            if (value.kind() == AttributeValue.Kind.STRING && !value.asString().isEmpty()) {
                return value.asString();
            }
            if (value.kind() == AttributeValue.Kind.NUMBER && value.asNumber() != 0) {
                double number = value.asNumber();
                return number == Math.rint(number) ? String.valueOf((long) number) : String.valueOf(number);
            }
        }
        return null;
    }
}
