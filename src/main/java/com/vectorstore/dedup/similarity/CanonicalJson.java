package com.vectorstore.dedup.similarity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vectorstore.dedup.core.model.AttributeValue;

import java.util.Map;

/**
 * Canonical serialization of attribute maps and values.
 * Keys are written in map iteration order, so two maps are byte-equal only if they
 * hold the same entries in the same order.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {
    }

    public static String serialize(Map<String, AttributeValue> attributes) {
        ObjectNode node = MAPPER.createObjectNode();
        attributes.forEach((key, value) -> node.set(key, value != null ? value.toJson() : null));
        return write(node);
    }

    public static String serialize(AttributeValue value) {
        return write(value.toJson());
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize attribute tree", e);
        }
    }
}
