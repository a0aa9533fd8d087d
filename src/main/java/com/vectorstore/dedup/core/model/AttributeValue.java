package com.vectorstore.dedup.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * A single attribute value attached to a stored record.
 * Values are one of null, boolean, number, string or a structured (object/array) tree,
 * identified by {@link Kind} so comparisons can dispatch without runtime type inspection.
 */
public final class AttributeValue {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final AttributeValue NULL = new AttributeValue(Kind.NULL, null);

    /**
     * Discriminator for the value held.
     */
    public enum Kind {
        NULL,
        BOOLEAN,
        NUMBER,
        STRING,
        STRUCTURED
    }

    private final Kind kind;
    private final Object value;

    private AttributeValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static AttributeValue of(boolean value) {
        return new AttributeValue(Kind.BOOLEAN, value);
    }

    public static AttributeValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Numeric attribute must be finite, got " + value);
        }
        return new AttributeValue(Kind.NUMBER, value);
    }

    public static AttributeValue of(String value) {
        return value == null ? NULL : new AttributeValue(Kind.STRING, value);
    }

    /**
     * Converts a Jackson tree node into an attribute value.
     */
    public static AttributeValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isBoolean()) {
            return of(node.booleanValue());
        }
        if (node.isNumber()) {
            return of(node.doubleValue());
        }
        if (node.isTextual()) {
            return of(node.textValue());
        }
        if (node.isContainerNode()) {
            return new AttributeValue(Kind.STRUCTURED, withDoubleNumbers(node));
        }
        return of(node.asText());
    }

    /**
     * Converts a plain Java value (as produced by a JSON client library) into an attribute value.
     * Maps, collections and arrays become structured values.
     */
    public static AttributeValue fromObject(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof AttributeValue attributeValue) {
            return attributeValue;
        }
        if (raw instanceof Boolean b) {
            return of(b);
        }
        if (raw instanceof Number n) {
            return of(n.doubleValue());
        }
        if (raw instanceof CharSequence s) {
            return of(s.toString());
        }
        if (raw instanceof JsonNode node) {
            return fromJson(node);
        }
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?> || raw.getClass().isArray()) {
            return new AttributeValue(Kind.STRUCTURED, withDoubleNumbers(MAPPER.valueToTree(raw)));
        }
        return of(raw.toString());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    public double asNumber() {
        requireKind(Kind.NUMBER);
        return (Double) value;
    }

    public String asString() {
        requireKind(Kind.STRING);
        return (String) value;
    }

    /**
     * Returns this value as a Jackson tree node. Works for every kind.
     */
    public JsonNode toJson() {
        switch (kind) {
            case NULL:
                return NullNode.getInstance();
            case BOOLEAN:
                return BooleanNode.valueOf((Boolean) value);
            case NUMBER:
                return DoubleNode.valueOf((Double) value);
            case STRING:
                return TextNode.valueOf((String) value);
            default:
                return ((JsonNode) value).deepCopy();
        }
    }

    /**
     * Copies a tree with every number widened to a double, so {@code 1} and {@code 1.0}
     * nested in structured values serialize identically, as top-level numbers do.
     */
    private static JsonNode withDoubleNumbers(JsonNode node) {
        if (node.isNumber()) {
            return DoubleNode.valueOf(node.doubleValue());
        }
        if (node.isObject()) {
            ObjectNode copy = MAPPER.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), withDoubleNumbers(field.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = MAPPER.createArrayNode();
            node.forEach(element -> copy.add(withDoubleNumbers(element)));
            return copy;
        }
        return node.deepCopy();
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Attribute value is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue that)) return false;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.NULL ? "null" : String.valueOf(value);
    }
}
