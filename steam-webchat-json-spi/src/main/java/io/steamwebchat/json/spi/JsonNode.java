package io.steamwebchat.json.spi;

import java.util.Iterator;

/**
 * Read-only abstraction of a JSON tree node. Represents any JSON value (object, array, string,
 * number, boolean, null) without exposing the underlying JSON library.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Gets an element by index from an array node.
     * Returns null if this is not an array or index is out of bounds.
     */
    JsonNode get(int index);

    /**
     * Returns true if this node has a field with the given name.
     */
    boolean has(String fieldName);

    /**
     * Returns the number of fields (objects) or elements (arrays); 0 for anything else.
     */
    int size();

    /**
     * Returns the text value of this node.
     * For text nodes: the string value
     * For other types: string representation
     */
    String asText();

    /**
     * Returns the long value of this node, or the default if it is not numeric.
     */
    long asLong(long defaultValue);

    /**
     * Returns the int value of this node, or the default if it is not numeric.
     */
    int asInt(int defaultValue);

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();

    /**
     * Returns the string value of an object's field, or null if the field is missing or not a string.
     */
    default String text(String fieldName) {
        JsonNode child = get(fieldName);
        return child != null && child.isTextual() ? child.asText() : null;
    }
}
