package io.steamwebchat.json.jackson;

import io.steamwebchat.json.spi.JsonNode;
import io.steamwebchat.json.spi.JsonNodeType;

import java.util.Iterator;
import java.util.Objects;

/**
 * Jackson implementation of JsonNode.
 * Wraps a Jackson JsonNode and delegates all operations to it.
 */
final class JacksonJsonNode implements JsonNode {
    final com.fasterxml.jackson.databind.JsonNode delegate;

    JacksonJsonNode(com.fasterxml.jackson.databind.JsonNode delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public JsonNodeType getNodeType() {
        if (delegate.isObject()) return JsonNodeType.OBJECT;
        if (delegate.isArray()) return JsonNodeType.ARRAY;
        if (delegate.isTextual()) return JsonNodeType.STRING;
        if (delegate.isNumber()) return JsonNodeType.NUMBER;
        if (delegate.isBoolean()) return JsonNodeType.BOOLEAN;
        return JsonNodeType.NULL;
    }

    @Override
    public JsonNode get(String fieldName) {
        com.fasterxml.jackson.databind.JsonNode child = delegate.get(fieldName);
        return child == null ? null : new JacksonJsonNode(child);
    }

    @Override
    public JsonNode get(int index) {
        com.fasterxml.jackson.databind.JsonNode child = delegate.get(index);
        return child == null ? null : new JacksonJsonNode(child);
    }

    @Override
    public boolean has(String fieldName) {
        return delegate.has(fieldName);
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public String asText() {
        return delegate.asText();
    }

    @Override
    public long asLong(long defaultValue) {
        return delegate.isNumber() ? delegate.asLong() : defaultValue;
    }

    @Override
    public int asInt(int defaultValue) {
        return delegate.isNumber() ? delegate.asInt() : defaultValue;
    }

    @Override
    public Iterator<JsonNode> elements() {
        Iterator<com.fasterxml.jackson.databind.JsonNode> iter = delegate.elements();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iter.hasNext();
            }

            @Override
            public JsonNode next() {
                return new JacksonJsonNode(iter.next());
            }
        };
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JacksonJsonNode other)) return false;
        return delegate.equals(other.delegate);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }
}
