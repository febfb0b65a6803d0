package io.steamwebchat.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.steamwebchat.json.spi.JsonCodec;
import io.steamwebchat.json.spi.JsonException;
import io.steamwebchat.json.spi.JsonNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Registered as a {@link java.util.ServiceLoader} provider.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory())
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Empty document");
        }
        try {
            return wrapRoot(mapper.readTree(data));
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException(e.getMessage(), e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        if (json == null || json.isEmpty()) {
            throw new JsonException("Empty document");
        }
        try {
            return wrapRoot(mapper.readTree(json));
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException(e.getMessage(), e);
        }
    }

    // readTree yields a MissingNode for whitespace-only input
    private static JsonNode wrapRoot(com.fasterxml.jackson.databind.JsonNode node) throws JsonException {
        if (node == null || node.isMissingNode()) {
            throw new JsonException("Empty document");
        }
        return new JacksonJsonNode(node);
    }
}
