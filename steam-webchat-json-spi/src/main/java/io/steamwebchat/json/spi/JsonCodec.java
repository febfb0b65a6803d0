package io.steamwebchat.json.spi;

/**
 * Minimal JSON decode primitive.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.) and are discovered
 * through {@link java.util.ServiceLoader} when none is configured explicitly.
 */
public interface JsonCodec {

    /**
     * Parses JSON bytes into a tree.
     * @param data JSON bytes
     * @return the root node, never null
     * @throws JsonException if the data is empty or not valid JSON
     */
    JsonNode readTree(byte[] data) throws JsonException;

    /**
     * Parses a JSON string into a tree.
     * @param json JSON text
     * @return the root node, never null
     * @throws JsonException if the text is empty or not valid JSON
     */
    JsonNode readTree(String json) throws JsonException;
}
