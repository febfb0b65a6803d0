package io.steamwebchat.client;

import io.steamwebchat.json.spi.JsonNode;

/**
 * Turns the parsed body of one operation's response into a {@link DecodeOutcome}.
 * Decoders for session-changing operations update the session as a side effect.
 */
@FunctionalInterface
interface ResponseDecoder<T> {
    DecodeOutcome<T> decode(JsonNode json, Session session);
}
