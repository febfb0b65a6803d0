package io.steamwebchat.core;

import java.util.Optional;

/**
 * Chat event kinds and their wire names.
 */
public enum MessageType {
    SAY_TEXT("saytext"),
    EMOTE("emote"),
    LEFT_CONVERSATION("leftconversation"),
    RELATIONSHIP("personarelationship"),
    STATE("personastate"),
    TYPING("typing");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a type by its wire name, ignoring ASCII case.
     *
     * @param wireName the value of a message's {@code type} field, may be null
     * @return the matching type, or empty for unknown names
     */
    public static Optional<MessageType> fromWireName(String wireName) {
        if (wireName == null) return Optional.empty();
        for (MessageType type : values()) {
            if (type.wireName.equalsIgnoreCase(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
