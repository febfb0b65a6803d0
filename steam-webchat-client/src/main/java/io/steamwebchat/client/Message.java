package io.steamwebchat.client;

import io.steamwebchat.core.MessageType;
import io.steamwebchat.core.PersonaState;

import java.util.Objects;

/**
 * A chat event. For polled events {@code steamId} is the sender; for outgoing messages it is the
 * recipient.
 *
 * @param steamId the other party's id
 * @param type the event kind
 * @param text message text (saytext and emote)
 * @param nick display name (personastate)
 * @param state numeric persona state (personastate and personarelationship)
 */
public record Message(String steamId, MessageType type, String text, String nick, Integer state) {
    public Message {
        Objects.requireNonNull(steamId, "steamId");
        Objects.requireNonNull(type, "type");
    }

    public static Message sayText(String steamId, String text) {
        return new Message(steamId, MessageType.SAY_TEXT, Objects.requireNonNull(text, "text"), null, null);
    }

    public static Message emote(String steamId, String text) {
        return new Message(steamId, MessageType.EMOTE, Objects.requireNonNull(text, "text"), null, null);
    }

    public static Message typing(String steamId) {
        return new Message(steamId, MessageType.TYPING, null, null, null);
    }

    public PersonaState personaState() {
        return state == null ? PersonaState.OFFLINE : PersonaState.fromCode(state);
    }
}
