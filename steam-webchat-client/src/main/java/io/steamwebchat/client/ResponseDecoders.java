package io.steamwebchat.client;

import io.steamwebchat.core.MessageType;
import io.steamwebchat.core.SteamApiException;
import io.steamwebchat.json.spi.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static io.steamwebchat.core.Protocol.ERROR_CODE_STEAMGUARD;
import static io.steamwebchat.core.Protocol.F_ACCESS_TOKEN;
import static io.steamwebchat.core.Protocol.F_ERROR;
import static io.steamwebchat.core.Protocol.F_ERROR_CODE;
import static io.steamwebchat.core.Protocol.F_ERROR_DESCRIPTION;
import static io.steamwebchat.core.Protocol.F_FRIENDS;
import static io.steamwebchat.core.Protocol.F_GAME_EXTRA_INFO;
import static io.steamwebchat.core.Protocol.F_GAME_SERVER_IP;
import static io.steamwebchat.core.Protocol.F_MESSAGE;
import static io.steamwebchat.core.Protocol.F_MESSAGES;
import static io.steamwebchat.core.Protocol.F_MESSAGE_LAST;
import static io.steamwebchat.core.Protocol.F_PERSONANAME;
import static io.steamwebchat.core.Protocol.F_PERSONASTATE;
import static io.steamwebchat.core.Protocol.F_PERSONA_NAME;
import static io.steamwebchat.core.Protocol.F_PERSONA_STATE;
import static io.steamwebchat.core.Protocol.F_PLAYERS;
import static io.steamwebchat.core.Protocol.F_PROFILE_URL;
import static io.steamwebchat.core.Protocol.F_REAL_NAME;
import static io.steamwebchat.core.Protocol.F_RELATIONSHIP;
import static io.steamwebchat.core.Protocol.F_STEAMID;
import static io.steamwebchat.core.Protocol.F_STEAMID_FROM;
import static io.steamwebchat.core.Protocol.F_TEXT;
import static io.steamwebchat.core.Protocol.F_TYPE;
import static io.steamwebchat.core.Protocol.F_UMQID;
import static io.steamwebchat.core.Protocol.RELATIONSHIP_FRIEND;
import static io.steamwebchat.core.Protocol.STATUS_NOT_LOGGED_ON;
import static io.steamwebchat.core.Protocol.STATUS_OK;
import static io.steamwebchat.core.Protocol.STATUS_TIMEOUT;

/**
 * One decoder per operation.
 *
 * <p>Decoders only see well-formed JSON; transport and parse failures are handled before them.
 */
final class ResponseDecoders {

    private static final Logger log = LoggerFactory.getLogger(ResponseDecoders.class);

    private ResponseDecoders() {}

    static DecodeOutcome<Void> auth(JsonNode json, Session session) {
        String token = json.text(F_ACCESS_TOKEN);
        if (token != null) {
            session.token(token);
            return DecodeOutcome.decoded(null);
        }

        String description = json.text(F_ERROR_DESCRIPTION);
        if (ERROR_CODE_STEAMGUARD.equals(json.text(F_ERROR_CODE))) {
            return DecodeOutcome.rejected(new SteamApiException.AuthCodeRequired(description));
        }
        return DecodeOutcome.rejected(new SteamApiException.AuthFailure(description));
    }

    static DecodeOutcome<List<String>> friends(JsonNode json, Session session) {
        List<String> ids = new ArrayList<>();
        JsonNode friends = json.get(F_FRIENDS);

        if (friends != null && friends.isArray()) {
            for (Iterator<JsonNode> it = friends.elements(); it.hasNext(); ) {
                JsonNode friend = it.next();
                if (!RELATIONSHIP_FRIEND.equals(friend.text(F_RELATIONSHIP))) continue;
                String steamId = friend.text(F_STEAMID);
                if (steamId == null) continue;
                ids.add(steamId);
            }
        }

        if (ids.isEmpty()) {
            return DecodeOutcome.rejected(new SteamApiException.FriendsFailure("Empty friends list"));
        }
        return DecodeOutcome.decoded(List.copyOf(ids));
    }

    static DecodeOutcome<Void> logon(JsonNode json, Session session) {
        String status = json.text(F_ERROR);
        if (!STATUS_OK.equals(status)) {
            return DecodeOutcome.rejected(new SteamApiException.LogonFailure(status));
        }

        number(json, F_MESSAGE).ifPresent(session::advanceLastMessageId);

        String steamId = json.text(F_STEAMID);
        if (steamId != null && !steamId.equals(session.steamId())) {
            session.steamId(steamId);
        }
        String umqid = json.text(F_UMQID);
        if (umqid != null && !umqid.equals(session.umqid())) {
            log.debug("Server assigned session queue id {}", umqid);
            session.umqid(umqid);
        }
        return DecodeOutcome.decoded(null);
    }

    static DecodeOutcome<Void> relogon(JsonNode json, Session session) {
        String status = json.text(F_ERROR);
        if (STATUS_OK.equals(status)) {
            return DecodeOutcome.decoded(null);
        }
        return DecodeOutcome.rejected(new SteamApiException.RelogonFailure(status));
    }

    static DecodeOutcome<Void> logoff(JsonNode json, Session session) {
        String status = json.text(F_ERROR);
        if (STATUS_OK.equals(status)) {
            return DecodeOutcome.decoded(null);
        }
        return DecodeOutcome.rejected(new SteamApiException.LogoffFailure(status));
    }

    static DecodeOutcome<Void> message(JsonNode json, Session session) {
        String status = json.text(F_ERROR);
        if (STATUS_OK.equals(status)) {
            return DecodeOutcome.decoded(null);
        }
        if (STATUS_NOT_LOGGED_ON.equalsIgnoreCase(status)) {
            return DecodeOutcome.sessionExpired(new SteamApiException.MessageFailure(status));
        }
        return DecodeOutcome.rejected(new SteamApiException.MessageFailure(status));
    }

    static DecodeOutcome<List<Message>> poll(JsonNode json, Session session) {
        number(json, F_MESSAGE_LAST).ifPresent(session::advanceLastMessageId);

        String status = json.text(F_ERROR);
        if (status != null && !STATUS_TIMEOUT.equalsIgnoreCase(status) && !STATUS_OK.equalsIgnoreCase(status)) {
            if (STATUS_NOT_LOGGED_ON.equalsIgnoreCase(status)) {
                return DecodeOutcome.sessionExpired(new SteamApiException.PollFailure(status));
            }
            return DecodeOutcome.rejected(new SteamApiException.PollFailure(status));
        }

        JsonNode messages = json.get(F_MESSAGES);
        if (messages == null || !messages.isArray()) {
            return DecodeOutcome.decoded(List.of());
        }

        String self = session.steamId();
        List<Message> decoded = new ArrayList<>(messages.size());
        for (Iterator<JsonNode> it = messages.elements(); it.hasNext(); ) {
            JsonNode entry = it.next();
            String from = entry.text(F_STEAMID_FROM);
            if (from == null || from.equals(self)) continue;

            Optional<MessageType> type = MessageType.fromWireName(entry.text(F_TYPE));
            if (type.isEmpty()) {
                log.debug("Skipping event of unknown type {}", entry.text(F_TYPE));
                continue;
            }

            Message message = pollEntry(from, type.get(), entry);
            if (message != null) {
                decoded.add(message);
            }
        }
        return DecodeOutcome.decoded(List.copyOf(decoded));
    }

    // Returns null when the entry lacks a field its type requires.
    private static Message pollEntry(String from, MessageType type, JsonNode entry) {
        switch (type) {
            case SAY_TEXT:
            case EMOTE: {
                String text = entry.text(F_TEXT);
                return text == null ? null : new Message(from, type, text, null, null);
            }
            case STATE: {
                String nick = entry.text(F_PERSONA_NAME);
                Optional<Long> state = number(entry, F_PERSONA_STATE);
                if (nick == null || state.isEmpty()) return null;
                return new Message(from, type, null, nick, state.get().intValue());
            }
            case RELATIONSHIP: {
                Optional<Long> state = number(entry, F_PERSONA_STATE);
                return state.map(s -> new Message(from, type, null, null, s.intValue())).orElse(null);
            }
            case TYPING:
            case LEFT_CONVERSATION:
                return new Message(from, type, null, null, null);
            default:
                return null;
        }
    }

    static DecodeOutcome<List<Summary>> summaries(JsonNode json, Session session) {
        List<Summary> summaries = new ArrayList<>();
        JsonNode players = json.get(F_PLAYERS);

        if (players != null && players.isArray()) {
            for (Iterator<JsonNode> it = players.elements(); it.hasNext(); ) {
                JsonNode player = it.next();
                String steamId = player.text(F_STEAMID);
                if (steamId == null) continue;

                summaries.add(new Summary(
                        steamId,
                        player.text(F_GAME_EXTRA_INFO),
                        player.text(F_GAME_SERVER_IP),
                        player.text(F_PERSONANAME),
                        player.text(F_PROFILE_URL),
                        player.text(F_REAL_NAME),
                        number(player, F_PERSONASTATE).map(Long::intValue).orElse(0)));
            }
        }

        if (summaries.isEmpty()) {
            return DecodeOutcome.rejected(new SteamApiException.SummariesFailure("No friends returned"));
        }
        return DecodeOutcome.decoded(List.copyOf(summaries));
    }

    private static Optional<Long> number(JsonNode node, String fieldName) {
        JsonNode child = node.get(fieldName);
        if (child == null || !child.isNumber()) {
            return Optional.empty();
        }
        return Optional.of(child.asLong(0));
    }
}
