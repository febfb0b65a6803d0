package io.steamwebchat.client;

import io.steamwebchat.core.PersonaState;

import java.util.Objects;

/**
 * Profile summary of a user.
 *
 * @param steamId the user's id
 * @param game name of the game being played, if any
 * @param serverAddress address of the game server, if any
 * @param nick display name
 * @param profileUrl community profile URL
 * @param fullName real name, if public
 * @param state numeric persona state
 */
public record Summary(String steamId, String game, String serverAddress, String nick,
                      String profileUrl, String fullName, int state) {
    public Summary {
        Objects.requireNonNull(steamId, "steamId");
    }

    public PersonaState personaState() {
        return PersonaState.fromCode(state);
    }
}
