package io.steamwebchat.client;

import java.util.List;

/**
 * Asynchronous client for the Steam web chat API.
 *
 * <p>Every operation returns as soon as its request is submitted; the handler later receives
 * exactly one {@link ApiResult}. Errors are delivered, not thrown. A message send or poll that
 * finds the session expired is recovered with a relogon and resent transparently.
 *
 * <pre>{@code
 * SteamApiClient client = SteamApiClient.create();
 * client.authenticate(null, "user", "secret", auth -> {
 *     if (auth.isSuccess()) client.logon(logon -> client.poll(messages -> { ... }));
 * });
 * }</pre>
 */
public interface SteamApiClient extends AutoCloseable {

    /**
     * Exchanges credentials for an access token.
     *
     * @param code the Steam Guard code mailed to the user, or null when not yet requested
     */
    void authenticate(String code, String user, String pass, ResultHandler<Void> handler);

    /**
     * Opens the chat session. Updates the session's id, queue id and message cursor.
     */
    void logon(ResultHandler<Void> handler);

    void logoff(ResultHandler<Void> handler);

    /**
     * Long-polls for events after the session's message cursor. Own messages are not returned.
     */
    void poll(ResultHandler<List<Message>> handler);

    /**
     * Sends a saytext, emote or typing event. Sends are delivered to the server one at a time in
     * call order.
     */
    void sendMessage(Message message, ResultHandler<Void> handler);

    /**
     * Fetches the ids of the user's friends, in server order.
     */
    void fetchFriends(ResultHandler<List<String>> handler);

    /**
     * Fetches profile summaries. Large id lists are split into several requests and the handler
     * is invoked once per request. A null or empty list completes immediately with an empty list.
     */
    void fetchSummaries(List<String> ids, ResultHandler<List<Summary>> handler);

    void fetchSummary(String id, ResultHandler<List<Summary>> handler);

    /**
     * The client's session. Only the client modifies it.
     */
    Session session();

    /**
     * Closes the underlying transport; pending requests are abandoned.
     */
    @Override
    void close();

    static SteamApiClient create() {
        return builder().build();
    }

    static SteamApiClient create(java.net.http.HttpClient httpClient) {
        return builder().jdkHttpClient(httpClient).build();
    }

    static SteamApiClientBuilder builder() {
        return new SteamApiClientBuilder();
    }
}
