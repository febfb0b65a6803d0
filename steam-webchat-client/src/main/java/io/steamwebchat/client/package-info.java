/**
 * Asynchronous client for the Steam web chat session API.
 *
 * <p>Start with {@link io.steamwebchat.client.SteamApiClient#builder()}. Results are delivered to
 * {@link io.steamwebchat.client.ResultHandler}s as {@link io.steamwebchat.client.ApiResult}s.
 */
package io.steamwebchat.client;
