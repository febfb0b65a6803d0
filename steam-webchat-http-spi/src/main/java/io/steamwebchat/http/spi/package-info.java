/**
 * Transport contract consumed by the Steam web chat client, and its JDK HttpClient binding.
 *
 * <p>The client never talks to an HTTP library directly. It submits request builders to an
 * {@link io.steamwebchat.http.spi.HttpClientAdapter} and receives completions through a
 * {@link io.steamwebchat.http.spi.ResponseHandler}.
 */
package io.steamwebchat.http.spi;
