package io.steamwebchat.http.spi;

import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 */
public interface HttpClientResponse {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body.
     * @return the body bytes, never null
     */
    byte[] body();

    default boolean isSuccessful() {
        return statusCode() >= 200 && statusCode() < 300;
    }
}
