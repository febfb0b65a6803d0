package io.steamwebchat.http.spi;

/**
 * Transport options of an {@link HttpClientRequest}.
 */
public enum RequestFlag {
    /** Send the parameters as a form body instead of a query string. */
    POST,
    /** Use TLS. */
    SSL,
    /** Serialize through the adapter's queued lane, which can be paused. */
    QUEUED
}
