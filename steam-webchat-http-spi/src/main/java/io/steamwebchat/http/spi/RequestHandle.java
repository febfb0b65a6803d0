package io.steamwebchat.http.spi;

/**
 * Opaque reference to a request submitted to an {@link HttpClientAdapter}.
 * Passed back to the {@link ResponseHandler} and accepted by {@link HttpClientAdapter#resend}.
 */
public interface RequestHandle {

    /**
     * Adapter-assigned id, unique per adapter instance.
     */
    long id();

    /**
     * The request as it was last built for sending.
     */
    HttpClientRequest request();
}
