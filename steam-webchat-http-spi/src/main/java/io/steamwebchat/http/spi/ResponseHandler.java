package io.steamwebchat.http.spi;

/**
 * Completion callback for a submitted request. Exactly one method is invoked per send attempt.
 */
public interface ResponseHandler {

    /**
     * Invoked when the server answered, whatever the status code.
     */
    void onResponse(RequestHandle handle, HttpClientResponse response);

    /**
     * Invoked when no response could be obtained.
     */
    void onFailure(RequestHandle handle, HttpClientException error);
}
