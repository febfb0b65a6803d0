package io.steamwebchat.client;

/**
 * Receives the result of an asynchronous client operation.
 *
 * <p>Invoked on the transport's completion thread, or on the calling thread when an operation
 * completes without sending anything.
 */
@FunctionalInterface
public interface ResultHandler<T> {
    void handle(ApiResult<T> result);
}
