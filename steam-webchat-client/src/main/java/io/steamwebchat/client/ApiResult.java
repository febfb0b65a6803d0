package io.steamwebchat.client;

import io.steamwebchat.core.SteamApiException;

import java.util.Objects;

/**
 * Outcome of one client operation: either a value or the error that prevented it.
 *
 * <p>Operations without a payload (logon, logoff, send) succeed with a {@code null} value.
 */
public sealed interface ApiResult<T> permits ApiResult.Success, ApiResult.Failure {

    /**
     * The operation succeeded.
     *
     * @param value the decoded payload, {@code null} for operations without one
     */
    record Success<T>(T value) implements ApiResult<T> {}

    /**
     * The operation failed; no payload is available.
     *
     * @param error the error, its message prefixed with the operation name
     */
    record Failure<T>(SteamApiException error) implements ApiResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> ApiResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ApiResult<T> failure(SteamApiException error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Returns the payload or throws the error.
     *
     * @throws SteamApiException if this is a failure
     */
    default T getOrThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw ((Failure<T>) this).error();
    }
}
