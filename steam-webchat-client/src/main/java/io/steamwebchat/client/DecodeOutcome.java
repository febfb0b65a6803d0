package io.steamwebchat.client;

import io.steamwebchat.core.SteamApiException;

import java.util.Objects;

/**
 * What a {@link ResponseDecoder} made of a well-formed response.
 */
sealed interface DecodeOutcome<T> permits DecodeOutcome.Decoded, DecodeOutcome.Rejected, DecodeOutcome.SessionExpired {

    /**
     * The response carried a result.
     */
    record Decoded<T>(T value) implements DecodeOutcome<T> {}

    /**
     * The server reported an error for this request.
     */
    record Rejected<T>(SteamApiException error) implements DecodeOutcome<T> {
        public Rejected {
            Objects.requireNonNull(error, "error");
        }
    }

    /**
     * The server no longer knows the session. The request should be resent after a relogon;
     * {@code error} is delivered only if recovery is given up.
     */
    record SessionExpired<T>(SteamApiException error) implements DecodeOutcome<T> {
        public SessionExpired {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> DecodeOutcome<T> decoded(T value) {
        return new Decoded<>(value);
    }

    static <T> DecodeOutcome<T> rejected(SteamApiException error) {
        return new Rejected<>(error);
    }

    static <T> DecodeOutcome<T> sessionExpired(SteamApiException error) {
        return new SessionExpired<>(error);
    }
}
