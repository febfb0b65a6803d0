package io.steamwebchat.core;

import java.util.Objects;

/**
 * Base class for errors reported by the Steam web chat client.
 *
 * <p>Every error belongs to one {@link ApiOperation} and its message is prefixed with the
 * operation's display name, e.g. {@code "Polling: Bad"}. The unprefixed text is available from
 * {@link #detail()}. Server-reported errors carry the server's own message as detail.
 */
public abstract class SteamApiException extends RuntimeException {

    private static final String UNKNOWN_ERROR = "Unknown error";

    private final ApiOperation operation;
    private final String detail;

    protected SteamApiException(ApiOperation operation, String detail) {
        this(operation, detail, null);
    }

    protected SteamApiException(ApiOperation operation, String detail, Throwable cause) {
        super(prefix(operation, detail), cause);
        this.operation = operation;
        this.detail = detail == null ? UNKNOWN_ERROR : detail;
    }

    public ApiOperation operation() {
        return operation;
    }

    public String detail() {
        return detail;
    }

    private static String prefix(ApiOperation operation, String detail) {
        Objects.requireNonNull(operation, "operation");
        return operation.displayName() + ": " + (detail == null ? UNKNOWN_ERROR : detail);
    }

    /**
     * Raised when the request never produced a usable response (network, TLS, timeout, or an
     * HTTP status without a JSON body). The transport's exception is kept as the cause.
     */
    public static class TransportFailure extends SteamApiException {
        public TransportFailure(ApiOperation operation, String detail, Throwable cause) {
            super(operation, detail, cause);
        }

        public TransportFailure(ApiOperation operation, Throwable cause) {
            super(operation, cause == null ? null : cause.getMessage(), cause);
        }
    }

    /**
     * Raised when a response body is not valid JSON.
     */
    public static class ParseFailure extends SteamApiException {
        public ParseFailure(ApiOperation operation, String detail, Throwable cause) {
            super(operation, "Parser: " + detail, cause);
        }
    }

    /**
     * Raised when the credentials are rejected.
     */
    public static class AuthFailure extends SteamApiException {
        public AuthFailure(String detail) {
            super(ApiOperation.AUTH, detail);
        }
    }

    /**
     * Raised when authentication needs the Steam Guard code that was mailed to the user.
     */
    public static class AuthCodeRequired extends AuthFailure {
        public AuthCodeRequired(String detail) {
            super(detail);
        }
    }

    public static class FriendsFailure extends SteamApiException {
        public FriendsFailure(String detail) {
            super(ApiOperation.FRIENDS, detail);
        }
    }

    public static class LogonFailure extends SteamApiException {
        public LogonFailure(String detail) {
            super(ApiOperation.LOGON, detail);
        }
    }

    public static class RelogonFailure extends SteamApiException {
        public RelogonFailure(String detail) {
            super(ApiOperation.RELOGON, detail);
        }
    }

    public static class LogoffFailure extends SteamApiException {
        public LogoffFailure(String detail) {
            super(ApiOperation.LOGOFF, detail);
        }
    }

    public static class MessageFailure extends SteamApiException {
        public MessageFailure(String detail) {
            super(ApiOperation.MESSAGE, detail);
        }
    }

    public static class PollFailure extends SteamApiException {
        public PollFailure(String detail) {
            super(ApiOperation.POLL, detail);
        }
    }

    public static class SummariesFailure extends SteamApiException {
        public SummariesFailure(String detail) {
            super(ApiOperation.SUMMARIES, detail);
        }
    }
}
