package io.steamwebchat.client;

import io.steamwebchat.core.Protocol;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Client configuration: endpoint, client identity, and protocol limits.
 *
 * <p>Immutable. Start from {@link #defaults()} or {@link #builder()}, or read the
 * {@code steam.api.*} keys of a {@link Properties} object with {@link #fromProperties(Properties)}.
 */
public final class SteamApiConfig {

    public static final String KEY_HOST = "steam.api.host";
    public static final String KEY_PORT = "steam.api.port";
    public static final String KEY_CLIENT_ID = "steam.api.client-id";
    public static final String KEY_USER_AGENT = "steam.api.user-agent";
    public static final String KEY_AUTH_USER_AGENT = "steam.api.auth-user-agent";
    public static final String KEY_POLL_TIMEOUT_SECONDS = "steam.api.poll-timeout-seconds";
    public static final String KEY_SUMMARIES_BATCH_SIZE = "steam.api.summaries-batch-size";
    public static final String KEY_MAX_RELOGON_ATTEMPTS = "steam.api.max-relogon-attempts";

    /** Extra time the transport waits for a poll beyond the server-side timeout. */
    static final Duration POLL_GRACE = Duration.ofSeconds(15);

    private static final SteamApiConfig DEFAULTS = builder().build();

    private final String host;
    private final int port;
    private final String clientId;
    private final String userAgent;
    private final String authUserAgent;
    private final Duration pollTimeout;
    private final int summariesBatchSize;
    private final int maxRelogonAttempts;

    private SteamApiConfig(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.clientId = b.clientId;
        this.userAgent = b.userAgent;
        this.authUserAgent = b.authUserAgent;
        this.pollTimeout = b.pollTimeout;
        this.summariesBatchSize = b.summariesBatchSize;
        this.maxRelogonAttempts = b.maxRelogonAttempts;
    }

    public static SteamApiConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads configuration from properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a numeric key holds an invalid value
     */
    public static SteamApiConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder b = builder();
        String host = properties.getProperty(KEY_HOST);
        if (host != null) b.host(host.trim());
        String port = properties.getProperty(KEY_PORT);
        if (port != null) b.port(parseInt(KEY_PORT, port));
        String clientId = properties.getProperty(KEY_CLIENT_ID);
        if (clientId != null) b.clientId(clientId.trim());
        String userAgent = properties.getProperty(KEY_USER_AGENT);
        if (userAgent != null) b.userAgent(userAgent);
        String authUserAgent = properties.getProperty(KEY_AUTH_USER_AGENT);
        if (authUserAgent != null) b.authUserAgent(authUserAgent);
        String pollTimeout = properties.getProperty(KEY_POLL_TIMEOUT_SECONDS);
        if (pollTimeout != null) b.pollTimeout(Duration.ofSeconds(parseInt(KEY_POLL_TIMEOUT_SECONDS, pollTimeout)));
        String batchSize = properties.getProperty(KEY_SUMMARIES_BATCH_SIZE);
        if (batchSize != null) b.summariesBatchSize(parseInt(KEY_SUMMARIES_BATCH_SIZE, batchSize));
        String attempts = properties.getProperty(KEY_MAX_RELOGON_ATTEMPTS);
        if (attempts != null) b.maxRelogonAttempts(parseInt(KEY_MAX_RELOGON_ATTEMPTS, attempts));
        return b.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String clientId() {
        return clientId;
    }

    public String userAgent() {
        return userAgent;
    }

    /**
     * User agent sent with authentication requests only.
     */
    public String authUserAgent() {
        return authUserAgent;
    }

    /**
     * Long-poll timeout requested from the server.
     */
    public Duration pollTimeout() {
        return pollTimeout;
    }

    /**
     * Largest number of ids sent in one summaries request.
     */
    public int summariesBatchSize() {
        return summariesBatchSize;
    }

    /**
     * How many times one request may be resent after a relogon before its error is delivered.
     */
    public int maxRelogonAttempts() {
        return maxRelogonAttempts;
    }

    public static final class Builder {
        private String host = Protocol.DEFAULT_HOST;
        private int port = Protocol.DEFAULT_PORT;
        private String clientId = Protocol.DEFAULT_CLIENT_ID;
        private String userAgent = Protocol.DEFAULT_USER_AGENT;
        private String authUserAgent = Protocol.DEFAULT_AUTH_USER_AGENT;
        private Duration pollTimeout = Duration.ofSeconds(Protocol.DEFAULT_POLL_TIMEOUT_SECONDS);
        private int summariesBatchSize = Protocol.SUMMARIES_BATCH_SIZE;
        private int maxRelogonAttempts = 3;

        private Builder() {}

        public Builder host(String host) {
            this.host = requireNonBlank(host, "host");
            return this;
        }

        public Builder port(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = requireNonBlank(clientId, "clientId");
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
            return this;
        }

        public Builder authUserAgent(String authUserAgent) {
            this.authUserAgent = Objects.requireNonNull(authUserAgent, "authUserAgent");
            return this;
        }

        public Builder pollTimeout(Duration pollTimeout) {
            Objects.requireNonNull(pollTimeout, "pollTimeout");
            if (pollTimeout.isNegative() || pollTimeout.isZero()) {
                throw new IllegalArgumentException("pollTimeout must be positive");
            }
            this.pollTimeout = pollTimeout;
            return this;
        }

        public Builder summariesBatchSize(int summariesBatchSize) {
            if (summariesBatchSize < 1) {
                throw new IllegalArgumentException("summariesBatchSize must be at least 1");
            }
            this.summariesBatchSize = summariesBatchSize;
            return this;
        }

        public Builder maxRelogonAttempts(int maxRelogonAttempts) {
            if (maxRelogonAttempts < 0) {
                throw new IllegalArgumentException("maxRelogonAttempts must not be negative");
            }
            this.maxRelogonAttempts = maxRelogonAttempts;
            return this;
        }

        public SteamApiConfig build() {
            return new SteamApiConfig(this);
        }

        private static String requireNonBlank(String value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value;
        }
    }
}
