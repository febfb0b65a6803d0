package io.steamwebchat.http.spi;

import io.steamwebchat.core.FormBody;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Represents an HTTP request to be sent by an {@link HttpClientAdapter}.
 * This is an immutable value type with a fluent builder API.
 *
 * <p>Parameters are form fields: they travel in a {@code application/x-www-form-urlencoded}
 * body when the request carries {@link RequestFlag#POST}, and in the query string otherwise.
 */
public final class HttpClientRequest {

    private final String host;
    private final int port;
    private final String path;
    private final Map<String, String> headers;
    private final Map<String, String> params;
    private final Set<RequestFlag> flags;
    private final Duration timeout;

    private HttpClientRequest(Builder b) {
        this.host = Objects.requireNonNull(b.host, "host");
        this.path = Objects.requireNonNull(b.path, "path");
        this.port = b.port;
        this.headers = b.headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.params = b.params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
        this.flags = b.flags.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(b.flags));
        this.timeout = b.timeout;
    }

    public String host() { return host; }
    public int port() { return port; }
    public String path() { return path; }
    public Map<String, String> headers() { return headers; }
    public Map<String, String> params() { return params; }
    public Set<RequestFlag> flags() { return flags; }
    public Duration timeout() { return timeout; }

    public boolean hasFlag(RequestFlag flag) {
        return flags.contains(flag);
    }

    public String method() {
        return hasFlag(RequestFlag.POST) ? "POST" : "GET";
    }

    /**
     * Returns the target URI; for GET requests the parameters are appended as the query string.
     */
    public URI uri() {
        String scheme = hasFlag(RequestFlag.SSL) ? "https" : "http";
        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        boolean defaultPort = (hasFlag(RequestFlag.SSL) && port == 443) || (!hasFlag(RequestFlag.SSL) && port == 80);
        if (!defaultPort) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (!hasFlag(RequestFlag.POST) && !params.isEmpty()) {
            sb.append('?').append(FormBody.encode(params));
        }
        return URI.create(sb.toString());
    }

    /**
     * Returns the encoded form body for POST requests, or null for GET requests.
     */
    public byte[] body() {
        return hasFlag(RequestFlag.POST) ? FormBody.encodeBytes(params) : null;
    }

    public static Builder builder(String host, int port, String path) {
        return new Builder(host, port, path);
    }

    public static final class Builder {
        private final String host;
        private final int port;
        private final String path;
        private Map<String, String> headers;
        private Map<String, String> params;
        private final EnumSet<RequestFlag> flags = EnumSet.noneOf(RequestFlag.class);
        private Duration timeout;

        private Builder(String host, int port, String path) {
            this.host = host;
            this.port = port;
            this.path = path;
        }

        public Builder header(String name, String value) {
            if (headers == null) headers = new LinkedHashMap<>();
            headers.put(name, value);
            return this;
        }

        public Builder param(String name, String value) {
            if (params == null) params = new LinkedHashMap<>();
            params.put(name, value);
            return this;
        }

        public Builder flag(RequestFlag flag) {
            flags.add(Objects.requireNonNull(flag, "flag"));
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
