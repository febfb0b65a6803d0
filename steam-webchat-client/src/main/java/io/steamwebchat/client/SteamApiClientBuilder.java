package io.steamwebchat.client;

import io.steamwebchat.http.spi.HttpClientAdapter;
import io.steamwebchat.http.spi.JdkHttpClientAdapter;
import io.steamwebchat.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ThreadLocalRandom;

public final class SteamApiClientBuilder {
    private HttpClientAdapter transport;
    private JsonCodec jsonCodec;
    private SteamApiConfig config = SteamApiConfig.defaults();
    private String umqid;
    private String token;

    public SteamApiClientBuilder transport(HttpClientAdapter transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public SteamApiClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    /**
     * Sets the JSON codec. Defaults to the first {@link JsonCodec} found on the class path.
     */
    public SteamApiClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    public SteamApiClientBuilder config(SteamApiConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    /**
     * Sets the session queue id. Defaults to a random unsigned 32-bit number.
     */
    public SteamApiClientBuilder umqid(String umqid) {
        this.umqid = Objects.requireNonNull(umqid, "umqid");
        return this;
    }

    /**
     * Starts from a previously obtained access token, so {@code authenticate} can be skipped.
     */
    public SteamApiClientBuilder token(String token) {
        this.token = token;
        return this;
    }

    public SteamApiClient build() {
        HttpClientAdapter resolvedTransport = transport;
        if (resolvedTransport == null) {
            resolvedTransport = JdkHttpClientAdapter.create();
        }
        JsonCodec resolvedCodec = jsonCodec != null ? jsonCodec : loadCodec();
        String resolvedUmqid = umqid != null ? umqid : randomUmqid();
        Session session = new Session(resolvedUmqid, token, null);
        return new DefaultSteamApiClient(resolvedTransport, resolvedCodec, config, session);
    }

    static String randomUmqid() {
        return Integer.toUnsignedString(ThreadLocalRandom.current().nextInt());
    }

    private static JsonCodec loadCodec() {
        Iterator<JsonCodec> codecs = ServiceLoader.load(JsonCodec.class).iterator();
        if (!codecs.hasNext()) {
            throw new IllegalStateException("No JsonCodec found; add steam-webchat-json-jackson or call jsonCodec(...)");
        }
        return codecs.next();
    }
}
