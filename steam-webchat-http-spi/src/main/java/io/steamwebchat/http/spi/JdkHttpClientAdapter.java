package io.steamwebchat.http.spi;

import io.steamwebchat.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 *
 * <p>Requests are sent with {@code sendAsync}; every completion is handed to one dispatch thread,
 * so handlers run one at a time and in the order responses arrive. The queued lane keeps at most
 * one request on the wire and moves on only after that request's handler has returned.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpClientAdapter.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    // The JDK client manages these itself and rejects them on a request builder.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final ExecutorService dispatcher;
    private final AtomicLong ids = new AtomicLong();

    private final Object lock = new Object();
    private final Deque<PendingRequest> lane = new ArrayDeque<>();
    private PendingRequest laneActive;
    private boolean paused;
    private volatile boolean closed;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "steam-webchat-dispatch");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public RequestHandle submit(Supplier<HttpClientRequest> builder, ResponseHandler handler) {
        Objects.requireNonNull(builder, "builder");
        Objects.requireNonNull(handler, "handler");
        if (closed) {
            throw new IllegalStateException("adapter is closed");
        }

        PendingRequest pending = new PendingRequest(ids.incrementAndGet(), builder, handler);
        HttpClientRequest request = pending.rebuild();
        if (request.hasFlag(RequestFlag.QUEUED)) {
            pending.queued = true;
            synchronized (lock) {
                lane.addLast(pending);
            }
            pump();
        } else {
            send(pending, request);
        }
        return pending;
    }

    @Override
    public void resend(RequestHandle handle) {
        if (!(handle instanceof PendingRequest pending)) {
            throw new IllegalArgumentException("handle was not issued by this adapter");
        }
        log.debug("Resending request {}", pending.id);
        if (pending.queued) {
            synchronized (lock) {
                lane.addFirst(pending);
            }
            pump();
        } else {
            send(pending, pending.rebuild());
        }
    }

    @Override
    public void setQueuePaused(boolean paused) {
        boolean changed;
        synchronized (lock) {
            changed = this.paused != paused;
            this.paused = paused;
        }
        if (!changed) {
            return;
        }
        log.debug("Queued lane {}", paused ? "paused" : "resumed");
        if (!paused) {
            pump();
        }
    }

    @Override
    public boolean isQueuePaused() {
        synchronized (lock) {
            return paused;
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (lock) {
            lane.clear();
            laneActive = null;
        }
        dispatcher.shutdownNow();
    }

    private void pump() {
        PendingRequest next;
        synchronized (lock) {
            if (closed || paused || laneActive != null || lane.isEmpty()) {
                return;
            }
            next = lane.pollFirst();
            laneActive = next;
        }
        send(next, next.rebuild());
    }

    private void send(PendingRequest pending, HttpClientRequest request) {
        if (closed) {
            log.debug("Dropping request {}: adapter is closed", pending.id);
            return;
        }

        HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (IllegalArgumentException e) {
            HttpClientException error = new HttpClientException("Invalid request: " + e.getMessage(), e);
            dispatcher.execute(() -> complete(pending, null, error));
            return;
        }

        log.debug("Sending request {}: {} {}", pending.id, request.method(), request.path());
        httpClient.sendAsync(jdkRequest, HttpResponse.BodyHandlers.ofByteArray())
                .whenCompleteAsync((response, error) -> complete(pending, response, error), dispatcher);
    }

    private void complete(PendingRequest pending, HttpResponse<byte[]> response, Throwable error) {
        try {
            if (error != null) {
                pending.handler.onFailure(pending, translate(error));
            } else {
                pending.handler.onResponse(pending, new ByteArrayResponse(response));
            }
        } catch (RuntimeException e) {
            log.error("Response handler for request {} failed", pending.id, e);
        } finally {
            if (pending.queued) {
                synchronized (lock) {
                    if (laneActive == pending) {
                        laneActive = null;
                    }
                }
                pump();
            }
        }
    }

    private static HttpClientException translate(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpClientException e) {
            return e;
        }
        if (cause instanceof java.net.http.HttpTimeoutException) {
            return new HttpTimeoutException(cause.getMessage(), cause);
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new HttpClientException(message, cause);
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        byte[] body = request.body();
        HttpRequest.BodyPublisher bodyPublisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);

        builder.method(request.method(), bodyPublisher);
        if (body != null) {
            builder.header(Protocol.H_CONTENT_TYPE, Protocol.CT_FORM_URLENCODED);
        }

        request.headers().forEach((name, value) -> {
            if (name != null && value != null && !RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                builder.header(name, value);
            }
        });

        builder.timeout(request.timeout() != null ? request.timeout() : DEFAULT_TIMEOUT);
        return builder.build();
    }

    private static final class PendingRequest implements RequestHandle {
        private final long id;
        private final Supplier<HttpClientRequest> builder;
        private final ResponseHandler handler;
        private volatile boolean queued;
        private volatile HttpClientRequest lastRequest;

        PendingRequest(long id, Supplier<HttpClientRequest> builder, ResponseHandler handler) {
            this.id = id;
            this.builder = builder;
            this.handler = handler;
        }

        HttpClientRequest rebuild() {
            HttpClientRequest request = Objects.requireNonNull(builder.get(), "builder returned null");
            lastRequest = request;
            return request;
        }

        @Override
        public long id() {
            return id;
        }

        @Override
        public HttpClientRequest request() {
            return lastRequest;
        }
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final HttpResponse<byte[]> response;

        ByteArrayResponse(HttpResponse<byte[]> response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public byte[] body() {
            return response.body() == null ? new byte[0] : response.body();
        }
    }
}
