package io.steamwebchat.client;

import io.steamwebchat.http.spi.HttpClientAdapter;
import io.steamwebchat.http.spi.HttpClientException;
import io.steamwebchat.http.spi.HttpClientRequest;
import io.steamwebchat.http.spi.HttpClientResponse;
import io.steamwebchat.http.spi.RequestFlag;
import io.steamwebchat.http.spi.RequestHandle;
import io.steamwebchat.http.spi.ResponseHandler;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * In-memory transport. Records every request that would go on the wire and lets the test answer
 * them. Queued requests are held while the lane is paused.
 */
final class FakeTransport implements HttpClientAdapter {

    final List<Sent> sent = new ArrayList<>();
    final List<Boolean> pauseCalls = new ArrayList<>();
    final List<Long> resends = new ArrayList<>();
    private final Deque<Pending> held = new ArrayDeque<>();
    private long ids;
    private boolean paused;
    boolean closed;

    @Override
    public RequestHandle submit(Supplier<HttpClientRequest> builder, ResponseHandler handler) {
        Pending pending = new Pending(++ids, builder, handler);
        dispatch(pending, false);
        return pending;
    }

    @Override
    public void resend(RequestHandle handle) {
        Pending pending = (Pending) handle;
        resends.add(pending.id);
        dispatch(pending, true);
    }

    @Override
    public void setQueuePaused(boolean paused) {
        pauseCalls.add(paused);
        this.paused = paused;
        while (!paused && !held.isEmpty()) {
            send(held.pollFirst());
        }
    }

    @Override
    public boolean isQueuePaused() {
        return paused;
    }

    @Override
    public void close() {
        closed = true;
    }

    List<Pending> held() {
        return List.copyOf(held);
    }

    Sent last() {
        return sent.get(sent.size() - 1);
    }

    List<Sent> sentTo(String path) {
        List<Sent> matching = new ArrayList<>();
        for (Sent s : sent) {
            if (s.request.path().equals(path)) matching.add(s);
        }
        return matching;
    }

    private void dispatch(Pending pending, boolean atHead) {
        pending.lastRequest = pending.builder.get();
        if (pending.lastRequest.hasFlag(RequestFlag.QUEUED) && paused) {
            if (atHead) held.addFirst(pending);
            else held.addLast(pending);
            return;
        }
        send(pending);
    }

    private void send(Pending pending) {
        pending.lastRequest = pending.builder.get();
        sent.add(new Sent(pending, pending.lastRequest));
    }

    static final class Sent {
        final Pending pending;
        final HttpClientRequest request;

        Sent(Pending pending, HttpClientRequest request) {
            this.pending = pending;
            this.request = request;
        }

        void respond(String json) {
            respond(200, json);
        }

        void respond(int status, String body) {
            pending.handler.onResponse(pending, new Response(status, body.getBytes(StandardCharsets.UTF_8)));
        }

        void fail(HttpClientException error) {
            pending.handler.onFailure(pending, error);
        }

        String param(String name) {
            return request.params().get(name);
        }
    }

    static final class Pending implements RequestHandle {
        final long id;
        final Supplier<HttpClientRequest> builder;
        final ResponseHandler handler;
        HttpClientRequest lastRequest;

        Pending(long id, Supplier<HttpClientRequest> builder, ResponseHandler handler) {
            this.id = id;
            this.builder = builder;
            this.handler = handler;
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

    private record Response(int statusCode, byte[] body) implements HttpClientResponse {
        @Override
        public Optional<String> header(String name) {
            return Optional.empty();
        }
    }
}
