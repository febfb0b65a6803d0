package io.steamwebchat.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class JdkHttpClientAdapterTest {

    private MockWebServer server;
    private JdkHttpClientAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = JdkHttpClientAdapter.create();
    }

    @AfterEach
    void tearDown() throws Exception {
        adapter.close();
        server.shutdown();
    }

    @Test
    void postSendsFormBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"error\":\"OK\"}"));
        RecordingHandler handler = new RecordingHandler();

        adapter.submit(() -> request("/logon")
                .param("format", "json")
                .param("umqid", "42")
                .flag(RequestFlag.POST)
                .build(), handler);

        Outcome outcome = handler.next();
        assertThat(outcome.response.statusCode()).isEqualTo(200);
        assertThat(new String(outcome.response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"error\":\"OK\"}");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/logon");
        assertThat(recorded.getHeader("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("format=json&umqid=42");
    }

    @Test
    void getSendsQueryStringAndCustomHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
        RecordingHandler handler = new RecordingHandler();

        adapter.submit(() -> request("/friends")
                .param("steamid", "1")
                .header("User-Agent", "test-agent")
                .header("Connection", "Keep-Alive")
                .build(), handler);

        assertThat(handler.next().response).isNotNull();
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/friends?steamid=1");
        assertThat(recorded.getHeader("User-Agent")).isEqualTo("test-agent");
    }

    @Test
    void nonSuccessStatusIsDeliveredAsResponse() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"Not Logged On\"}"));
        RecordingHandler handler = new RecordingHandler();

        adapter.submit(() -> request("/poll").flag(RequestFlag.POST).build(), handler);

        Outcome outcome = handler.next();
        assertThat(outcome.response.statusCode()).isEqualTo(401);
        assertThat(outcome.response.isSuccessful()).isFalse();
    }

    @Test
    void pausedLaneHoldsQueuedRequestsUntilResumed() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"n\":1}"));
        server.enqueue(new MockResponse().setBody("{\"n\":2}"));
        RecordingHandler handler = new RecordingHandler();

        adapter.setQueuePaused(true);
        adapter.submit(() -> request("/message").param("n", "1").flag(RequestFlag.POST).flag(RequestFlag.QUEUED).build(), handler);
        adapter.submit(() -> request("/message").param("n", "2").flag(RequestFlag.POST).flag(RequestFlag.QUEUED).build(), handler);

        assertThat(server.takeRequest(300, TimeUnit.MILLISECONDS)).isNull();

        adapter.setQueuePaused(false);

        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8()).isEqualTo("n=1");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8()).isEqualTo("n=2");
        assertThat(handler.next().handle.request().params()).containsEntry("n", "1");
        assertThat(handler.next().handle.request().params()).containsEntry("n", "2");
    }

    @Test
    void pauseAndResumeAreIdempotent() {
        adapter.setQueuePaused(true);
        adapter.setQueuePaused(true);
        assertThat(adapter.isQueuePaused()).isTrue();

        adapter.setQueuePaused(false);
        adapter.setQueuePaused(false);
        assertThat(adapter.isQueuePaused()).isFalse();
    }

    @Test
    void resendRebuildsRequestFromCurrentState() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"error\":\"Not Logged On\"}"));
        server.enqueue(new MockResponse().setBody("{\"error\":\"OK\"}"));
        AtomicReference<String> token = new AtomicReference<>("old");
        BlockingQueue<String> bodies = new LinkedBlockingQueue<>();

        adapter.submit(() -> request("/message").param("access_token", token.get())
                .flag(RequestFlag.POST).flag(RequestFlag.QUEUED).build(), new ResponseHandler() {
            @Override
            public void onResponse(RequestHandle handle, HttpClientResponse response) {
                String body = new String(response.body(), StandardCharsets.UTF_8);
                bodies.add(body);
                if (body.contains("Not Logged On")) {
                    token.set("new");
                    adapter.resend(handle);
                }
            }

            @Override
            public void onFailure(RequestHandle handle, HttpClientException error) {
                bodies.add("failure");
            }
        });

        assertThat(bodies.poll(1, TimeUnit.SECONDS)).contains("Not Logged On");
        assertThat(bodies.poll(1, TimeUnit.SECONDS)).contains("OK");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8()).isEqualTo("access_token=old");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8()).isEqualTo("access_token=new");
    }

    @Test
    void connectionFailureIsDeliveredAsFailure() throws Exception {
        MockWebServer closed = new MockWebServer();
        closed.start();
        int port = closed.getPort();
        closed.shutdown();
        RecordingHandler handler = new RecordingHandler();

        adapter.submit(() -> HttpClientRequest.builder("localhost", port, "/poll").build(), handler);

        Outcome outcome = handler.next();
        assertThat(outcome.error).isNotNull();
        assertThat(outcome.response).isNull();
    }

    @Test
    void slowResponseIsDeliveredAsTimeout() throws Exception {
        server.enqueue(new MockResponse().setBody("{}").setHeadersDelay(2, TimeUnit.SECONDS));
        RecordingHandler handler = new RecordingHandler();

        adapter.submit(() -> request("/poll").timeout(Duration.ofMillis(200)).build(), handler);

        assertThat(handler.next().error).isInstanceOf(HttpTimeoutException.class);
    }

    @Test
    void throwingHandlerDoesNotStopDispatch() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));
        server.enqueue(new MockResponse().setBody("{}"));
        RecordingHandler handler = new RecordingHandler();

        adapter.submit(() -> request("/a").flag(RequestFlag.QUEUED).build(), new ResponseHandler() {
            @Override
            public void onResponse(RequestHandle handle, HttpClientResponse response) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onFailure(RequestHandle handle, HttpClientException error) {
                throw new IllegalStateException("boom");
            }
        });
        adapter.submit(() -> request("/b").flag(RequestFlag.QUEUED).build(), handler);

        assertThat(handler.next().response.statusCode()).isEqualTo(200);
    }

    private HttpClientRequest.Builder request(String path) {
        return HttpClientRequest.builder(server.getHostName(), server.getPort(), path);
    }

    private static final class Outcome {
        final RequestHandle handle;
        final HttpClientResponse response;
        final HttpClientException error;

        Outcome(RequestHandle handle, HttpClientResponse response, HttpClientException error) {
            this.handle = handle;
            this.response = response;
            this.error = error;
        }
    }

    private static final class RecordingHandler implements ResponseHandler {
        private final BlockingQueue<Outcome> outcomes = new LinkedBlockingQueue<>();

        @Override
        public void onResponse(RequestHandle handle, HttpClientResponse response) {
            outcomes.add(new Outcome(handle, response, null));
        }

        @Override
        public void onFailure(RequestHandle handle, HttpClientException error) {
            outcomes.add(new Outcome(handle, null, error));
        }

        Outcome next() throws InterruptedException {
            Outcome outcome = outcomes.poll(5, TimeUnit.SECONDS);
            assertThat(outcome).as("completion").isNotNull();
            return outcome;
        }
    }
}
