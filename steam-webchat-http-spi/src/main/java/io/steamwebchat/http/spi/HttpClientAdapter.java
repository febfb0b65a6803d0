package io.steamwebchat.http.spi;

import java.util.function.Supplier;

/**
 * Asynchronous transport used by the Steam web chat client.
 *
 * <p>Requests are submitted as builders rather than frozen requests: the adapter invokes the
 * builder each time the request actually goes on the wire, so a {@link #resend resent} request
 * picks up whatever state the builder reads at that moment (for example a refreshed token).
 *
 * <p>Requests flagged {@link RequestFlag#QUEUED} form the queued lane. The lane sends one request
 * at a time in submission order and can be paused; other requests are sent immediately.
 *
 * <p>Implementations deliver completions one at a time, so handlers never run concurrently.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * adapter.submit(() -> HttpClientRequest.builder("api.steampowered.com", 443, "/path")
 *         .flag(RequestFlag.SSL)
 *         .build(), handler);
 * }</pre>
 */
public interface HttpClientAdapter extends AutoCloseable {

    /**
     * Submits a request and returns immediately.
     *
     * @param builder builds the request; invoked once per send attempt
     * @param handler receives the outcome of every send attempt
     * @return the handle identifying the request
     */
    RequestHandle submit(Supplier<HttpClientRequest> builder, ResponseHandler handler);

    /**
     * Sends a previously submitted request again, rebuilding it first. A queued request re-enters
     * the lane at its head.
     *
     * @param handle a handle returned by {@link #submit}
     */
    void resend(RequestHandle handle);

    /**
     * Pauses or resumes the queued lane. Requests already on the wire are not affected. Pausing a
     * paused lane or resuming a running one does nothing.
     */
    void setQueuePaused(boolean paused);

    boolean isQueuePaused();

    /**
     * Releases the adapter's resources. Pending requests are abandoned.
     */
    @Override
    void close();
}
