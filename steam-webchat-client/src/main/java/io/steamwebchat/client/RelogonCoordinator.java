package io.steamwebchat.client;

import io.steamwebchat.core.ApiOperation;
import io.steamwebchat.core.SteamApiException;
import io.steamwebchat.http.spi.HttpClientAdapter;
import io.steamwebchat.http.spi.RequestHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Recovers requests whose session expired on the server.
 *
 * <p>The first expired request pauses the queued lane and starts one relogon. Requests that
 * expire while it is in flight are only parked. When the relogon completes, whatever its
 * outcome, the parked requests are resent (rebuilt from the current session) and the lane is
 * resumed.
 */
final class RelogonCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RelogonCoordinator.class);

    enum State {
        NORMAL,
        RELOGON_IN_FLIGHT,
        RESUMING
    }

    private final HttpClientAdapter transport;
    private final Consumer<ResultHandler<Void>> relogon;
    private final List<RequestHandle> parked = new ArrayList<>();
    private State state = State.NORMAL;

    /**
     * @param transport the transport whose queued lane is paused during relogon
     * @param relogon submits a relogon request delivering its result to the given handler
     */
    RelogonCoordinator(HttpClientAdapter transport, Consumer<ResultHandler<Void>> relogon) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.relogon = Objects.requireNonNull(relogon, "relogon");
    }

    synchronized State state() {
        return state;
    }

    void sessionExpired(RequestHandle handle) {
        synchronized (this) {
            parked.add(handle);
            if (state == State.RELOGON_IN_FLIGHT) {
                log.debug("Relogon already in flight, request {} parked", handle.id());
                return;
            }
            state = State.RELOGON_IN_FLIGHT;
            transport.setQueuePaused(true);
        }

        log.info("Session expired, logging on again");
        try {
            relogon.accept(this::relogonCompleted);
        } catch (RuntimeException e) {
            relogonCompleted(ApiResult.failure(new SteamApiException.TransportFailure(ApiOperation.RELOGON, e)));
        }
    }

    void relogonCompleted(ApiResult<Void> result) {
        List<RequestHandle> resend;
        synchronized (this) {
            state = State.RESUMING;
            resend = new ArrayList<>(parked);
            parked.clear();
        }

        if (result instanceof ApiResult.Failure<Void> failure) {
            log.warn("Relogon failed, resending {} request(s) anyway: {}", resend.size(), failure.error().getMessage());
        } else {
            log.info("Relogon succeeded, resending {} request(s)", resend.size());
        }

        // Queued requests re-enter the paused lane at its head, ahead of anything queued meanwhile.
        for (RequestHandle handle : resend) {
            transport.resend(handle);
        }

        synchronized (this) {
            if (state != State.RESUMING) {
                // A resent request expired again and started another relogon, which owns the lane now.
                return;
            }
            transport.setQueuePaused(false);
            state = State.NORMAL;
        }
    }
}
