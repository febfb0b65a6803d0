package io.steamwebchat.client;

import io.steamwebchat.core.SteamApiException;
import io.steamwebchat.http.spi.HttpClientRequest;
import io.steamwebchat.http.spi.RequestFlag;
import io.steamwebchat.http.spi.HttpClientException;
import io.steamwebchat.http.spi.HttpClientResponse;
import io.steamwebchat.http.spi.RequestHandle;
import io.steamwebchat.http.spi.ResponseHandler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RelogonCoordinatorTest {

    private final FakeTransport transport = new FakeTransport();
    private final List<ResultHandler<Void>> relogons = new ArrayList<>();
    private final RelogonCoordinator coordinator = new RelogonCoordinator(transport, relogons::add);

    private RequestHandle queuedRequest() {
        return transport.submit(() -> HttpClientRequest.builder("localhost", 443, "/message")
                .flag(RequestFlag.POST)
                .flag(RequestFlag.QUEUED)
                .build(), new IgnoringHandler());
    }

    @Test
    void walksThroughStates() {
        RequestHandle handle = queuedRequest();
        assertThat(coordinator.state()).isEqualTo(RelogonCoordinator.State.NORMAL);

        coordinator.sessionExpired(handle);
        assertThat(coordinator.state()).isEqualTo(RelogonCoordinator.State.RELOGON_IN_FLIGHT);
        assertThat(transport.isQueuePaused()).isTrue();
        assertThat(relogons).hasSize(1);

        relogons.get(0).handle(ApiResult.success(null));
        assertThat(coordinator.state()).isEqualTo(RelogonCoordinator.State.NORMAL);
        assertThat(transport.isQueuePaused()).isFalse();
        assertThat(transport.resends).containsExactly(handle.id());
    }

    @Test
    void secondExpiryWhileInFlightOnlyParks() {
        RequestHandle first = queuedRequest();
        RequestHandle second = queuedRequest();

        coordinator.sessionExpired(first);
        coordinator.sessionExpired(second);

        assertThat(relogons).hasSize(1);
        assertThat(transport.pauseCalls).containsExactly(true);

        relogons.get(0).handle(ApiResult.failure(new SteamApiException.RelogonFailure("Bad")));
        assertThat(transport.resends).containsExactly(first.id(), second.id());
        assertThat(transport.pauseCalls).containsExactly(true, false);
    }

    @Test
    void relogonThatCannotBeSubmittedStillResumes() {
        RelogonCoordinator failing = new RelogonCoordinator(transport, handler -> {
            throw new IllegalStateException("adapter is closed");
        });
        RequestHandle handle = queuedRequest();

        failing.sessionExpired(handle);

        assertThat(failing.state()).isEqualTo(RelogonCoordinator.State.NORMAL);
        assertThat(transport.isQueuePaused()).isFalse();
        assertThat(transport.resends).containsExactly(handle.id());
    }

    private static final class IgnoringHandler implements ResponseHandler {
        @Override
        public void onResponse(RequestHandle handle, HttpClientResponse response) {
        }

        @Override
        public void onFailure(RequestHandle handle, HttpClientException error) {
        }
    }
}
