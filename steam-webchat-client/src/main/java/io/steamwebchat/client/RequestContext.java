package io.steamwebchat.client;

import io.steamwebchat.core.ApiOperation;
import io.steamwebchat.core.SteamApiException;
import io.steamwebchat.http.spi.HttpClientException;
import io.steamwebchat.http.spi.HttpClientResponse;
import io.steamwebchat.http.spi.RequestHandle;
import io.steamwebchat.http.spi.ResponseHandler;
import io.steamwebchat.json.spi.JsonCodec;
import io.steamwebchat.json.spi.JsonException;
import io.steamwebchat.json.spi.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request state attached to the transport's pending request.
 *
 * <p>Turns each transport completion into an {@link ApiResult} and delivers it exactly once. A
 * session-expired response is not delivered; the request is handed to the
 * {@link RelogonCoordinator} instead, up to {@code maxRecoveries} times.
 */
final class RequestContext<T> implements ResponseHandler {

    private static final Logger log = LoggerFactory.getLogger(RequestContext.class);

    private final ApiOperation operation;
    private final ResponseDecoder<T> decoder;
    private final ResultHandler<T> handler;
    private final Session session;
    private final JsonCodec codec;
    private final RelogonCoordinator coordinator;
    private final int maxRecoveries;
    private final AtomicBoolean delivered = new AtomicBoolean();
    private int recoveries;

    RequestContext(ApiOperation operation,
                   ResponseDecoder<T> decoder,
                   ResultHandler<T> handler,
                   Session session,
                   JsonCodec codec,
                   RelogonCoordinator coordinator,
                   int maxRecoveries) {
        this.operation = operation;
        this.decoder = decoder;
        this.handler = handler;
        this.session = session;
        this.codec = codec;
        this.coordinator = coordinator;
        this.maxRecoveries = maxRecoveries;
    }

    @Override
    public void onResponse(RequestHandle handle, HttpClientResponse response) {
        JsonNode json;
        try {
            json = codec.readTree(response.body());
        } catch (JsonException e) {
            if (response.isSuccessful()) {
                deliver(ApiResult.failure(new SteamApiException.ParseFailure(operation, e.getMessage(), e)));
            } else {
                deliver(ApiResult.failure(new SteamApiException.TransportFailure(
                        operation, "Unexpected HTTP status " + response.statusCode(), e)));
            }
            return;
        }

        DecodeOutcome<T> outcome = decoder.decode(json, session);
        if (outcome instanceof DecodeOutcome.Decoded<T> decoded) {
            deliver(ApiResult.success(decoded.value()));
        } else if (outcome instanceof DecodeOutcome.Rejected<T> rejected) {
            deliver(ApiResult.failure(rejected.error()));
        } else if (outcome instanceof DecodeOutcome.SessionExpired<T> expired) {
            if (coordinator == null || recoveries >= maxRecoveries) {
                log.warn("{} request {} still not logged on after {} relogon attempts",
                        operation.displayName(), handle.id(), recoveries);
                deliver(ApiResult.failure(expired.error()));
                return;
            }
            recoveries++;
            log.debug("{} request {} hit an expired session, parking it for resend",
                    operation.displayName(), handle.id());
            coordinator.sessionExpired(handle);
        }
    }

    @Override
    public void onFailure(RequestHandle handle, HttpClientException error) {
        deliver(ApiResult.failure(new SteamApiException.TransportFailure(operation, error)));
    }

    void deliver(ApiResult<T> result) {
        if (!delivered.compareAndSet(false, true)) {
            log.warn("Dropping second result for a {} request", operation.displayName());
            return;
        }
        if (result instanceof ApiResult.Failure<T> failure) {
            log.debug("{} failed: {}", operation.displayName(), failure.error().detail());
        }
        handler.handle(result);
    }
}
