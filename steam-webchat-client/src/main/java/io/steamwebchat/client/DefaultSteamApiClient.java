package io.steamwebchat.client;

import io.steamwebchat.core.ApiOperation;
import io.steamwebchat.core.MessageType;
import io.steamwebchat.core.SteamApiException;
import io.steamwebchat.http.spi.HttpClientAdapter;
import io.steamwebchat.http.spi.HttpClientRequest;
import io.steamwebchat.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

final class DefaultSteamApiClient implements SteamApiClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultSteamApiClient.class);

    private final HttpClientAdapter transport;
    private final JsonCodec codec;
    private final SteamApiConfig config;
    private final Session session;
    private final SteamRequests requests;
    private final RelogonCoordinator coordinator;

    DefaultSteamApiClient(HttpClientAdapter transport, JsonCodec codec, SteamApiConfig config, Session session) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
        this.session = Objects.requireNonNull(session, "session");
        this.requests = new SteamRequests(config, session);
        this.coordinator = new RelogonCoordinator(transport,
                handler -> submit(ApiOperation.RELOGON, requests::logon, ResponseDecoders::relogon, handler));
    }

    RelogonCoordinator coordinator() {
        return coordinator;
    }

    @Override
    public void authenticate(String code, String user, String pass, ResultHandler<Void> handler) {
        submit(ApiOperation.AUTH, () -> requests.auth(code, user, pass), ResponseDecoders::auth, handler);
    }

    @Override
    public void logon(ResultHandler<Void> handler) {
        submit(ApiOperation.LOGON, requests::logon, ResponseDecoders::logon, handler);
    }

    @Override
    public void logoff(ResultHandler<Void> handler) {
        submit(ApiOperation.LOGOFF, requests::logoff, ResponseDecoders::logoff, handler);
    }

    @Override
    public void poll(ResultHandler<List<Message>> handler) {
        submit(ApiOperation.POLL, requests::poll, ResponseDecoders::poll, handler);
    }

    @Override
    public void sendMessage(Message message, ResultHandler<Void> handler) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(handler, "handler");

        MessageType type = message.type();
        if (type != MessageType.SAY_TEXT && type != MessageType.EMOTE && type != MessageType.TYPING) {
            handler.handle(ApiResult.failure(
                    new SteamApiException.MessageFailure("Unsupported message type: " + type.wireName())));
            return;
        }
        if (type != MessageType.TYPING && message.text() == null) {
            handler.handle(ApiResult.failure(
                    new SteamApiException.MessageFailure("Missing text for " + type.wireName() + " message")));
            return;
        }
        submit(ApiOperation.MESSAGE, () -> requests.message(message), ResponseDecoders::message, handler);
    }

    @Override
    public void fetchFriends(ResultHandler<List<String>> handler) {
        submit(ApiOperation.FRIENDS, requests::friends, ResponseDecoders::friends, handler);
    }

    @Override
    public void fetchSummaries(List<String> ids, ResultHandler<List<Summary>> handler) {
        Objects.requireNonNull(handler, "handler");
        List<String> batches = SummaryBatcher.batches(ids, config.summariesBatchSize());
        if (batches.isEmpty()) {
            handler.handle(ApiResult.success(List.of()));
            return;
        }
        log.debug("Fetching summaries for {} id(s) in {} request(s)", ids.size(), batches.size());
        for (String batch : batches) {
            submit(ApiOperation.SUMMARIES, () -> requests.summaries(batch), ResponseDecoders::summaries, handler);
        }
    }

    @Override
    public void fetchSummary(String id, ResultHandler<List<Summary>> handler) {
        Objects.requireNonNull(id, "id");
        submit(ApiOperation.SUMMARIES, () -> requests.summaries(id), ResponseDecoders::summaries, handler);
    }

    @Override
    public Session session() {
        return session;
    }

    @Override
    public void close() {
        transport.close();
    }

    private <T> void submit(ApiOperation operation,
                            Supplier<HttpClientRequest> builder,
                            ResponseDecoder<T> decoder,
                            ResultHandler<T> handler) {
        Objects.requireNonNull(handler, "handler");
        RequestContext<T> context = new RequestContext<>(
                operation, decoder, handler, session, codec, coordinator, config.maxRelogonAttempts());
        log.debug("Submitting {} request", operation.displayName());
        transport.submit(builder, context);
    }
}
