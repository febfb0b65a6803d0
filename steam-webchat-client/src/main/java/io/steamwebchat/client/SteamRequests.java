package io.steamwebchat.client;

import io.steamwebchat.core.MessageType;
import io.steamwebchat.http.spi.HttpClientRequest;
import io.steamwebchat.http.spi.RequestFlag;

import static io.steamwebchat.core.Protocol.AUTH_SCOPE;
import static io.steamwebchat.core.Protocol.FORMAT_JSON;
import static io.steamwebchat.core.Protocol.GRANT_TYPE_PASSWORD;
import static io.steamwebchat.core.Protocol.H_CONNECTION;
import static io.steamwebchat.core.Protocol.H_USER_AGENT;
import static io.steamwebchat.core.Protocol.KEEP_ALIVE;
import static io.steamwebchat.core.Protocol.PATH_AUTH;
import static io.steamwebchat.core.Protocol.PATH_FRIENDS;
import static io.steamwebchat.core.Protocol.PATH_LOGOFF;
import static io.steamwebchat.core.Protocol.PATH_LOGON;
import static io.steamwebchat.core.Protocol.PATH_MESSAGE;
import static io.steamwebchat.core.Protocol.PATH_POLL;
import static io.steamwebchat.core.Protocol.PATH_SUMMARIES;
import static io.steamwebchat.core.Protocol.P_ACCESS_TOKEN;
import static io.steamwebchat.core.Protocol.P_CLIENT_ID;
import static io.steamwebchat.core.Protocol.P_EMAIL_AUTH_CODE;
import static io.steamwebchat.core.Protocol.P_FORMAT;
import static io.steamwebchat.core.Protocol.P_GRANT_TYPE;
import static io.steamwebchat.core.Protocol.P_MESSAGE;
import static io.steamwebchat.core.Protocol.P_PASSWORD;
import static io.steamwebchat.core.Protocol.P_RELATIONSHIP;
import static io.steamwebchat.core.Protocol.P_SCOPE;
import static io.steamwebchat.core.Protocol.P_SECTIMEOUT;
import static io.steamwebchat.core.Protocol.P_STEAMID;
import static io.steamwebchat.core.Protocol.P_STEAMIDS;
import static io.steamwebchat.core.Protocol.P_STEAMID_DST;
import static io.steamwebchat.core.Protocol.P_TEXT;
import static io.steamwebchat.core.Protocol.P_TYPE;
import static io.steamwebchat.core.Protocol.P_UMQID;
import static io.steamwebchat.core.Protocol.P_USERNAME;
import static io.steamwebchat.core.Protocol.P_WEB_COOKIE;
import static io.steamwebchat.core.Protocol.RELATIONSHIP_FRIEND;

/**
 * Builds the HTTP request of each operation from the configuration and the current session.
 *
 * <p>Every method reads the session when called, so the client hands these out as builders and
 * a resent request carries whatever token and queue id the session holds at resend time.
 */
final class SteamRequests {

    private final SteamApiConfig config;
    private final Session session;

    SteamRequests(SteamApiConfig config, Session session) {
        this.config = config;
        this.session = session;
    }

    HttpClientRequest auth(String code, String user, String pass) {
        return base(PATH_AUTH, config.authUserAgent())
                .flag(RequestFlag.POST)
                .param(P_CLIENT_ID, config.clientId())
                .param(P_GRANT_TYPE, GRANT_TYPE_PASSWORD)
                .param(P_USERNAME, user)
                .param(P_PASSWORD, pass)
                .param(P_EMAIL_AUTH_CODE, code)
                .param(P_WEB_COOKIE, "")
                .param(P_SCOPE, AUTH_SCOPE)
                .build();
    }

    HttpClientRequest friends() {
        return authorized(PATH_FRIENDS)
                .param(P_STEAMID, session.steamId())
                .param(P_RELATIONSHIP, RELATIONSHIP_FRIEND)
                .build();
    }

    /** Also used for relogon, which is a logon reusing the current token and queue id. */
    HttpClientRequest logon() {
        return authorized(PATH_LOGON)
                .flag(RequestFlag.POST)
                .param(P_UMQID, session.umqid())
                .build();
    }

    HttpClientRequest logoff() {
        return authorized(PATH_LOGOFF)
                .flag(RequestFlag.POST)
                .param(P_UMQID, session.umqid())
                .build();
    }

    HttpClientRequest message(Message message) {
        HttpClientRequest.Builder b = authorized(PATH_MESSAGE)
                .flag(RequestFlag.POST)
                .flag(RequestFlag.QUEUED)
                .param(P_UMQID, session.umqid())
                .param(P_STEAMID_DST, message.steamId())
                .param(P_TYPE, message.type().wireName());
        if (message.type() == MessageType.SAY_TEXT || message.type() == MessageType.EMOTE) {
            b.param(P_TEXT, message.text());
        }
        return b.build();
    }

    HttpClientRequest poll() {
        return authorized(PATH_POLL)
                .flag(RequestFlag.POST)
                .header(H_CONNECTION, KEEP_ALIVE)
                .param(P_UMQID, session.umqid())
                .param(P_MESSAGE, Long.toString(session.lastMessageId()))
                .param(P_SECTIMEOUT, Long.toString(config.pollTimeout().getSeconds()))
                .timeout(config.pollTimeout().plus(SteamApiConfig.POLL_GRACE))
                .build();
    }

    HttpClientRequest summaries(String joinedIds) {
        return authorized(PATH_SUMMARIES)
                .param(P_STEAMIDS, joinedIds)
                .build();
    }

    private HttpClientRequest.Builder authorized(String path) {
        return base(path, config.userAgent())
                .param(P_ACCESS_TOKEN, session.token());
    }

    private HttpClientRequest.Builder base(String path, String userAgent) {
        return HttpClientRequest.builder(config.host(), config.port(), path)
                .flag(RequestFlag.SSL)
                .header(H_USER_AGENT, userAgent)
                .param(P_FORMAT, FORMAT_JSON);
    }
}
