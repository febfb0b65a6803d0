package io.steamwebchat.core;

/**
 * Steam web chat protocol constants (endpoint paths, parameter names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings. It only models protocol-level
 * concerns shared by request builders and response decoders.
 */
public final class Protocol {
    private Protocol() {}

    public static final String DEFAULT_HOST = "api.steampowered.com";
    public static final int DEFAULT_PORT = 443;

    public static final String DEFAULT_USER_AGENT = "Steam 1291812 / iPhone";
    public static final String DEFAULT_AUTH_USER_AGENT = "Steam App / Android / 1.0 / 1297579";
    public static final String DEFAULT_CLIENT_ID = "DE45CD61";
    public static final String FORMAT_JSON = "json";

    /** Server-side long-poll timeout, in seconds. */
    public static final int DEFAULT_POLL_TIMEOUT_SECONDS = 30;

    /** Largest number of ids the summaries endpoint accepts per request. */
    public static final int SUMMARIES_BATCH_SIZE = 100;

    // Endpoint paths
    public static final String PATH_AUTH = "/ISteamOAuth2/GetTokenWithCredentials/v0001";
    public static final String PATH_FRIENDS = "/ISteamUserOAuth/GetFriendList/v0001";
    public static final String PATH_LOGON = "/ISteamWebUserPresenceOAuth/Logon/v0001";
    public static final String PATH_LOGOFF = "/ISteamWebUserPresenceOAuth/Logoff/v0001";
    public static final String PATH_MESSAGE = "/ISteamWebUserPresenceOAuth/Message/v0001";
    public static final String PATH_POLL = "/ISteamWebUserPresenceOAuth/Poll/v0001";
    public static final String PATH_SUMMARIES = "/ISteamUserOAuth/GetUserSummaries/v0001";

    // Request parameters
    public static final String P_FORMAT = "format";
    public static final String P_ACCESS_TOKEN = "access_token";
    public static final String P_UMQID = "umqid";
    public static final String P_STEAMID = "steamid";
    public static final String P_STEAMIDS = "steamids";
    public static final String P_STEAMID_DST = "steamid_dst";
    public static final String P_TYPE = "type";
    public static final String P_TEXT = "text";
    public static final String P_MESSAGE = "message";
    public static final String P_SECTIMEOUT = "sectimeout";
    public static final String P_RELATIONSHIP = "relationship";
    public static final String P_CLIENT_ID = "client_id";
    public static final String P_GRANT_TYPE = "grant_type";
    public static final String P_USERNAME = "username";
    public static final String P_PASSWORD = "password";
    public static final String P_EMAIL_AUTH_CODE = "x_emailauthcode";
    public static final String P_WEB_COOKIE = "x_webcookie";
    public static final String P_SCOPE = "scope";

    public static final String GRANT_TYPE_PASSWORD = "password";
    public static final String AUTH_SCOPE = "read_profile write_profile read_client write_client";
    public static final String RELATIONSHIP_FRIEND = "friend";

    // Response fields
    public static final String F_ERROR = "error";
    public static final String F_ACCESS_TOKEN = "access_token";
    public static final String F_ERROR_CODE = "x_errorcode";
    public static final String F_ERROR_DESCRIPTION = "error_description";
    public static final String F_FRIENDS = "friends";
    public static final String F_RELATIONSHIP = "relationship";
    public static final String F_STEAMID = "steamid";
    public static final String F_UMQID = "umqid";
    public static final String F_MESSAGE = "message";
    public static final String F_MESSAGE_LAST = "messagelast";
    public static final String F_MESSAGES = "messages";
    public static final String F_STEAMID_FROM = "steamid_from";
    public static final String F_TYPE = "type";
    public static final String F_TEXT = "text";
    public static final String F_PERSONA_NAME = "persona_name";
    public static final String F_PERSONA_STATE = "persona_state";
    public static final String F_PLAYERS = "players";
    public static final String F_GAME_EXTRA_INFO = "gameextrainfo";
    public static final String F_GAME_SERVER_IP = "gameserverip";
    public static final String F_PERSONANAME = "personaname";
    public static final String F_PROFILE_URL = "profileurl";
    public static final String F_REAL_NAME = "realname";
    public static final String F_PERSONASTATE = "personastate";

    // Well-known values
    public static final String STATUS_OK = "OK";
    public static final String STATUS_TIMEOUT = "Timeout";
    public static final String STATUS_NOT_LOGGED_ON = "Not Logged On";
    public static final String ERROR_CODE_STEAMGUARD = "steamguard_code_required";

    // HTTP headers
    public static final String H_USER_AGENT = "User-Agent";
    public static final String H_CONNECTION = "Connection";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String KEEP_ALIVE = "Keep-Alive";

    public static final String CT_FORM_URLENCODED = "application/x-www-form-urlencoded";
}
