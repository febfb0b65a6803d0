package io.steamwebchat.core;

/**
 * The kinds of request the session client issues.
 *
 * <p>The display name prefixes every error reported for the operation.
 */
public enum ApiOperation {
    AUTH("Authentication"),
    FRIENDS("Friends"),
    LOGON("Logon"),
    RELOGON("Relogon"),
    LOGOFF("Logoff"),
    MESSAGE("Message"),
    POLL("Polling"),
    SUMMARIES("Summaries");

    private final String displayName;

    ApiOperation(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
