package io.steamwebchat.core;

/**
 * Presence states reported for a user.
 *
 * <p>Lookups fall back to {@link #OFFLINE} for codes and names the protocol does not define.
 */
public enum PersonaState {
    OFFLINE(0, "Offline"),
    ONLINE(1, "Online"),
    BUSY(2, "Busy"),
    AWAY(3, "Away"),
    SNOOZE(4, "Snooze");

    private final int code;
    private final String displayName;

    PersonaState(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public static PersonaState fromCode(int code) {
        for (PersonaState state : values()) {
            if (state.code == code) return state;
        }
        return OFFLINE;
    }

    public static PersonaState fromDisplayName(String name) {
        if (name == null) return OFFLINE;
        for (PersonaState state : values()) {
            if (state.displayName.equalsIgnoreCase(name)) return state;
        }
        return OFFLINE;
    }
}
