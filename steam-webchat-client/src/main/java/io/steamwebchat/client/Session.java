package io.steamwebchat.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The authenticated identity shared by every request of one client.
 *
 * <p>Only the response decoders write to it. Reads happen whenever a request is built, possibly
 * on a caller thread, hence the synchronized accessors.
 */
public final class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private String token;
    private String umqid;
    private String steamId;
    private long lastMessageId;

    Session(String umqid, String token, String steamId) {
        this.umqid = Objects.requireNonNull(umqid, "umqid");
        this.token = token;
        this.steamId = steamId;
    }

    /**
     * OAuth access token, null until authenticated.
     */
    public synchronized String token() {
        return token;
    }

    /**
     * Session queue id correlating the poll queue with this logon.
     */
    public synchronized String umqid() {
        return umqid;
    }

    /**
     * The local user's id, null until logged on.
     */
    public synchronized String steamId() {
        return steamId;
    }

    /**
     * Cursor of the last consumed message; the next poll starts after it.
     */
    public synchronized long lastMessageId() {
        return lastMessageId;
    }

    synchronized void token(String token) {
        this.token = token;
    }

    synchronized void umqid(String umqid) {
        this.umqid = Objects.requireNonNull(umqid, "umqid");
    }

    synchronized void steamId(String steamId) {
        this.steamId = steamId;
    }

    /**
     * Moves the cursor forward. The cursor never moves backwards.
     *
     * @return true if the cursor changed
     */
    synchronized boolean advanceLastMessageId(long messageId) {
        if (messageId <= lastMessageId) {
            if (messageId < lastMessageId) {
                log.debug("Ignoring message cursor {} behind {}", messageId, lastMessageId);
            }
            return false;
        }
        lastMessageId = messageId;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "Session[steamId=" + steamId + ", umqid=" + umqid + ", lastMessageId=" + lastMessageId
                + ", authenticated=" + (token != null) + "]";
    }
}
