package com.ninesync.idle;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Push notification received while idling. Transient, never persisted.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class IdleNotification {

    public enum Type {
        /** * n EXISTS */
        NEW_MESSAGE_COUNT,
        /** * n RECENT */
        RECENT_COUNT,
        /** * n EXPUNGE */
        EXPUNGE,
        /** * n FETCH (... UID u ...) */
        FETCH_UPDATE,
        CONNECTION_LOST,
        TIMEOUT
    }

    private final Type type;
    private final long count;       // EXISTS / RECENT
    private final long sequence;    // EXPUNGE / FETCH
    private final Long uid;         // FETCH, when the server included it
    private final String reason;    // CONNECTION_LOST

    public static IdleNotification newMessageCount(long count) {
        return new IdleNotification(Type.NEW_MESSAGE_COUNT, count, 0, null, null);
    }

    public static IdleNotification recentCount(long count) {
        return new IdleNotification(Type.RECENT_COUNT, count, 0, null, null);
    }

    public static IdleNotification expunge(long sequence) {
        return new IdleNotification(Type.EXPUNGE, 0, sequence, null, null);
    }

    public static IdleNotification fetchUpdate(long sequence, Long uid) {
        return new IdleNotification(Type.FETCH_UPDATE, 0, sequence, uid, null);
    }

    public static IdleNotification connectionLost(String reason) {
        return new IdleNotification(Type.CONNECTION_LOST, 0, 0, null, reason);
    }

    public static IdleNotification timeout() {
        return new IdleNotification(Type.TIMEOUT, 0, 0, null, null);
    }

    /**
     * Notifications after which the monitor restarts itself
     */
    public boolean requiresRestart() {
        return type == Type.CONNECTION_LOST || type == Type.TIMEOUT;
    }

    /**
     * Notifications that mean the folder content changed on the server
     */
    public boolean isMailboxChange() {
        return type == Type.NEW_MESSAGE_COUNT || type == Type.EXPUNGE || type == Type.FETCH_UPDATE;
    }
}
