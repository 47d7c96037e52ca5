package com.ninesync.idle;

import com.ninesync.imap.ImapException;

/**
 * Receives push notifications of one account, in registration order
 */
public interface IdleNotificationListener {

    void onNotification(String accountId, IdleNotification notification);

    /**
     * The automatic restart after a timeout or connection loss failed; monitoring has stopped
     */
    default void onRestartFailure(String accountId, ImapException error) {
    }
}
