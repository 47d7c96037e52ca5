package com.ninesync.imap;

/**
 * Client connection state machine (4-state model)
 */
public enum ImapState {
    /** No socket */
    DISCONNECTED,
    /** Greeting received - before authentication */
    CONNECTED,
    /** Authenticated - before mailbox selection */
    AUTHENTICATED,
    /** A mailbox is selected - message operations allowed */
    SELECTED;

    public boolean isAuthenticated() {
        return this == AUTHENTICATED || this == SELECTED;
    }
}
