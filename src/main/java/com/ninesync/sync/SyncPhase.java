package com.ninesync.sync;

/**
 * Sync phases in the order they are reached. A tracker never moves backwards.
 */
public enum SyncPhase {
    INITIALIZING,
    CHECKING_FOLDERS,
    FETCHING_HEADERS,
    FETCHING_BODIES,
    PROCESSING_CHANGES,
    COMPLETE,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
