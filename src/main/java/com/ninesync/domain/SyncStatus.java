package com.ninesync.domain;

/**
 * Outcome of the most recent sync attempt of a folder
 */
public enum SyncStatus {
    IDLE,
    SYNCING,
    ERROR,
    COMPLETE
}
