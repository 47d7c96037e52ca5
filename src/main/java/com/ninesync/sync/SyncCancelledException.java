package com.ninesync.sync;

/**
 * Thrown from a folder sync that was cancelled or interrupted between batches
 */
public class SyncCancelledException extends RuntimeException {

    public SyncCancelledException(String message) {
        super(message);
    }
}
