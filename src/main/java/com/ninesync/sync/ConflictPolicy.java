package com.ninesync.sync;

/**
 * Rule applied when an incremental sync fetches a message that already exists locally
 */
public enum ConflictPolicy {
    /** Overwrite the local copy */
    SERVER_WINS,
    /** Keep the local copy, discard the server version */
    LOCAL_WINS,
    /** Union of both flag sets, local version counter bumped */
    MERGE,
    /** Needs a user decision; without an interactive front end the server version is applied */
    ASK_USER
}
