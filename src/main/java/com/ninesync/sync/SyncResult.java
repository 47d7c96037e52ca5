package com.ninesync.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one folder sync
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private String accountId;
    private String folderName;
    private SyncStrategy requested;
    private SyncStrategy applied;       // FULL when the checkpoint was missing or UIDVALIDITY changed
    private int newMessages;
    private int updatedMessages;
    private int deletedMessages;
    private int conflicts;
    private int failedMessages;         // conversion failures, skipped
    private SyncProgress progress;      // final snapshot
}
