package com.ninesync.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable progress snapshot of one folder sync
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncProgress {

    private String accountId;
    private String folderName;
    private SyncPhase phase;
    private long messagesProcessed;
    private long totalMessages;
    private Instant startedAt;
    private Instant updatedAt;
    private Instant estimatedCompletion;    // null until at least one message is processed
    private String errorMessage;
}
