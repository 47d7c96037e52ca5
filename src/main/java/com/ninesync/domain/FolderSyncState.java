package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Durable per account+folder checkpoint.
 * Read before every sync to pick the strategy, rewritten after every attempt.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FolderSyncState {

    private String accountId;
    private String folderName;
    private long uidValidity;
    private long uidNext;
    private Long highestModSeq;     // Only with CONDSTORE
    private LocalDateTime lastSync;
    private long messageCount;
    private long unreadCount;
    @Builder.Default
    private SyncStatus status = SyncStatus.IDLE;
    private String errorMessage;    // Set when status is ERROR
}
