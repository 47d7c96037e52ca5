package com.ninesync.scheduler;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoSyncStats {

    private boolean active;
    private int monitoredAccounts;
    private Instant nextSyncTime;
    private Instant lastSyncTime;
    private long totalSyncsQueued;
    private long totalSyncsRejected;
}
