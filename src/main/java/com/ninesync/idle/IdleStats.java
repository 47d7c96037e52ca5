package com.ninesync.idle;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdleStats {

    private boolean active;
    private String monitoredFolder;
    private int callbackCount;
    private int restarts;
    private Instant lastHeartbeat;
}
