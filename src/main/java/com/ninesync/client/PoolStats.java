package com.ninesync.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of the client pool
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStats {

    private int activeConnections;
    private int maxConnections;
    @Builder.Default
    private List<Entry> entries = new ArrayList<>();

    @Data
    @AllArgsConstructor
    public static class Entry {
        private String accountId;
        private String state;
        private String selectedFolder;
    }
}
