package com.ninesync.scheduler;

import com.ninesync.sync.SyncProgress;
import lombok.Getter;

import java.util.List;

/**
 * Typed payload of a completed task; one field is set per kind
 */
@Getter
public final class TaskResultData {

    public enum Kind {
        SYNC_PROGRESS,
        MESSAGE_COUNT,
        SEARCH_RESULTS,
        CACHE_STATS
    }

    private final Kind kind;
    private final SyncProgress syncProgress;
    private final long count;
    private final List<String> messageIds;

    private TaskResultData(Kind kind, SyncProgress syncProgress, long count, List<String> messageIds) {
        this.kind = kind;
        this.syncProgress = syncProgress;
        this.count = count;
        this.messageIds = messageIds;
    }

    public static TaskResultData syncProgress(SyncProgress progress) {
        return new TaskResultData(Kind.SYNC_PROGRESS, progress, progress.getMessagesProcessed(), List.of());
    }

    public static TaskResultData messageCount(long count) {
        return new TaskResultData(Kind.MESSAGE_COUNT, null, count, List.of());
    }

    public static TaskResultData searchResults(List<String> messageIds) {
        return new TaskResultData(Kind.SEARCH_RESULTS, null, messageIds.size(), List.copyOf(messageIds));
    }

    /**
     * @param cached number of items loaded
     */
    public static TaskResultData cacheStats(long cached) {
        return new TaskResultData(Kind.CACHE_STATS, null, cached, List.of());
    }

    @Override
    public String toString() {
        return kind + "(" + count + ")";
    }
}
