package com.ninesync.scheduler;

import com.ninesync.sync.SyncStrategy;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * What a background task does, with the parameters of that kind.
 * Instances are created through the static factories only.
 */
@Getter
public final class TaskType {

    public enum Kind {
        ACCOUNT_SYNC,
        FOLDER_SYNC,
        FOLDER_REFRESH,
        SEARCH,
        INDEXING,
        CACHE_WARM
    }

    private final Kind kind;
    private final String folderName;
    private final SyncStrategy strategy;
    private final String query;
    private final List<String> folders;
    private final int messageCount;

    private TaskType(Kind kind, String folderName, SyncStrategy strategy, String query, List<String> folders,
                     int messageCount) {
        this.kind = kind;
        this.folderName = folderName;
        this.strategy = strategy;
        this.query = query;
        this.folders = folders;
        this.messageCount = messageCount;
    }

    public static TaskType accountSync(SyncStrategy strategy) {
        return new TaskType(Kind.ACCOUNT_SYNC, null, Objects.requireNonNull(strategy), null, List.of(), 0);
    }

    public static TaskType folderSync(String folderName, SyncStrategy strategy) {
        return new TaskType(Kind.FOLDER_SYNC, requireFolder(folderName), Objects.requireNonNull(strategy),
                null, List.of(), 0);
    }

    public static TaskType folderRefresh(String folderName) {
        return new TaskType(Kind.FOLDER_REFRESH, requireFolder(folderName), null, null, List.of(), 0);
    }

    public static TaskType search(String query, List<String> folders) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query is required");
        }
        return new TaskType(Kind.SEARCH, null, null, query, folders == null ? List.of() : List.copyOf(folders), 0);
    }

    public static TaskType indexing(String folderName) {
        return new TaskType(Kind.INDEXING, requireFolder(folderName), null, null, List.of(), 0);
    }

    public static TaskType cacheWarm(String folderName, int messageCount) {
        if (messageCount <= 0) {
            throw new IllegalArgumentException("messageCount must be positive: " + messageCount);
        }
        return new TaskType(Kind.CACHE_WARM, requireFolder(folderName), null, null, List.of(), messageCount);
    }

    private static String requireFolder(String folderName) {
        if (folderName == null || folderName.isBlank()) {
            throw new IllegalArgumentException("Folder name is required");
        }
        return folderName;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ACCOUNT_SYNC -> "AccountSync(" + strategy + ")";
            case FOLDER_SYNC -> "FolderSync(" + folderName + ", " + strategy + ")";
            case FOLDER_REFRESH -> "FolderRefresh(" + folderName + ")";
            case SEARCH -> "Search(" + query + ")";
            case INDEXING -> "Indexing(" + folderName + ")";
            case CACHE_WARM -> "CacheWarm(" + folderName + ", " + messageCount + ")";
        };
    }
}
