package com.ninesync.sync;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per folder outcomes of an account sync. Folders that failed are listed with their error.
 */
@Data
public class AccountSyncResult {

    private final String accountId;
    private final List<SyncResult> folders = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    public int getMessagesProcessed() {
        return folders.stream().mapToInt(r -> (int) r.getProgress().getMessagesProcessed()).sum();
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
