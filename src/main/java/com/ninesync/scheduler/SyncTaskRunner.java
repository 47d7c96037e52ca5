package com.ninesync.scheduler;

import com.ninesync.domain.ImapFolder;
import com.ninesync.domain.StoredMessage;
import com.ninesync.imap.ImapException;
import com.ninesync.storage.MailStore;
import com.ninesync.sync.AccountSyncResult;
import com.ninesync.sync.SyncEngine;
import com.ninesync.sync.SyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs every task kind against the sync engine and the mail store
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncTaskRunner implements TaskRunner {

    static final int SEARCH_LIMIT = 100;

    private final SyncEngine syncEngine;
    private final MailStore mailStore;

    @Override
    public TaskResultData run(BackgroundTask task) throws ImapException {
        String accountId = task.getAccountId();
        TaskType type = task.getType();
        log.debug("[{}] Running {}", accountId, type);

        return switch (type.getKind()) {
            case ACCOUNT_SYNC -> {
                AccountSyncResult result = syncEngine.syncAccount(accountId, type.getStrategy());
                if (!result.isSuccessful()) {
                    log.warn("[{}] Account sync left {} folder(s) unsynced: {}", accountId,
                            result.getFailures().size(), result.getFailures().keySet());
                }
                yield TaskResultData.messageCount(result.getMessagesProcessed());
            }
            case FOLDER_SYNC -> {
                SyncResult result = syncEngine.syncFolder(accountId, type.getFolderName(), type.getStrategy());
                yield TaskResultData.syncProgress(result.getProgress());
            }
            case FOLDER_REFRESH -> {
                ImapFolder folder = syncEngine.refreshFolder(accountId, type.getFolderName());
                yield TaskResultData.messageCount(folder.getExists() == null ? 0 : folder.getExists());
            }
            case SEARCH -> {
                List<StoredMessage> hits = mailStore.searchMessages(accountId, type.getQuery(), type.getFolders(),
                        SEARCH_LIMIT);
                yield TaskResultData.searchResults(hits.stream()
                        .map(SyncTaskRunner::messageKey)
                        .collect(Collectors.toList()));
            }
            case INDEXING -> TaskResultData.messageCount(mailStore.reindexFolder(accountId, type.getFolderName()));
            case CACHE_WARM -> {
                // Touching the newest rows loads their pages before the first read
                List<StoredMessage> recent = mailStore.listRecentMessages(accountId, type.getFolderName(),
                        type.getMessageCount());
                yield TaskResultData.cacheStats(recent.size());
            }
        };
    }

    /**
     * Message-ID when known, otherwise folder/uid
     */
    static String messageKey(StoredMessage message) {
        if (message.getMessageId() != null) {
            return message.getMessageId();
        }
        return message.getFolderName() + "/" + message.getUid();
    }
}
