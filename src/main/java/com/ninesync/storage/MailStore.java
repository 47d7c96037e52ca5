package com.ninesync.storage;

import com.ninesync.domain.FolderSyncState;
import com.ninesync.domain.StoredMessage;

import java.util.Collection;
import java.util.List;

/**
 * Local message and checkpoint storage used by the sync engine.
 * Implementations throw {@link MailStoreException} on storage failures.
 */
public interface MailStore {

    /**
     * Insert or replace the message identified by account, folder and UID
     */
    StoredMessage storeMessage(StoredMessage message);

    /**
     * @return the stored copy, or null
     */
    StoredMessage getMessageByUid(String accountId, String folderName, long uid);

    int deleteMessagesByUids(String accountId, String folderName, Collection<Long> uids);

    void updateFolderSyncState(FolderSyncState state);

    /**
     * @return the checkpoint, or null before the first sync
     */
    FolderSyncState getFolderSyncState(String accountId, String folderName);

    List<Long> listMessageUids(String accountId, String folderName);

    /**
     * Most recently received messages of the folder, newest first
     */
    List<StoredMessage> listRecentMessages(String accountId, String folderName, int limit);

    /**
     * Messages of the folder without the {@code \Seen} flag
     */
    long countUnread(String accountId, String folderName);

    /**
     * Full-text search over subject, sender and body
     *
     * @param folders restrict to these folders; empty means all folders
     */
    List<StoredMessage> searchMessages(String accountId, String query, List<String> folders, int limit);

    /**
     * Rebuild the full-text index of one folder
     *
     * @return number of messages indexed
     */
    int reindexFolder(String accountId, String folderName);
}
