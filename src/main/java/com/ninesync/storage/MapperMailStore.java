package com.ninesync.storage;

import com.ninesync.domain.FolderSyncState;
import com.ninesync.domain.StoredMessage;
import com.ninesync.mapper.FolderSyncStateMapper;
import com.ninesync.mapper.StoredMessageMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * MyBatis backed mail store (SQLite with an FTS5 index)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MapperMailStore implements MailStore {

    private final StoredMessageMapper messageMapper;
    private final FolderSyncStateMapper syncStateMapper;

    @Override
    @Transactional
    public StoredMessage storeMessage(StoredMessage message) {
        return call("store message " + message.getUid(), () -> {
            LocalDateTime now = LocalDateTime.now();
            if (message.getCreatedAt() == null) {
                message.setCreatedAt(now);
            }
            message.setUpdatedAt(now);
            messageMapper.upsert(message);

            StoredMessage stored = messageMapper.findByUid(message.getAccountId(), message.getFolderName(),
                    message.getUid());
            message.setId(stored.getId());
            messageMapper.deleteIndex(stored.getId());
            messageMapper.insertIndex(message);
            return message;
        });
    }

    @Override
    public StoredMessage getMessageByUid(String accountId, String folderName, long uid) {
        return call("load message " + uid, () -> messageMapper.findByUid(accountId, folderName, uid));
    }

    @Override
    @Transactional
    public int deleteMessagesByUids(String accountId, String folderName, Collection<Long> uids) {
        if (uids == null || uids.isEmpty()) {
            return 0;
        }
        return call("delete messages", () -> {
            messageMapper.deleteIndexByUids(accountId, folderName, uids);
            int deleted = messageMapper.deleteByUids(accountId, folderName, uids);
            log.debug("[{}] Deleted {} local message(s) from {}", accountId, deleted, folderName);
            return deleted;
        });
    }

    @Override
    public void updateFolderSyncState(FolderSyncState state) {
        call("update sync state", () -> {
            syncStateMapper.upsert(state);
            return null;
        });
    }

    @Override
    public FolderSyncState getFolderSyncState(String accountId, String folderName) {
        return call("load sync state", () -> syncStateMapper.find(accountId, folderName));
    }

    @Override
    public List<Long> listMessageUids(String accountId, String folderName) {
        return call("list uids", () -> messageMapper.findUids(accountId, folderName));
    }

    @Override
    public List<StoredMessage> listRecentMessages(String accountId, String folderName, int limit) {
        return call("list recent messages", () -> messageMapper.findRecent(accountId, folderName, limit));
    }

    @Override
    public long countUnread(String accountId, String folderName) {
        return call("count unread", () -> messageMapper.countUnread(accountId, folderName));
    }

    @Override
    public List<StoredMessage> searchMessages(String accountId, String query, List<String> folders, int limit) {
        String match = toMatchExpression(query);
        if (match.isEmpty()) {
            return List.of();
        }
        return call("search", () -> messageMapper.search(accountId, match, folders, limit));
    }

    @Override
    @Transactional
    public int reindexFolder(String accountId, String folderName) {
        return call("reindex " + folderName, () -> {
            messageMapper.deleteIndexByFolder(accountId, folderName);
            int indexed = messageMapper.insertIndexByFolder(accountId, folderName);
            log.info("[{}] Reindexed {} message(s) in {}", accountId, indexed, folderName);
            return indexed;
        });
    }

    /**
     * Each word becomes a quoted FTS5 phrase, so user input never breaks the MATCH syntax
     */
    static String toMatchExpression(String query) {
        if (query == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String word : query.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append('"').append(word.replace("\"", "\"\"")).append('"');
        }
        return sb.toString();
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new MailStoreException("Mail store failed to " + operation, e);
        }
    }
}
