package com.ninesync.support;

import com.ninesync.domain.FolderSyncState;
import com.ninesync.domain.StoredMessage;
import com.ninesync.domain.SyncStatus;
import com.ninesync.storage.MailStore;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Map backed {@link MailStore}. Also records how many syncs of one folder were
 * in the SYNCING state at the same time.
 */
public class InMemoryMailStore implements MailStore {

    private final Map<String, StoredMessage> messages = new ConcurrentHashMap<>();
    private final Map<String, FolderSyncState> states = new ConcurrentHashMap<>();
    private final List<FolderSyncState> stateHistory = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> syncing = new ConcurrentHashMap<>();
    private final AtomicInteger maxConcurrentSyncs = new AtomicInteger();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public StoredMessage storeMessage(StoredMessage message) {
        StoredMessage copy = message.toBuilder().build();
        if (copy.getId() == null) {
            copy.setId(ids.incrementAndGet());
        }
        if (copy.getCreatedAt() == null) {
            copy.setCreatedAt(LocalDateTime.now());
        }
        copy.setUpdatedAt(LocalDateTime.now());
        messages.put(key(copy.getAccountId(), copy.getFolderName(), copy.getUid()), copy);
        return copy;
    }

    @Override
    public StoredMessage getMessageByUid(String accountId, String folderName, long uid) {
        StoredMessage stored = messages.get(key(accountId, folderName, uid));
        return stored == null ? null : stored.toBuilder().build();
    }

    @Override
    public int deleteMessagesByUids(String accountId, String folderName, Collection<Long> uids) {
        int deleted = 0;
        for (Long uid : uids) {
            if (messages.remove(key(accountId, folderName, uid)) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public void updateFolderSyncState(FolderSyncState state) {
        String folderKey = state.getAccountId() + ":" + state.getFolderName();
        FolderSyncState before = states.put(folderKey, state.toBuilder().build());
        stateHistory.add(state.toBuilder().build());

        AtomicInteger active = syncing.computeIfAbsent(folderKey, k -> new AtomicInteger());
        if (state.getStatus() == SyncStatus.SYNCING) {
            maxConcurrentSyncs.accumulateAndGet(active.incrementAndGet(), Math::max);
        } else if (before != null && before.getStatus() == SyncStatus.SYNCING) {
            active.decrementAndGet();
        }
    }

    @Override
    public FolderSyncState getFolderSyncState(String accountId, String folderName) {
        FolderSyncState state = states.get(accountId + ":" + folderName);
        return state == null ? null : state.toBuilder().build();
    }

    @Override
    public List<Long> listMessageUids(String accountId, String folderName) {
        return inFolder(accountId, folderName).stream()
                .map(StoredMessage::getUid)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public List<StoredMessage> listRecentMessages(String accountId, String folderName, int limit) {
        return inFolder(accountId, folderName).stream()
                .sorted(Comparator.comparingLong(StoredMessage::getUid).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public long countUnread(String accountId, String folderName) {
        return inFolder(accountId, folderName).stream()
                .filter(m -> !m.getFlags().contains("\\Seen"))
                .count();
    }

    @Override
    public List<StoredMessage> searchMessages(String accountId, String query, List<String> folders, int limit) {
        String needle = query.toLowerCase(Locale.ROOT);
        return messages.values().stream()
                .filter(m -> m.getAccountId().equals(accountId))
                .filter(m -> folders.isEmpty() || folders.contains(m.getFolderName()))
                .filter(m -> contains(m.getSubject(), needle) || contains(m.getBodyText(), needle))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public int reindexFolder(String accountId, String folderName) {
        return inFolder(accountId, folderName).size();
    }

    public List<FolderSyncState> getStateHistory() {
        return new ArrayList<>(stateHistory);
    }

    public int getMaxConcurrentSyncs() {
        return maxConcurrentSyncs.get();
    }

    public int size() {
        return messages.size();
    }

    private List<StoredMessage> inFolder(String accountId, String folderName) {
        return messages.values().stream()
                .filter(m -> m.getAccountId().equals(accountId) && m.getFolderName().equals(folderName))
                .collect(Collectors.toList());
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String key(String accountId, String folderName, long uid) {
        return accountId + ":" + folderName + ":" + uid;
    }
}
