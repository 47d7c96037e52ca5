package com.ninesync.sync;

import com.ninesync.client.AccountManager;
import com.ninesync.client.ImapClient;
import com.ninesync.config.SyncProperties;
import com.ninesync.domain.Capability;
import com.ninesync.domain.FolderSyncState;
import com.ninesync.domain.ImapFolder;
import com.ninesync.domain.ImapMessage;
import com.ninesync.domain.SearchCriteria;
import com.ninesync.domain.StoredMessage;
import com.ninesync.domain.SyncStatus;
import com.ninesync.imap.ImapCommands;
import com.ninesync.imap.ImapException;
import com.ninesync.storage.MailStore;
import com.ninesync.storage.MailStoreException;
import com.ninesync.storage.MessageConverter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Synchronizes folders from the IMAP server into the {@link MailStore}.
 * <ul>
 *   <li>Syncs of the same account and folder are serialized by a per folder lock</li>
 *   <li>A missing checkpoint or a changed UIDVALIDITY forces a full sync</li>
 *   <li>The checkpoint is written after every attempt, including failed ones</li>
 * </ul>
 * The client lock is only held per command group (select + fetch of one batch),
 * never for a whole folder.
 */
@Slf4j
@Service
public class SyncEngine {

    static final String CANCELLED = "Cancelled by user";

    private final AccountManager accountManager;
    private final MailStore mailStore;
    private final MessageConverter converter;
    private final SyncProperties properties;
    private final Clock clock = Clock.systemUTC();
    private final Counter storedCounter;
    private final Counter failureCounter;

    private final Map<String, ReentrantLock> folderLocks = new ConcurrentHashMap<>();
    private final Map<String, ProgressTracker> activeTrackers = new ConcurrentHashMap<>();
    private final Map<String, SyncProgress> latestProgress = new ConcurrentHashMap<>();
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();
    private final Sinks.Many<SyncProgress> progressSink = Sinks.many().multicast().directBestEffort();

    public SyncEngine(AccountManager accountManager, MailStore mailStore, MessageConverter converter,
                      SyncProperties properties, MeterRegistry meterRegistry) {
        this.accountManager = accountManager;
        this.mailStore = mailStore;
        this.converter = converter;
        this.properties = properties;
        this.storedCounter = Counter.builder("ninesync.sync.messages.stored")
                .description("Messages written to the local store by folder syncs")
                .register(meterRegistry);
        this.failureCounter = Counter.builder("ninesync.sync.failures")
                .description("Folder syncs that ended in error")
                .register(meterRegistry);
    }

    /**
     * Sync every selectable folder of the account, priority folders first.
     * A folder failing on a protocol or server error is recorded and skipped;
     * connection and authentication errors abort the account.
     */
    public AccountSyncResult syncAccount(String accountId, SyncStrategy strategy) throws ImapException {
        ImapClient client = accountManager.getClient(accountId);
        List<String> folders = orderFolders(accountId, client.listFolders());
        log.info("[{}] Account sync ({}) of {} folder(s)", accountId, strategy, folders.size());

        AccountSyncResult result = new AccountSyncResult(accountId);
        for (String folder : folders) {
            try {
                result.getFolders().add(syncFolder(accountId, folder, strategy));
            } catch (ImapException e) {
                result.getFailures().put(folder, e.getMessage());
                if (e.getKind() == ImapException.ErrorKind.CONNECTION
                        || e.getKind() == ImapException.ErrorKind.AUTHENTICATION) {
                    throw e;
                }
            }
        }
        log.info("[{}] Account sync finished: {} folder(s) synced, {} failed", accountId,
                result.getFolders().size(), result.getFailures().size());
        return result;
    }

    /**
     * Sync one folder. Waits while another sync of the same folder is running.
     */
    public SyncResult syncFolder(String accountId, String folderName, SyncStrategy strategy) throws ImapException {
        String key = key(accountId, folderName);
        ReentrantLock lock = folderLocks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncCancelledException("Interrupted while waiting for the sync of " + key);
        }
        try {
            cancelRequests.remove(key);
            ProgressTracker tracker = new ProgressTracker(accountId, folderName, clock, this::publish);
            activeTrackers.put(key, tracker);
            FolderRun run = new FolderRun(accountId, folderName, strategy, tracker);
            try {
                return run.execute();
            } catch (ImapException | RuntimeException e) {
                run.fail(e);
                throw e;
            } finally {
                activeTrackers.remove(key, tracker);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Quick metadata refresh through STATUS; the folder is not selected and nothing is stored
     */
    public ImapFolder refreshFolder(String accountId, String folderName) throws ImapException {
        ImapClient client = accountManager.getClient(accountId);
        ImapFolder folder = client.status(folderName);
        log.debug("[{}] Refreshed {}: messages={}, unseen={}, uidNext={}", accountId, folderName,
                folder.getExists(), folder.getUnseen(), folder.getUidNext());
        return folder;
    }

    /**
     * Stream of progress snapshots of all folder syncs
     */
    public Flux<SyncProgress> progress() {
        return progressSink.asFlux();
    }

    /**
     * @return the last snapshot of the folder's most recent sync, or null
     */
    public SyncProgress getProgress(String accountId, String folderName) {
        return latestProgress.get(key(accountId, folderName));
    }

    /**
     * Mark a running sync as cancelled. It stops before its next batch.
     *
     * @return false when no sync of the folder is running
     */
    public boolean cancelSync(String accountId, String folderName) {
        String key = key(accountId, folderName);
        ProgressTracker tracker = activeTrackers.get(key);
        if (tracker == null) {
            return false;
        }
        synchronized (tracker) {
            if (tracker.isFinished()) {
                return false;
            }
            cancelRequests.add(key);
            tracker.error(CANCELLED);
        }
        log.info("[{}] Sync of {} cancelled", accountId, folderName);
        return true;
    }

    private void publish(SyncProgress progress) {
        latestProgress.put(key(progress.getAccountId(), progress.getFolderName()), progress);
        // Sinks reject concurrent emission
        synchronized (progressSink) {
            progressSink.tryEmitNext(progress);
        }
    }

    private List<String> orderFolders(String accountId, List<ImapFolder> folders) {
        SyncProperties.Account account = properties.getAccounts().get(accountId);
        List<String> priority = account == null ? List.of() : account.getPriorityFolders();
        Set<String> selectable = folders.stream()
                .filter(ImapFolder::isSelectable)
                .map(ImapFolder::getFullName)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        List<String> ordered = new ArrayList<>();
        for (String name : priority) {
            if (selectable.remove(name)) {
                ordered.add(name);
            }
        }
        ordered.addAll(selectable);
        return ordered;
    }

    private static String key(String accountId, String folderName) {
        return accountId + ":" + folderName;
    }

    private static long valueOf(Long value) {
        return value == null ? 0L : value;
    }

    /**
     * State of one folder sync attempt
     */
    private class FolderRun {

        private final String accountId;
        private final String folderName;
        private final String key;
        private final SyncStrategy requested;
        private final ProgressTracker tracker;
        private final SyncProperties.Sync config = properties.getSync();

        private FolderSyncState previous;
        private ImapClient client;
        private ImapFolder info;
        private SyncStrategy applied;
        private long highestUid;
        private int newMessages;
        private int updatedMessages;
        private int deletedMessages;
        private int conflicts;
        private int failedMessages;
        private boolean askUserWarned;

        FolderRun(String accountId, String folderName, SyncStrategy requested, ProgressTracker tracker) {
            this.accountId = accountId;
            this.folderName = folderName;
            this.key = key(accountId, folderName);
            this.requested = requested;
            this.tracker = tracker;
        }

        SyncResult execute() throws ImapException {
            previous = mailStore.getFolderSyncState(accountId, folderName);
            tracker.phase(SyncPhase.CHECKING_FOLDERS);
            client = accountManager.getClient(accountId);
            info = client.selectFolder(folderName);

            long uidValidity = valueOf(info.getUidValidity());
            boolean validityChanged = previous != null && previous.getUidValidity() != uidValidity;
            if (validityChanged) {
                log.warn("[{}] UIDVALIDITY of {} changed from {} to {}, discarding local copies", accountId,
                        folderName, previous.getUidValidity(), uidValidity);
                List<Long> local = mailStore.listMessageUids(accountId, folderName);
                deletedMessages += mailStore.deleteMessagesByUids(accountId, folderName, local);
            }

            applied = requested;
            if (previous == null || validityChanged) {
                applied = SyncStrategy.FULL;
            } else if (requested.getKind() == SyncStrategy.Kind.INCREMENTAL && !config.isIncrementalEnabled()) {
                applied = SyncStrategy.FULL;
            }
            if (!applied.equals(requested)) {
                log.info("[{}] Running a full sync of {} instead of {}", accountId, folderName, requested);
            }
            markSyncing();

            switch (applied.getKind()) {
                case FULL, HEADERS_ONLY -> enumerateAll();
                case INCREMENTAL -> incremental();
                case RECENT -> recent(applied.getDays());
            }
            checkCancelled();

            tracker.phase(SyncPhase.PROCESSING_CHANGES);
            FolderSyncState done = checkpoint(uidValidity);
            // cancelSync holds the same lock: a cancel is either seen here or finds the run finished
            synchronized (tracker) {
                checkCancelled();
                mailStore.updateFolderSyncState(done);
                tracker.complete();
            }
            log.info("[{}] Synced {} ({}): {} new, {} updated, {} deleted, {} conflict(s)", accountId, folderName,
                    applied, newMessages, updatedMessages, deletedMessages, conflicts);

            return SyncResult.builder()
                    .accountId(accountId)
                    .folderName(folderName)
                    .requested(requested)
                    .applied(applied)
                    .newMessages(newMessages)
                    .updatedMessages(updatedMessages)
                    .deletedMessages(deletedMessages)
                    .conflicts(conflicts)
                    .failedMessages(failedMessages)
                    .progress(tracker.snapshot())
                    .build();
        }

        /**
         * FULL and HEADERS_ONLY: every UID of the folder; local copies missing on the server are dropped
         */
        private void enumerateAll() throws ImapException {
            boolean withBody = applied.fetchesBody();
            int batchSize = withBody ? config.getFullBatchSize() : config.getHeadersBatchSize();
            tracker.phase(SyncPhase.FETCHING_HEADERS);
            List<Long> uids = valueOf(info.getExists()) == 0 ? List.of() : search(SearchCriteria.all());

            Set<Long> onServer = new HashSet<>(uids);
            List<Long> stale = mailStore.listMessageUids(accountId, folderName).stream()
                    .filter(uid -> !onServer.contains(uid))
                    .collect(Collectors.toList());
            if (!stale.isEmpty()) {
                deletedMessages += mailStore.deleteMessagesByUids(accountId, folderName, stale);
            }

            tracker.setTotal(uids.size());
            if (withBody) {
                tracker.phase(SyncPhase.FETCHING_BODIES);
            }
            fetchInBatches(uids, batchSize, withBody ? ImapCommands.FULL_ITEMS : ImapCommands.HEADER_ITEMS, false);
        }

        /**
         * CONDSTORE servers report changed messages by mod-sequence; others only new UIDs
         */
        private void incremental() throws ImapException {
            tracker.phase(SyncPhase.FETCHING_HEADERS);
            Long storedModSeq = previous.getHighestModSeq();
            Long currentModSeq = info.getHighestModSeq();
            List<Long> uids;
            if (valueOf(info.getExists()) == 0) {
                uids = List.of();
            } else if (client.hasCapability(Capability.CONDSTORE) && storedModSeq != null && currentModSeq != null) {
                uids = currentModSeq <= storedModSeq ? List.of() : search(SearchCriteria.modSeq(storedModSeq + 1));
            } else {
                long from = Math.max(1L, previous.getUidNext());
                // n:* always matches the highest UID, even when it is below n
                uids = search(SearchCriteria.uidFrom(from)).stream()
                        .filter(uid -> uid >= from)
                        .collect(Collectors.toList());
            }
            tracker.setTotal(uids.size());
            tracker.phase(SyncPhase.FETCHING_BODIES);
            fetchInBatches(uids, config.getFullBatchSize(), ImapCommands.FULL_ITEMS, true);
        }

        private void recent(int days) throws ImapException {
            tracker.phase(SyncPhase.FETCHING_HEADERS);
            LocalDate cutoff = LocalDate.now(clock).minusDays(days);
            List<Long> uids = valueOf(info.getExists()) == 0 ? List.of() : search(SearchCriteria.since(cutoff));
            tracker.setTotal(uids.size());
            tracker.phase(SyncPhase.FETCHING_BODIES);
            fetchInBatches(uids, config.getFullBatchSize(), ImapCommands.FULL_ITEMS, false);
        }

        private List<Long> search(SearchCriteria criteria) throws ImapException {
            List<Long> uids = new ArrayList<>(client.withLock(() -> {
                client.ensureSelected(folderName);
                return client.uidSearch(criteria);
            }));
            Collections.sort(uids);
            return uids;
        }

        private void fetchInBatches(List<Long> uids, int batchSize, String items, boolean resolveConflicts)
                throws ImapException {
            int size = Math.max(1, batchSize);
            for (int start = 0; start < uids.size(); start += size) {
                checkCancelled();
                if (start > 0) {
                    pause();
                }
                List<Long> batch = uids.subList(start, Math.min(uids.size(), start + size));
                List<ImapMessage> messages = client.withLock(() -> {
                    client.ensureSelected(folderName);
                    return client.uidFetch(ImapCommands.sequenceSet(batch), items);
                });
                for (ImapMessage message : messages) {
                    apply(message, resolveConflicts);
                }
                tracker.addProcessed(batch.size());
            }
        }

        private void apply(ImapMessage message, boolean resolveConflicts) {
            StoredMessage incoming;
            try {
                incoming = converter.convert(accountId, folderName, message);
            } catch (RuntimeException e) {
                failedMessages++;
                log.warn("[{}] Skipping message {} in {}: {}", accountId, message.getUid(), folderName,
                        e.getMessage());
                return;
            }
            highestUid = Math.max(highestUid, incoming.getUid());

            StoredMessage existing = mailStore.getMessageByUid(accountId, folderName, incoming.getUid());
            if (existing == null) {
                store(incoming);
                newMessages++;
                return;
            }
            if (!resolveConflicts) {
                store(replace(existing, incoming, existing.getSyncVersion()));
                updatedMessages++;
                return;
            }

            conflicts++;
            StoredMessage resolved = resolve(existing, incoming);
            if (resolved != null) {
                store(resolved);
                updatedMessages++;
            }
        }

        private StoredMessage resolve(StoredMessage existing, StoredMessage incoming) {
            ConflictPolicy policy = config.getConflictPolicy();
            if (policy == ConflictPolicy.ASK_USER && !askUserWarned) {
                askUserWarned = true;
                log.warn("[{}] Conflict policy ASK_USER has no interactive resolver, applying server versions",
                        accountId);
            }
            return switch (policy) {
                case SERVER_WINS, ASK_USER -> replace(existing, incoming, existing.getSyncVersion() + 1);
                case LOCAL_WINS -> null;
                case MERGE -> {
                    Set<String> flags = new LinkedHashSet<>(existing.getFlags());
                    flags.addAll(incoming.getFlags());
                    yield existing.toBuilder()
                            .flags(flags)
                            .syncVersion(existing.getSyncVersion() + 1)
                            .build();
                }
            };
        }

        /**
         * Server copy takes the local row's identity; a headers-only fetch keeps a body already stored
         */
        private StoredMessage replace(StoredMessage existing, StoredMessage incoming, long syncVersion) {
            StoredMessage.StoredMessageBuilder builder = incoming.toBuilder()
                    .id(existing.getId())
                    .createdAt(existing.getCreatedAt())
                    .syncVersion(syncVersion);
            if (incoming.isHeadersOnly() && !existing.isHeadersOnly()) {
                builder.bodyText(existing.getBodyText())
                        .preview(existing.getPreview())
                        .headersOnly(false);
            }
            return builder.build();
        }

        private void store(StoredMessage message) {
            mailStore.storeMessage(message);
            storedCounter.increment();
        }

        private void checkCancelled() {
            if (cancelRequests.contains(key)) {
                throw new SyncCancelledException(CANCELLED);
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new SyncCancelledException("Sync of " + key + " interrupted");
            }
        }

        private void pause() {
            long pauseMs = config.getBatchPauseMs();
            if (pauseMs <= 0) {
                return;
            }
            try {
                Thread.sleep(pauseMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SyncCancelledException("Sync of " + key + " interrupted");
            }
        }

        private void markSyncing() {
            FolderSyncState state = carryOver();
            state.setStatus(SyncStatus.SYNCING);
            mailStore.updateFolderSyncState(state);
        }

        private FolderSyncState checkpoint(long uidValidity) {
            long uidNext = info.getUidNext() != null ? info.getUidNext()
                    : Math.max(highestUid + 1, previous == null ? 1L : previous.getUidNext());
            return FolderSyncState.builder()
                    .accountId(accountId)
                    .folderName(folderName)
                    .uidValidity(uidValidity)
                    .uidNext(uidNext)
                    .highestModSeq(info.getHighestModSeq())
                    .lastSync(LocalDateTime.now(clock))
                    .messageCount(valueOf(info.getExists()))
                    .unreadCount(mailStore.countUnread(accountId, folderName))
                    .status(SyncStatus.COMPLETE)
                    .build();
        }

        // Previous position; a failed attempt must not advance it
        private FolderSyncState carryOver() {
            FolderSyncState.FolderSyncStateBuilder builder = FolderSyncState.builder()
                    .accountId(accountId)
                    .folderName(folderName)
                    .lastSync(LocalDateTime.now(clock));
            if (previous != null) {
                builder.uidValidity(previous.getUidValidity())
                        .uidNext(previous.getUidNext())
                        .highestModSeq(previous.getHighestModSeq())
                        .messageCount(previous.getMessageCount())
                        .unreadCount(previous.getUnreadCount());
            }
            return builder.build();
        }

        void fail(Exception e) {
            String message = cancelRequests.remove(key) ? CANCELLED : e.getMessage();
            tracker.error(message);
            failureCounter.increment();
            if (e instanceof SyncCancelledException) {
                log.info("[{}] Sync of {} stopped: {}", accountId, folderName, message);
            } else {
                log.warn("[{}] Sync of {} failed: {}", accountId, folderName, message);
            }

            FolderSyncState state = carryOver();
            state.setStatus(SyncStatus.ERROR);
            state.setErrorMessage(message);
            try {
                mailStore.updateFolderSyncState(state);
            } catch (MailStoreException storeError) {
                log.error("[{}] Could not record the failed sync of {}", accountId, folderName, storeError);
                e.addSuppressed(storeError);
            }
        }
    }
}
