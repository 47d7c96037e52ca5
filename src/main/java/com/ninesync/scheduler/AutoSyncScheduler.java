package com.ninesync.scheduler;

import com.ninesync.config.SyncProperties;
import com.ninesync.sync.SyncStrategy;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic re-sync of configured accounts through the task scheduler.
 * <ul>
 *   <li>On startup every account is synced once, staggered</li>
 *   <li>Each check queues accounts whose sync interval elapsed</li>
 *   <li>A rejected submission is retried with exponential backoff</li>
 * </ul>
 */
@Slf4j
@Service
public class AutoSyncScheduler {

    static final Duration RETRY_BASE = Duration.ofSeconds(30);

    private final BackgroundTaskScheduler taskScheduler;
    private final SyncProperties properties;

    private final Map<String, ScheduledSync> schedule = new ConcurrentHashMap<>();
    private final AtomicLong queued = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private volatile Instant lastSyncTime;
    private Disposable checker;
    private Disposable startup;

    public AutoSyncScheduler(BackgroundTaskScheduler taskScheduler, SyncProperties properties) {
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        SyncProperties.Scheduler config = properties.getScheduler();
        Instant now = Instant.now();
        properties.getAccounts().forEach((accountId, account) ->
                schedule.put(accountId, new ScheduledSync(now.plus(interval(account)))));

        if (config.isStartupSyncEnabled()) {
            startupSync();
        }
        if (config.isAutoSyncEnabled()) {
            Duration every = Duration.ofSeconds(config.getAutoSyncCheckSeconds());
            checker = Flux.interval(every, every)
                    .onBackpressureDrop()
                    .subscribe(t -> check(Instant.now()), e -> log.error("Auto-sync check stopped", e));
            log.info("Auto-sync started for {} account(s), checking every {}", schedule.size(), every);
        }
    }

    @PreDestroy
    public void stop() {
        if (checker != null) {
            checker.dispose();
            checker = null;
        }
        if (startup != null) {
            startup.dispose();
            startup = null;
        }
    }

    /**
     * Queue a sync of every account, one account per stagger interval
     */
    void startupSync() {
        SyncStrategy strategy = properties.getSync().isIncrementalEnabled() ? SyncStrategy.INCREMENTAL
                : SyncStrategy.recent(properties.getSync().getStartupRecentDays());
        List<String> accountIds = new ArrayList<>(properties.getAccounts().keySet());
        if (accountIds.isEmpty()) {
            return;
        }
        Duration stagger = Duration.ofMillis(properties.getScheduler().getStartupStaggerMs());
        startup = Flux.interval(Duration.ZERO, stagger)
                .take(accountIds.size())
                .map(i -> accountIds.get(i.intValue()))
                .subscribe(accountId -> queueSync(accountId, strategy, TaskPriority.NORMAL),
                        e -> log.error("Startup sync failed", e),
                        () -> log.info("Triggered startup sync for {} account(s)", accountIds.size()));
    }

    /**
     * Queue every account whose next sync time has passed
     */
    void check(Instant now) {
        SyncStrategy strategy = properties.getSync().isIncrementalEnabled() ? SyncStrategy.INCREMENTAL
                : SyncStrategy.FULL;
        schedule.forEach((accountId, scheduled) -> {
            if (now.isBefore(scheduled.nextSync)) {
                return;
            }
            SyncProperties.Account account = properties.getAccounts().get(accountId);
            if (account == null) {
                schedule.remove(accountId);
                return;
            }
            if (queueSync(accountId, strategy, TaskPriority.NORMAL).isEmpty()) {
                scheduled.retryCount++;
                Duration delay = RETRY_BASE.multipliedBy(1L << Math.min(scheduled.retryCount, 5));
                scheduled.nextSync = now.plus(delay);
                log.warn("[{}] Auto-sync deferred by {} (attempt {})", accountId, delay, scheduled.retryCount);
            } else {
                scheduled.retryCount = 0;
                scheduled.nextSync = now.plus(interval(account));
            }
        });
    }

    /**
     * Queue a sync now, outside the periodic schedule
     *
     * @return ids of the queued tasks; empty when the queue was full
     */
    public List<UUID> forceSyncAccount(String accountId) {
        SyncStrategy strategy = properties.getSync().isIncrementalEnabled() ? SyncStrategy.INCREMENTAL
                : SyncStrategy.FULL;
        return queueSync(accountId, strategy, TaskPriority.HIGH);
    }

    public AutoSyncStats getStats() {
        Instant next = schedule.values().stream()
                .map(s -> s.nextSync)
                .min(Instant::compareTo)
                .orElse(null);
        return AutoSyncStats.builder()
                .active(checker != null && !checker.isDisposed())
                .monitoredAccounts(schedule.size())
                .nextSyncTime(next)
                .lastSyncTime(lastSyncTime)
                .totalSyncsQueued(queued.get())
                .totalSyncsRejected(rejected.get())
                .build();
    }

    /**
     * Priority folders as HIGH folder syncs, then the rest of the account at the given priority
     */
    private List<UUID> queueSync(String accountId, SyncStrategy strategy, TaskPriority accountPriority) {
        SyncProperties.Account account = properties.getAccounts().get(accountId);
        List<UUID> ids = new ArrayList<>();
        try {
            if (account != null) {
                for (String folder : account.getPriorityFolders()) {
                    ids.add(taskScheduler.queueTask(BackgroundTask.of(accountId,
                            TaskType.folderSync(folder, strategy), TaskPriority.HIGH)));
                }
            }
            ids.add(taskScheduler.queueTask(BackgroundTask.of(accountId,
                    TaskType.accountSync(strategy), accountPriority)));
        } catch (QueueFullException e) {
            rejected.incrementAndGet();
            log.warn("[{}] Auto-sync not queued: {}", accountId, e.getMessage());
            ids.forEach(taskScheduler::cancelTask);
            return List.of();
        }
        queued.addAndGet(ids.size());
        lastSyncTime = Instant.now();
        log.info("[{}] Queued {} sync task(s) ({})", accountId, ids.size(), strategy);
        return ids;
    }

    private static Duration interval(SyncProperties.Account account) {
        return Duration.ofMinutes(Math.max(1, account.getSyncIntervalMinutes()));
    }

    private static class ScheduledSync {
        private volatile Instant nextSync;
        private volatile int retryCount;

        ScheduledSync(Instant nextSync) {
            this.nextSync = nextSync;
        }
    }
}
