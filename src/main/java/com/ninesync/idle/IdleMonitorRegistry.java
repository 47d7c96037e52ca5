package com.ninesync.idle;

import com.ninesync.client.ImapClient;
import com.ninesync.client.ImapClientFactory;
import com.ninesync.config.SyncProperties;
import com.ninesync.imap.ImapException;
import com.ninesync.scheduler.BackgroundTask;
import com.ninesync.scheduler.BackgroundTaskScheduler;
import com.ninesync.scheduler.QueueFullException;
import com.ninesync.scheduler.TaskPriority;
import com.ninesync.scheduler.TaskStatus;
import com.ninesync.scheduler.TaskType;
import com.ninesync.sync.SyncStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One IDLE monitor per account with {@code idleEnabled}.
 * Folder changes reported by a monitor are turned into HIGH priority incremental folder syncs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdleMonitorRegistry implements IdleNotificationListener {

    private final ImapClientFactory clientFactory;
    private final BackgroundTaskScheduler taskScheduler;
    private final SyncProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, IdleNotificationService> monitors = new ConcurrentHashMap<>();
    private final Map<String, ImapClient> clients = new ConcurrentHashMap<>();
    // Last sync queued per account; no second one while it is still waiting
    private final Map<String, UUID> pendingSyncs = new ConcurrentHashMap<>();

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        properties.getAccounts().forEach((accountId, account) -> {
            if (!account.isIdleEnabled()) {
                return;
            }
            try {
                startMonitor(accountId);
            } catch (ImapException e) {
                log.warn("[{}] IDLE monitor not started: {}", accountId, e.getMessage());
            }
        });
    }

    /**
     * Start monitoring the account's IDLE folder on a dedicated connection. No-op when already active.
     */
    public IdleNotificationService startMonitor(String accountId) throws ImapException {
        IdleNotificationService existing = monitors.get(accountId);
        if (existing != null && existing.isActive()) {
            return existing;
        }
        stopMonitor(accountId);

        SyncProperties.Account account = clientFactory.getAccount(accountId);
        ImapClient client = clientFactory.createIdleClient(accountId);
        IdleNotificationService service = new IdleNotificationService(accountId, client, properties.getIdle(),
                meterRegistry);
        service.addListener(this);
        try {
            service.start(account.getIdleFolder());
        } catch (ImapException e) {
            client.disconnect();
            throw e;
        }
        monitors.put(accountId, service);
        clients.put(accountId, client);
        log.info("[{}] IDLE monitor active on {}", accountId, account.getIdleFolder());
        return service;
    }

    /**
     * @return false when the account had no monitor
     */
    public boolean stopMonitor(String accountId) {
        IdleNotificationService service = monitors.remove(accountId);
        ImapClient client = clients.remove(accountId);
        if (service != null) {
            service.stop();
        }
        if (client != null) {
            client.disconnect();
        }
        pendingSyncs.remove(accountId);
        return service != null;
    }

    @PreDestroy
    public void stopAll() {
        for (String accountId : monitors.keySet()) {
            stopMonitor(accountId);
        }
    }

    /**
     * Stats of the account's monitor; inactive stats for a configured account without one
     *
     * @throws ImapException NOT_FOUND for an unknown account
     */
    public IdleStats getIdleStats(String accountId) throws ImapException {
        IdleNotificationService service = monitors.get(accountId);
        if (service != null) {
            return service.getStats();
        }
        clientFactory.getAccount(accountId);
        return IdleStats.builder().active(false).build();
    }

    public Flux<IdleNotification> notifications(String accountId) throws ImapException {
        IdleNotificationService service = monitors.get(accountId);
        if (service == null) {
            throw ImapException.notFound("No IDLE monitor for " + accountId);
        }
        return service.notifications();
    }

    @Override
    public void onNotification(String accountId, IdleNotification notification) {
        log.debug("[{}] IDLE {}", accountId, notification);
        if (!notification.isMailboxChange()) {
            return;
        }
        UUID pending = pendingSyncs.get(accountId);
        if (pending != null && taskScheduler.getTaskStatus(pending) == TaskStatus.QUEUED) {
            return;
        }

        SyncProperties.Account account = properties.getAccounts().get(accountId);
        if (account == null) {
            return;
        }
        BackgroundTask task = BackgroundTask.of(accountId,
                TaskType.folderSync(account.getIdleFolder(), SyncStrategy.INCREMENTAL), TaskPriority.HIGH);
        try {
            pendingSyncs.put(accountId, taskScheduler.queueTask(task));
        } catch (QueueFullException e) {
            log.warn("[{}] Sync after IDLE {} dropped: {}", accountId, notification.getType(), e.getMessage());
        }
    }

    @Override
    public void onRestartFailure(String accountId, ImapException error) {
        log.error("[{}] IDLE monitor stopped after a failed restart: {}", accountId, error.getMessage());
    }
}
