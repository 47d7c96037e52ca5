package com.ninesync.idle;

import com.ninesync.client.ImapClient;
import com.ninesync.config.SyncProperties;
import com.ninesync.domain.Capability;
import com.ninesync.imap.IdleResponseParser;
import com.ninesync.imap.ImapConnection;
import com.ninesync.imap.ImapException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * IMAP IDLE monitor for one folder on a dedicated client.
 *
 * <p>{@link #start(String)} selects the folder, enters IDLE and runs two loops:
 * a listener that reads pushes and stamps the {@link HeartbeatClock}, and a
 * heartbeat monitor that emits {@code TIMEOUT} once the clock is older than
 * the IDLE timeout. {@code TIMEOUT} and {@code CONNECTION_LOST} trigger one
 * stop-then-start of the same folder; if that fails, listeners get
 * {@link IdleNotificationListener#onRestartFailure} and monitoring ends.</p>
 *
 * <p>Each start opens a new generation. Loops of an older generation may still
 * be winding down but no longer dispatch anything.</p>
 */
@Slf4j
public class IdleNotificationService {

    private final String accountId;
    private final ImapClient client;
    private final SyncProperties.Idle config;
    private final Counter restartCounter;

    private final HeartbeatClock heartbeat = new HeartbeatClock();
    private final List<IdleNotificationListener> listeners = new CopyOnWriteArrayList<>();
    private final Sinks.Many<IdleNotification> sink = Sinks.many().multicast().directBestEffort();
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Object dispatchLock = new Object();
    private final AtomicInteger restarts = new AtomicInteger();

    private volatile boolean active = false;
    private volatile long generation = 0;
    private volatile String monitoredFolder;
    private Disposable listenerTask;
    private Disposable heartbeatTask;
    private CountDownLatch listenerDone = new CountDownLatch(0);

    public IdleNotificationService(String accountId, ImapClient client, SyncProperties.Idle config,
                                   MeterRegistry meterRegistry) {
        this.accountId = accountId;
        this.client = client;
        this.config = config;
        this.restartCounter = Counter.builder("ninesync.idle.restarts")
                .tag("account", accountId)
                .register(meterRegistry);
    }

    public void addListener(IdleNotificationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(IdleNotificationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Hot stream of every dispatched notification
     */
    public Flux<IdleNotification> notifications() {
        return sink.asFlux();
    }

    public String getAccountId() {
        return accountId;
    }

    public boolean isActive() {
        return active;
    }

    public IdleStats getStats() {
        return IdleStats.builder()
                .active(active)
                .monitoredFolder(monitoredFolder)
                .callbackCount(listeners.size())
                .restarts(restarts.get())
                .lastHeartbeat(heartbeat.getLastBeatAt())
                .build();
    }

    /**
     * Start monitoring a folder. Only one folder per service.
     */
    public void start(String folder) throws ImapException {
        stateLock.lock();
        try {
            if (active) {
                throw ImapException.invalidState("Already monitoring " + monitoredFolder);
            }
            List<String> early = new ArrayList<>();
            String tag = client.withLock(() -> {
                client.connect();
                client.authenticate();
                if (!client.hasCapability(Capability.IDLE)) {
                    throw ImapException.notSupported("Server does not advertise IDLE");
                }
                client.selectFolder(folder);
                return client.getConnection().beginIdle(early);
            });

            long gen = ++generation;
            heartbeat.beat();
            monitoredFolder = folder;
            active = true;
            listenerDone = new CountDownLatch(1);
            CountDownLatch done = listenerDone;

            listenerTask = Mono.fromRunnable(() -> listen(gen, tag, done))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe();
            heartbeatTask = Flux.interval(Duration.ofMillis(heartbeatIntervalMillis()))
                    .subscribe(tick -> checkHeartbeat(gen));

            log.info("[{}] IDLE monitoring started on {}", accountId, folder);
            for (IdleNotification n : IdleResponseParser.parse(early)) {
                if (n.requiresRestart()) {
                    fail(gen, n);
                    break;
                }
                dispatch(n);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Leave IDLE (DONE) and return to not monitoring. No-op when not active.
     */
    public void stop() {
        stateLock.lock();
        try {
            if (!active) {
                return;
            }
            stopInternal();
            log.info("[{}] IDLE monitoring stopped", accountId);
        } finally {
            stateLock.unlock();
        }
    }

    private void stopInternal() {
        active = false;
        generation++;
        if (heartbeatTask != null) {
            heartbeatTask.dispose();
        }
        ImapConnection connection = client.getConnection();
        try {
            connection.sendDone();
        } catch (ImapException e) {
            log.debug("[{}] DONE not sent: {}", accountId, e.getMessage());
        }
        boolean finished;
        try {
            finished = listenerDone.await(readTimeoutMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = false;
        }
        if (!finished || !connection.isOpen()) {
            // Completion of IDLE was not observed: the stream position is unknown
            if (listenerTask != null) {
                listenerTask.dispose();
            }
            connection.abort();
        }
        monitoredFolder = null;
    }

    // ---------------------------------------------------------------- loops

    /**
     * Listener loop. Runs until the IDLE command completes or the connection fails.
     */
    private void listen(long gen, String tag, CountDownLatch done) {
        ImapConnection connection = client.getConnection();
        Duration readTimeout = Duration.ofMillis(readTimeoutMillis());
        try {
            while (true) {
                String line;
                try {
                    line = connection.readLine(readTimeout);
                } catch (ImapException e) {
                    if (e.getKind() == ImapException.ErrorKind.TIMEOUT) {
                        continue;
                    }
                    fail(gen, IdleNotification.connectionLost(e.getMessage()));
                    return;
                }
                heartbeat.beat();

                if (line.startsWith(tag + " ")) {
                    if (isCurrent(gen)) {
                        // Server ended IDLE on its own
                        fail(gen, IdleNotification.connectionLost("IDLE terminated by server: " + line));
                    }
                    return;
                }
                IdleNotification notification = IdleResponseParser.parseLine(line);
                if (notification == null) {
                    continue;
                }
                if (notification.requiresRestart()) {
                    fail(gen, notification);
                    return;
                }
                if (isCurrent(gen)) {
                    dispatch(notification);
                }
            }
        } finally {
            done.countDown();
        }
    }

    private void checkHeartbeat(long gen) {
        if (!isCurrent(gen)) {
            return;
        }
        Duration silent = heartbeat.sinceLastBeat();
        if (silent.toMillis() > idleTimeoutMillis()) {
            log.warn("[{}] No IDLE traffic for {}s, heartbeat timed out", accountId, silent.toSeconds());
            if (heartbeatTask != null) {
                heartbeatTask.dispose();
            }
            fail(gen, IdleNotification.timeout());
        }
    }

    /**
     * Emit a TIMEOUT / CONNECTION_LOST notification once per generation and schedule the restart
     */
    private void fail(long gen, IdleNotification notification) {
        if (!isCurrent(gen)) {
            return;
        }
        String folder;
        long failedGen;
        stateLock.lock();
        try {
            if (!isCurrent(gen)) {
                return;
            }
            failedGen = ++generation;
            folder = monitoredFolder;
        } finally {
            stateLock.unlock();
        }
        dispatch(notification);
        Mono.fromRunnable(() -> restart(folder, failedGen))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    /**
     * Stop then start the same folder, unless someone stopped or restarted the service meanwhile
     */
    private void restart(String folder, long failedGen) {
        stateLock.lock();
        try {
            if (!active || generation != failedGen) {
                return;
            }
            restarts.incrementAndGet();
            restartCounter.increment();
            log.warn("[{}] Restarting IDLE on {}", accountId, folder);
            stopInternal();
            start(folder);
        } catch (ImapException e) {
            log.error("[{}] IDLE restart failed: {}", accountId, e.getMessage());
            active = false;
            monitoredFolder = null;
            for (IdleNotificationListener listener : listeners) {
                listener.onRestartFailure(accountId, e);
            }
        } finally {
            stateLock.unlock();
        }
    }

    private boolean isCurrent(long gen) {
        return active && gen == generation;
    }

    private void dispatch(IdleNotification notification) {
        synchronized (dispatchLock) {
            log.debug("[{}] IDLE notification {}", accountId, notification);
            for (IdleNotificationListener listener : listeners) {
                try {
                    listener.onNotification(accountId, notification);
                } catch (RuntimeException e) {
                    log.error("[{}] IDLE listener failed", accountId, e);
                }
            }
            sink.tryEmitNext(notification);
        }
    }

    private long idleTimeoutMillis() {
        return config.getTimeoutMs();
    }

    private long heartbeatIntervalMillis() {
        return config.getHeartbeatIntervalMs();
    }

    private long readTimeoutMillis() {
        return config.getReadTimeoutMs();
    }
}
