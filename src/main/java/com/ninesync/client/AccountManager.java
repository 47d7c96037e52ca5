package com.ninesync.client;

import com.ninesync.config.SyncProperties;
import com.ninesync.domain.CapabilitySet;
import com.ninesync.imap.ImapException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of clients keyed by account id
 * - Lazily connects and authenticates on first use
 * - Evicts the least recently used client when full
 * - Connect and authenticate are each bounded by their own timeout
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountManager {

    private final ImapClientFactory clientFactory;
    private final SyncProperties properties;

    // Access ordered: iteration starts at the least recently used client
    private final Map<String, ImapClient> pool = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock poolLock = new ReentrantLock();

    /**
     * Pooled client for the account, connected and authenticated
     */
    public ImapClient getClient(String accountId) throws ImapException {
        ImapClient client;
        ImapClient evicted = null;
        poolLock.lock();
        try {
            client = pool.get(accountId);
            if (client == null) {
                // Unknown accounts fail here, before anything is evicted
                ImapClient created = clientFactory.create(accountId);
                if (pool.size() >= properties.getPool().getMaxConnections()) {
                    Iterator<Map.Entry<String, ImapClient>> eldest = pool.entrySet().iterator();
                    Map.Entry<String, ImapClient> entry = eldest.next();
                    evicted = entry.getValue();
                    eldest.remove();
                    log.info("Connection pool full, evicting {}", entry.getKey());
                }
                client = created;
                pool.put(accountId, client);
            }
        } finally {
            poolLock.unlock();
        }

        if (evicted != null) {
            evicted.disconnect();
        }
        ensureReady(client);
        return client;
    }

    private void ensureReady(ImapClient client) throws ImapException {
        String accountId = client.getAccountId();
        if (!client.isConnected()) {
            bounded(() -> {
                client.connect();
                return Boolean.TRUE;
            }, Duration.ofSeconds(properties.getPool().getConnectTimeoutSeconds()),
                    "Connection to " + accountId + " timed out");
        }
        if (!client.isAuthenticated()) {
            bounded(() -> {
                client.authenticate();
                return Boolean.TRUE;
            }, Duration.ofSeconds(properties.getPool().getAuthTimeoutSeconds()),
                    "Authentication for " + accountId + " timed out");
        }
    }

    /**
     * Run a blocking step on the elastic scheduler under a deadline
     */
    static <T> T bounded(Callable<T> step, Duration timeout, String timeoutMessage) throws ImapException {
        try {
            return Mono.fromCallable(step)
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw ImapException.timeout(timeoutMessage);
            }
            if (cause instanceof ImapException imapException) {
                throw imapException;
            }
            throw ImapException.connection(cause.getMessage(), cause);
        }
    }

    /**
     * Connect and authenticate a throwaway client, returning the advertised capabilities
     */
    public CapabilitySet testConnection(String accountId) throws ImapException {
        ImapClient client = clientFactory.create(accountId);
        try {
            ensureReady(client);
            return client.capability();
        } finally {
            client.disconnect();
        }
    }

    public List<String> listAccounts() {
        return new ArrayList<>(properties.getAccounts().keySet());
    }

    public boolean isPooled(String accountId) {
        poolLock.lock();
        try {
            return pool.containsKey(accountId);
        } finally {
            poolLock.unlock();
        }
    }

    public void disconnect(String accountId) {
        ImapClient client;
        poolLock.lock();
        try {
            client = pool.remove(accountId);
        } finally {
            poolLock.unlock();
        }
        if (client != null) {
            client.disconnect();
        }
    }

    @PreDestroy
    public void disconnectAll() {
        List<ImapClient> clients;
        poolLock.lock();
        try {
            clients = new ArrayList<>(pool.values());
            pool.clear();
        } finally {
            poolLock.unlock();
        }
        clients.forEach(ImapClient::disconnect);
        log.info("Disconnected {} pooled client(s)", clients.size());
    }

    public PoolStats getStats() {
        poolLock.lock();
        try {
            PoolStats stats = PoolStats.builder()
                    .activeConnections(pool.size())
                    .maxConnections(properties.getPool().getMaxConnections())
                    .build();
            for (Map.Entry<String, ImapClient> entry : pool.entrySet()) {
                ImapClient client = entry.getValue();
                stats.getEntries().add(new PoolStats.Entry(entry.getKey(),
                        client.getState().name(), client.getSelectedFolder()));
            }
            return stats;
        } finally {
            poolLock.unlock();
        }
    }
}
