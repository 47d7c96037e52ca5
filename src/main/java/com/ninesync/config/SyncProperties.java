package com.ninesync.config;

import com.ninesync.domain.AccountCredentials;
import com.ninesync.sync.ConflictPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 9Sync configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "ninesync")
public class SyncProperties {

    private Map<String, Account> accounts = new LinkedHashMap<>();
    private Pool pool = new Pool();
    private Sync sync = new Sync();
    private Idle idle = new Idle();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Account {
        private String displayName;
        private String host;
        private int port = 993;
        private String username;
        private String password;
        private String tokenReference;      // Set instead of password for XOAUTH2 accounts
        private Boolean useTls;             // null = implicit TLS on port 993 only
        private boolean useStartTls = false;
        private int timeoutSeconds = 60;
        private boolean validateCertificates = true;
        private List<String> priorityFolders = new ArrayList<>(List.of("INBOX"));
        private int syncIntervalMinutes = 15;
        private boolean idleEnabled = false;
        private String idleFolder = "INBOX";

        public boolean isImplicitTls() {
            return useTls != null ? useTls : port == 993;
        }

        public AccountCredentials toCredentials() {
            if (tokenReference != null && !tokenReference.isBlank()) {
                return AccountCredentials.token(username, tokenReference);
            }
            return AccountCredentials.password(username, password);
        }
    }

    @Data
    public static class Pool {
        private int maxConnections = 10;
        private int connectTimeoutSeconds = 30;
        private int authTimeoutSeconds = 30;
        private int maxLineLength = 65536;
        // Largest literal (e.g. a message body) a response may announce
        private int maxLiteralLength = 50 * 1024 * 1024;
    }

    @Data
    public static class Sync {
        private int fullBatchSize = 50;
        private int headersBatchSize = 100;
        private long batchPauseMs = 100L;
        private ConflictPolicy conflictPolicy = ConflictPolicy.SERVER_WINS;
        private int cacheWarmMessages = 50;
        private boolean incrementalEnabled = true;
        private int startupRecentDays = 7;
    }

    @Data
    public static class Idle {
        private long timeoutMs = 1740000L;          // 29 min, below the 30 minute server limit
        private long heartbeatIntervalMs = 60000L;
        private long readTimeoutMs = 30000L;
    }

    @Data
    public static class Scheduler {
        private int maxConcurrentTasks = 3;
        private long taskTimeoutSeconds = 300L;
        private int maxQueueSize = 100;
        private int resultCacheSize = 50;
        private long tickIntervalMs = 100L;
        private boolean autoSyncEnabled = true;
        private long autoSyncCheckSeconds = 60L;
        private boolean startupSyncEnabled = true;
        private long startupStaggerMs = 2000L;
    }
}
