package com.ninesync.controller;

import com.ninesync.client.AccountManager;
import com.ninesync.domain.CapabilitySet;
import com.ninesync.imap.ImapException;
import com.ninesync.scheduler.AutoSyncScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Account REST API
 * - Pool stats and configured accounts (GET /api/accounts)
 * - Connection test (POST /api/accounts/{id}/test)
 * - Sync now (POST /api/accounts/{id}/sync)
 * - Drop pooled connection (DELETE /api/accounts/{id}/connection)
 * - Auto-sync stats (GET /api/accounts/auto-sync)
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountManager accountManager;
    private final AutoSyncScheduler autoSyncScheduler;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listAccounts() {
        Map<String, Object> response = ApiResponses.success();
        response.put("accounts", accountManager.listAccounts());
        response.put("pool", accountManager.getStats());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{accountId}/test")
    public ResponseEntity<Map<String, Object>> testConnection(@PathVariable String accountId) {
        try {
            CapabilitySet capabilities = accountManager.testConnection(accountId);
            Map<String, Object> response = ApiResponses.success();
            response.put("accountId", accountId);
            response.put("capabilities", capabilities.tokens());
            return ResponseEntity.ok(response);
        } catch (ImapException e) {
            log.warn("[{}] Connection test failed: {}", accountId, e.getMessage());
            return ApiResponses.error(e);
        }
    }

    @PostMapping("/{accountId}/sync")
    public ResponseEntity<Map<String, Object>> syncNow(@PathVariable String accountId) {
        if (!accountManager.listAccounts().contains(accountId)) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, "Unknown account: " + accountId);
        }
        List<UUID> taskIds = autoSyncScheduler.forceSyncAccount(accountId);
        if (taskIds.isEmpty()) {
            return ApiResponses.error(HttpStatus.TOO_MANY_REQUESTS, "Task queue is full.");
        }
        Map<String, Object> response = ApiResponses.success();
        response.put("taskIds", taskIds);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @DeleteMapping("/{accountId}/connection")
    public ResponseEntity<Map<String, Object>> disconnect(@PathVariable String accountId) {
        boolean pooled = accountManager.isPooled(accountId);
        accountManager.disconnect(accountId);
        Map<String, Object> response = ApiResponses.success();
        response.put("disconnected", pooled);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/auto-sync")
    public ResponseEntity<Map<String, Object>> autoSyncStats() {
        Map<String, Object> response = ApiResponses.success();
        response.put("autoSync", autoSyncScheduler.getStats());
        return ResponseEntity.ok(response);
    }
}
