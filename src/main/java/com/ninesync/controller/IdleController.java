package com.ninesync.controller;

import com.ninesync.idle.IdleMonitorRegistry;
import com.ninesync.idle.IdleNotification;
import com.ninesync.imap.ImapException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * IDLE monitor REST API
 * - Stats (GET /api/idle/{accountId})
 * - Start / stop (POST, DELETE /api/idle/{accountId})
 * - Notification stream (GET /api/idle/{accountId}/notifications, SSE)
 */
@Slf4j
@RestController
@RequestMapping("/api/idle")
@RequiredArgsConstructor
public class IdleController {

    private final IdleMonitorRegistry registry;

    @GetMapping("/{accountId}")
    public ResponseEntity<Map<String, Object>> stats(@PathVariable String accountId) {
        try {
            Map<String, Object> response = ApiResponses.success();
            response.put("accountId", accountId);
            response.put("idle", registry.getIdleStats(accountId));
            return ResponseEntity.ok(response);
        } catch (ImapException e) {
            return ApiResponses.error(e);
        }
    }

    @PostMapping("/{accountId}")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String accountId) {
        try {
            registry.startMonitor(accountId);
            log.info("[{}] IDLE monitor started via API", accountId);
            Map<String, Object> response = ApiResponses.success();
            response.put("idle", registry.getIdleStats(accountId));
            return ResponseEntity.ok(response);
        } catch (ImapException e) {
            return ApiResponses.error(e);
        }
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String accountId) {
        Map<String, Object> response = ApiResponses.success();
        response.put("stopped", registry.stopMonitor(accountId));
        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/{accountId}/notifications", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<IdleNotification> notifications(@PathVariable String accountId) {
        try {
            return registry.notifications(accountId);
        } catch (ImapException e) {
            return Flux.error(e);
        }
    }
}
