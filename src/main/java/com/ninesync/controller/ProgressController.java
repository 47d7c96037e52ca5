package com.ninesync.controller;

import com.ninesync.sync.SyncEngine;
import com.ninesync.sync.SyncProgress;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Sync progress REST API
 * - Progress stream (GET /api/progress, SSE)
 * - Last progress of a folder (GET /api/progress/folder?accountId=&folder=)
 * - Cancel a running folder sync (DELETE /api/progress/folder?accountId=&folder=)
 */
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final SyncEngine syncEngine;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<SyncProgress> progress() {
        return syncEngine.progress();
    }

    @GetMapping("/folder")
    public ResponseEntity<Map<String, Object>> folderProgress(@RequestParam String accountId,
                                                              @RequestParam String folder) {
        SyncProgress progress = syncEngine.getProgress(accountId, folder);
        if (progress == null) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, "No sync recorded for " + accountId + ":" + folder);
        }
        Map<String, Object> response = ApiResponses.success();
        response.put("progress", progress);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/folder")
    public ResponseEntity<Map<String, Object>> cancelSync(@RequestParam String accountId,
                                                          @RequestParam String folder) {
        Map<String, Object> response = ApiResponses.success();
        response.put("cancelled", syncEngine.cancelSync(accountId, folder));
        return ResponseEntity.ok(response);
    }
}
