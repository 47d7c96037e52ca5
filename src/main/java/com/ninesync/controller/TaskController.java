package com.ninesync.controller;

import com.ninesync.config.SyncProperties;
import com.ninesync.scheduler.BackgroundTask;
import com.ninesync.scheduler.BackgroundTaskScheduler;
import com.ninesync.scheduler.QueueFullException;
import com.ninesync.scheduler.TaskPriority;
import com.ninesync.scheduler.TaskResult;
import com.ninesync.scheduler.TaskStatus;
import com.ninesync.scheduler.TaskType;
import com.ninesync.sync.SyncStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Background task REST API
 * - Queue task (POST /api/tasks)
 * - Cancel task (DELETE /api/tasks/{id})
 * - Task status and result (GET /api/tasks/{id})
 * - Queued and running tasks (GET /api/tasks)
 * - Completion stream (GET /api/tasks/completions, SSE)
 */
@Slf4j
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final BackgroundTaskScheduler scheduler;
    private final SyncProperties properties;

    /**
     * Queue task
     * POST /api/tasks
     * Body: { "accountId": "work", "type": "FOLDER_SYNC", "folderName": "INBOX",
     *         "strategy": "INCREMENTAL", "priority": "HIGH" }
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> queueTask(@RequestBody Map<String, Object> request) {
        String accountId = string(request, "accountId");
        if (accountId == null || accountId.isBlank()) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, "accountId is required.");
        }
        if (!properties.getAccounts().containsKey(accountId)) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, "Unknown account: " + accountId);
        }

        BackgroundTask task;
        try {
            BackgroundTask.BackgroundTaskBuilder builder = BackgroundTask.builder()
                    .accountId(accountId)
                    .type(toTaskType(request, properties.getSync().getCacheWarmMessages()))
                    .priority(priority(request));
            Object timeout = request.get("timeoutSeconds");
            if (timeout != null) {
                builder.timeout(Duration.ofSeconds(Long.parseLong(timeout.toString())));
            }
            task = builder.build();
        } catch (IllegalArgumentException e) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        try {
            scheduler.queueTask(task);
        } catch (QueueFullException e) {
            return ApiResponses.error(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
        }
        log.info("[{}] Task {} queued via API ({})", accountId, task.getId(), task.getType());

        Map<String, Object> response = ApiResponses.success();
        response.put("taskId", task.getId());
        response.put("type", task.getType().toString());
        response.put("priority", task.getPriority());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * Cancel task
     * DELETE /api/tasks/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancelTask(@PathVariable UUID id) {
        Map<String, Object> response = ApiResponses.success();
        response.put("taskId", id);
        response.put("cancelled", scheduler.cancelTask(id));
        return ResponseEntity.ok(response);
    }

    /**
     * Task status and result
     * GET /api/tasks/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getTask(@PathVariable UUID id) {
        TaskStatus status = scheduler.getTaskStatus(id);
        if (status == null) {
            return ApiResponses.error(HttpStatus.NOT_FOUND, "Task not found: " + id);
        }
        Map<String, Object> response = ApiResponses.success();
        response.put("taskId", id);
        response.put("taskStatus", status);
        TaskResult result = scheduler.getTaskResult(id);
        if (result != null) {
            response.put("result", result);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * Queued and running tasks
     * GET /api/tasks
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listTasks() {
        Map<String, Object> response = ApiResponses.success();
        response.put("queued", summarize(scheduler.getQueuedTasks()));
        response.put("running", summarize(scheduler.getRunningTasks()));
        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/completions", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<TaskResult> completions() {
        return scheduler.completions();
    }

    static TaskType toTaskType(Map<String, Object> request, int defaultWarmCount) {
        String type = string(request, "type");
        if (type == null) {
            throw new IllegalArgumentException("type is required.");
        }
        String folder = string(request, "folderName");
        return switch (type.toUpperCase(Locale.ROOT)) {
            case "ACCOUNT_SYNC" -> TaskType.accountSync(strategy(request));
            case "FOLDER_SYNC" -> TaskType.folderSync(folder, strategy(request));
            case "FOLDER_REFRESH" -> TaskType.folderRefresh(folder);
            case "SEARCH" -> TaskType.search(string(request, "query"), folders(request));
            case "INDEXING" -> TaskType.indexing(folder);
            case "CACHE_WARM" -> {
                Object count = request.get("messageCount");
                int messageCount = count == null ? defaultWarmCount : Integer.parseInt(count.toString());
                yield TaskType.cacheWarm(folder, messageCount);
            }
            default -> throw new IllegalArgumentException("Unknown task type: " + type);
        };
    }

    private static SyncStrategy strategy(Map<String, Object> request) {
        String strategy = string(request, "strategy");
        return strategy == null ? SyncStrategy.INCREMENTAL : SyncStrategy.parse(strategy);
    }

    private static TaskPriority priority(Map<String, Object> request) {
        String priority = string(request, "priority");
        return priority == null ? TaskPriority.NORMAL : TaskPriority.valueOf(priority.toUpperCase(Locale.ROOT));
    }

    private static List<String> folders(Map<String, Object> request) {
        Object folders = request.get("folders");
        if (folders instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of();
    }

    private static String string(Map<String, Object> request, String key) {
        Object value = request.get(key);
        return value == null ? null : value.toString();
    }

    private static List<Map<String, Object>> summarize(List<BackgroundTask> tasks) {
        return tasks.stream().map(task -> Map.<String, Object>of(
                "taskId", task.getId(),
                "accountId", task.getAccountId(),
                "type", task.getType().toString(),
                "priority", task.getPriority(),
                "createdAt", task.getCreatedAt())).collect(Collectors.toList());
    }
}
