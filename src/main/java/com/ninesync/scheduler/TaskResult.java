package com.ninesync.scheduler;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Final outcome of a background task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResult {

    public static final String TIMEOUT = "timeout";

    private UUID taskId;
    private String accountId;
    private TaskType taskType;
    private TaskStatus status;
    private Instant startedAt;          // null when cancelled while queued
    private Instant completedAt;
    private String error;
    private TaskResultData data;

    public static TaskResult completed(BackgroundTask task, Instant startedAt, TaskResultData data) {
        return of(task, TaskStatus.COMPLETED, startedAt, null, data);
    }

    public static TaskResult failed(BackgroundTask task, Instant startedAt, String reason) {
        return of(task, TaskStatus.FAILED, startedAt, reason, null);
    }

    public static TaskResult cancelled(BackgroundTask task, Instant startedAt) {
        return of(task, TaskStatus.CANCELLED, startedAt, null, null);
    }

    private static TaskResult of(BackgroundTask task, TaskStatus status, Instant startedAt, String error,
                                 TaskResultData data) {
        return TaskResult.builder()
                .taskId(task.getId())
                .accountId(task.getAccountId())
                .taskType(task.getType())
                .status(status)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .error(error)
                .data(data)
                .build();
    }

    public boolean isTimeout() {
        return status == TaskStatus.FAILED && TIMEOUT.equals(error);
    }
}
