package com.ninesync.scheduler;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Unit of background work for one account
 */
@Getter
@Builder
@ToString
public class BackgroundTask {

    @Builder.Default
    private final UUID id = UUID.randomUUID();
    private final String name;
    private final String accountId;
    private final TaskType type;
    @Builder.Default
    private final TaskPriority priority = TaskPriority.NORMAL;
    @Builder.Default
    private final Instant createdAt = Instant.now();
    private final Duration timeout;         // null = scheduler default

    public static BackgroundTask of(String accountId, TaskType type, TaskPriority priority) {
        return BackgroundTask.builder()
                .name(type.toString())
                .accountId(accountId)
                .type(type)
                .priority(priority)
                .build();
    }
}
