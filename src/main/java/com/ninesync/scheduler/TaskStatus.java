package com.ninesync.scheduler;

public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,     // reason in TaskResult.error, "timeout" when the deadline expired
    CANCELLED;

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
