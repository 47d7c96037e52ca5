package com.ninesync.scheduler;

/**
 * Dispatch order: CRITICAL first, LOW last
 */
public enum TaskPriority {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW
}
