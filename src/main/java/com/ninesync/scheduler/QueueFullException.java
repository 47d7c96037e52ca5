package com.ninesync.scheduler;

/**
 * The task queue already holds the configured maximum number of tasks
 */
public class QueueFullException extends Exception {

    public QueueFullException(int maxQueueSize) {
        super("Task queue is full (" + maxQueueSize + " tasks)");
    }
}
