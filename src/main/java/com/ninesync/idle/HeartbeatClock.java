package com.ninesync.idle;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last-heartbeat timestamp shared by the listener (writer) and the heartbeat monitor (reader)
 */
public class HeartbeatClock {

    private final ReentrantLock lock = new ReentrantLock();
    private long lastBeatNanos = System.nanoTime();
    private Instant lastBeatAt = Instant.now();

    public void beat() {
        lock.lock();
        try {
            lastBeatNanos = System.nanoTime();
            lastBeatAt = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    public Duration sinceLastBeat() {
        lock.lock();
        try {
            return Duration.ofNanos(System.nanoTime() - lastBeatNanos);
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastBeatAt() {
        lock.lock();
        try {
            return lastBeatAt;
        } finally {
            lock.unlock();
        }
    }
}
