package com.ninesync.scheduler;

import com.ninesync.config.SyncProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Priority queue of background tasks feeding a capped set of running tasks.
 * <p>
 * Each tick reaps finished tasks and, below the concurrency cap, dispatches the oldest
 * task of the highest non-empty priority. Running tasks race a deadline; on expiry or
 * cancellation the worker is disposed (interrupted) and a FAILED("timeout") or
 * CANCELLED result is recorded.
 */
@Slf4j
@Service
public class BackgroundTaskScheduler {

    private final TaskRunner runner;
    private final SyncProperties.Scheduler config;

    private final Map<TaskPriority, Deque<BackgroundTask>> queues = new EnumMap<>(TaskPriority.class);
    private final ReentrantLock queueLock = new ReentrantLock();
    private final Map<UUID, RunningTask> running = new ConcurrentHashMap<>();
    private final Map<UUID, TaskResult> results;
    private final Sinks.Many<TaskResult> completionSink = Sinks.many().multicast().directBestEffort();

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;
    private final Counter rejectedCounter;

    private Disposable ticker;

    public BackgroundTaskScheduler(TaskRunner runner, SyncProperties properties, MeterRegistry meterRegistry) {
        this.runner = runner;
        this.config = properties.getScheduler();
        for (TaskPriority priority : TaskPriority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
        int cacheSize = config.getResultCacheSize();
        this.results = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, TaskResult> eldest) {
                return size() > cacheSize;
            }
        };

        this.completedCounter = outcomeCounter(meterRegistry, "completed");
        this.failedCounter = outcomeCounter(meterRegistry, "failed");
        this.cancelledCounter = outcomeCounter(meterRegistry, "cancelled");
        this.rejectedCounter = outcomeCounter(meterRegistry, "rejected");
        Gauge.builder("ninesync.tasks.queued", this, BackgroundTaskScheduler::getQueuedCount)
                .description("Tasks waiting for dispatch")
                .register(meterRegistry);
        Gauge.builder("ninesync.tasks.running", running, Map::size)
                .description("Tasks currently running")
                .register(meterRegistry);
    }

    private static Counter outcomeCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("ninesync.tasks")
                .tag("outcome", outcome)
                .description("Background task outcomes")
                .register(registry);
    }

    @PostConstruct
    public void start() {
        if (ticker != null && !ticker.isDisposed()) {
            return;
        }
        ticker = Flux.interval(Duration.ofMillis(config.getTickIntervalMs()))
                .onBackpressureDrop()
                .subscribe(t -> tick(), e -> log.error("Task scheduler tick stopped", e));
        log.info("Background task scheduler started (max {} concurrent, queue {}, timeout {}s)",
                config.getMaxConcurrentTasks(), config.getMaxQueueSize(), config.getTaskTimeoutSeconds());
    }

    /**
     * Stop dispatching and cancel everything still running
     */
    @PreDestroy
    public void stop() {
        if (ticker != null) {
            ticker.dispose();
            ticker = null;
        }
        for (UUID id : new ArrayList<>(running.keySet())) {
            cancelTask(id);
        }
        log.info("Background task scheduler stopped");
    }

    /**
     * @return the task id
     * @throws QueueFullException when the queue already holds {@code maxQueueSize} tasks
     */
    public UUID queueTask(BackgroundTask task) throws QueueFullException {
        queueLock.lock();
        try {
            if (getQueuedCount() >= config.getMaxQueueSize()) {
                rejectedCounter.increment();
                throw new QueueFullException(config.getMaxQueueSize());
            }
            queues.get(task.getPriority()).addLast(task);
        } finally {
            queueLock.unlock();
        }
        log.debug("[{}] Queued {} ({}, {})", task.getAccountId(), task.getName(), task.getPriority(), task.getId());
        return task.getId();
    }

    /**
     * Cancel a queued or running task
     *
     * @return false when the task is unknown or already finished
     */
    public boolean cancelTask(UUID taskId) {
        BackgroundTask queued = removeQueued(taskId);
        if (queued != null) {
            record(TaskResult.cancelled(queued, null));
            log.info("[{}] Cancelled queued task {}", queued.getAccountId(), queued.getName());
            return true;
        }

        RunningTask handle = running.get(taskId);
        if (handle != null && handle.finish()) {
            handle.abort();
            running.remove(taskId);
            record(TaskResult.cancelled(handle.getTask(), handle.getStartedAt()));
            log.info("[{}] Cancelled running task {}", handle.getTask().getAccountId(), handle.getTask().getName());
            return true;
        }
        return false;
    }

    /**
     * @return QUEUED, RUNNING, the final status, or null for an unknown (or evicted) task
     */
    public TaskStatus getTaskStatus(UUID taskId) {
        TaskResult result = getTaskResult(taskId);
        if (result != null) {
            return result.getStatus();
        }
        RunningTask handle = running.get(taskId);
        if (handle != null && !handle.isFinished()) {
            return TaskStatus.RUNNING;
        }
        queueLock.lock();
        try {
            for (Deque<BackgroundTask> queue : queues.values()) {
                for (BackgroundTask task : queue) {
                    if (task.getId().equals(taskId)) {
                        return TaskStatus.QUEUED;
                    }
                }
            }
        } finally {
            queueLock.unlock();
        }
        return null;
    }

    public TaskResult getTaskResult(UUID taskId) {
        synchronized (results) {
            return results.get(taskId);
        }
    }

    /**
     * Queued tasks in dispatch order
     */
    public List<BackgroundTask> getQueuedTasks() {
        queueLock.lock();
        try {
            List<BackgroundTask> tasks = new ArrayList<>();
            for (TaskPriority priority : TaskPriority.values()) {
                tasks.addAll(queues.get(priority));
            }
            return tasks;
        } finally {
            queueLock.unlock();
        }
    }

    public List<BackgroundTask> getRunningTasks() {
        return running.values().stream()
                .filter(handle -> !handle.isFinished())
                .map(RunningTask::getTask)
                .collect(Collectors.toList());
    }

    public int getQueuedCount() {
        queueLock.lock();
        try {
            return queues.values().stream().mapToInt(Deque::size).sum();
        } finally {
            queueLock.unlock();
        }
    }

    public Flux<TaskResult> completions() {
        return completionSink.asFlux();
    }

    /**
     * One scheduling round: reap finished tasks, then dispatch at most one task
     */
    void tick() {
        running.values().removeIf(RunningTask::isFinished);
        if (running.size() >= config.getMaxConcurrentTasks()) {
            return;
        }
        BackgroundTask next = pollNext();
        if (next != null) {
            dispatch(next);
        }
    }

    private BackgroundTask pollNext() {
        queueLock.lock();
        try {
            for (TaskPriority priority : TaskPriority.values()) {
                BackgroundTask task = queues.get(priority).pollFirst();
                if (task != null) {
                    return task;
                }
            }
            return null;
        } finally {
            queueLock.unlock();
        }
    }

    private BackgroundTask removeQueued(UUID taskId) {
        queueLock.lock();
        try {
            for (Deque<BackgroundTask> queue : queues.values()) {
                Iterator<BackgroundTask> it = queue.iterator();
                while (it.hasNext()) {
                    BackgroundTask task = it.next();
                    if (task.getId().equals(taskId)) {
                        it.remove();
                        return task;
                    }
                }
            }
            return null;
        } finally {
            queueLock.unlock();
        }
    }

    private void dispatch(BackgroundTask task) {
        RunningTask handle = new RunningTask(task, Instant.now());
        running.put(task.getId(), handle);
        Duration timeout = task.getTimeout() != null ? task.getTimeout()
                : Duration.ofSeconds(config.getTaskTimeoutSeconds());
        log.debug("[{}] Starting {} (timeout {})", task.getAccountId(), task.getName(), timeout);

        Disposable execution = Mono.fromCallable(() -> runner.run(task))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .subscribe(
                        data -> complete(handle, TaskResult.completed(task, handle.getStartedAt(), data)),
                        error -> complete(handle, failure(task, handle.getStartedAt(), error)),
                        () -> complete(handle, TaskResult.failed(task, handle.getStartedAt(), "no result")));
        handle.setExecution(execution);
        if (handle.isFinished()) {
            // Cancelled before the handle was attached
            execution.dispose();
        }
    }

    private TaskResult failure(BackgroundTask task, Instant startedAt, Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("[{}] Task {} timed out", task.getAccountId(), task.getName());
            return TaskResult.failed(task, startedAt, TaskResult.TIMEOUT);
        }
        log.warn("[{}] Task {} failed: {}", task.getAccountId(), task.getName(), cause.toString());
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return TaskResult.failed(task, startedAt, reason);
    }

    private void complete(RunningTask handle, TaskResult result) {
        // Loses against a concurrent cancel
        if (handle.finish()) {
            record(result);
        }
    }

    private void record(TaskResult result) {
        synchronized (results) {
            results.put(result.getTaskId(), result);
        }
        switch (result.getStatus()) {
            case COMPLETED -> completedCounter.increment();
            case FAILED -> failedCounter.increment();
            case CANCELLED -> cancelledCounter.increment();
            default -> { }
        }
        synchronized (completionSink) {
            completionSink.tryEmitNext(result);
        }
    }

    /**
     * Running task with its execution handle
     */
    @Getter
    private static class RunningTask {

        private final BackgroundTask task;
        private final Instant startedAt;
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile Disposable execution;

        RunningTask(BackgroundTask task, Instant startedAt) {
            this.task = task;
            this.startedAt = startedAt;
        }

        void setExecution(Disposable execution) {
            this.execution = execution;
        }

        /**
         * @return true for the first caller only
         */
        boolean finish() {
            return finished.compareAndSet(false, true);
        }

        boolean isFinished() {
            return finished.get();
        }

        void abort() {
            Disposable current = execution;
            if (current != null) {
                current.dispose();
            }
        }
    }
}
