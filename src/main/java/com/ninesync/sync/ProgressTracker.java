package com.ninesync.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Mutable progress of one folder sync. Publishes a snapshot on every change.
 * Phases only move forward and nothing changes after COMPLETE or ERROR.
 */
public class ProgressTracker {

    private final String accountId;
    private final String folderName;
    private final Clock clock;
    private final Consumer<SyncProgress> publisher;
    private final Instant startedAt;

    private SyncPhase phase = SyncPhase.INITIALIZING;
    private long processed;
    private long total;
    private String errorMessage;

    public ProgressTracker(String accountId, String folderName, Clock clock, Consumer<SyncProgress> publisher) {
        this.accountId = accountId;
        this.folderName = folderName;
        this.clock = clock;
        this.publisher = publisher;
        this.startedAt = clock.instant();
        publish();
    }

    /**
     * Move to the given phase. Ignored when it is not after the current one.
     */
    public synchronized void phase(SyncPhase next) {
        if (phase.isTerminal() || next.ordinal() <= phase.ordinal()) {
            return;
        }
        phase = next;
        publish();
    }

    public synchronized void setTotal(long total) {
        if (phase.isTerminal()) {
            return;
        }
        this.total = total;
        publish();
    }

    public synchronized void addProcessed(long count) {
        if (phase.isTerminal() || count <= 0) {
            return;
        }
        processed += count;
        publish();
    }

    public synchronized void complete() {
        phase(SyncPhase.COMPLETE);
    }

    public synchronized void error(String message) {
        if (phase.isTerminal()) {
            return;
        }
        errorMessage = message;
        phase = SyncPhase.ERROR;
        publish();
    }

    public synchronized boolean isFinished() {
        return phase.isTerminal();
    }

    public synchronized SyncProgress snapshot() {
        Instant now = clock.instant();
        return SyncProgress.builder()
                .accountId(accountId)
                .folderName(folderName)
                .phase(phase)
                .messagesProcessed(processed)
                .totalMessages(total)
                .startedAt(startedAt)
                .updatedAt(now)
                .estimatedCompletion(estimate(now))
                .errorMessage(errorMessage)
                .build();
    }

    // Linear extrapolation from the average time per processed message
    private Instant estimate(Instant now) {
        if (phase.isTerminal() || processed == 0 || total <= processed) {
            return null;
        }
        long elapsedMillis = Duration.between(startedAt, now).toMillis();
        long remainingMillis = elapsedMillis * (total - processed) / processed;
        return now.plusMillis(remainingMillis);
    }

    private void publish() {
        publisher.accept(snapshot());
    }
}
