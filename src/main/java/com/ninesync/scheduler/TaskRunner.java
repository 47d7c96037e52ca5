package com.ninesync.scheduler;

/**
 * Executes background tasks. Runs on a worker thread and may be interrupted when
 * the task is cancelled or times out.
 */
@FunctionalInterface
public interface TaskRunner {

    /**
     * @return result payload, never null
     */
    TaskResultData run(BackgroundTask task) throws Exception;
}
