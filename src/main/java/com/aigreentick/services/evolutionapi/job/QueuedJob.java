package com.aigreentick.services.evolutionapi.job;

import java.time.Duration;

/**
 * Unit of work run by a {@link JobQueue}.
 *
 * The queue calls {@link #handle(int)} until it returns normally, the job
 * declines a retry, or {@link #getMaxTries()} attempts have failed. In the
 * last two cases {@link #failed(Throwable)} is called exactly once.
 */
public interface QueuedJob {

    /** Name used in logs */
    String getName();

    /** Queue (worker pool) the job runs on */
    String getQueue();

    int getMaxTries();

    BackoffSchedule getBackoff();

    /**
     * Run one attempt. Throwing marks the attempt as failed.
     *
     * @param attempt 1-based attempt number
     */
    void handle(int attempt) throws Exception;

    /** Called once when the job gives up */
    default void failed(Throwable cause) {
    }

    /** Whether a failure of this kind is worth another attempt */
    default boolean shouldRetry(Throwable cause) {
        return true;
    }

    /** Called when attempt {@code nextAttempt} has been scheduled */
    default void retryScheduled(int nextAttempt, Duration delay) {
    }
}
