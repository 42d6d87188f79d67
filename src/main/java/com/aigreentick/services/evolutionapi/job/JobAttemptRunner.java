package com.aigreentick.services.evolutionapi.job;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a single attempt and applies the retry policy shared by every
 * {@link JobQueue}: retry while the job allows it and tries remain, call
 * {@link QueuedJob#failed(Throwable)} once otherwise.
 */
@Slf4j
final class JobAttemptRunner {

    private JobAttemptRunner() {
    }

    static AttemptOutcome run(QueuedJob job, int attempt) {
        try {
            job.handle(attempt);
            log.debug("Job {} succeeded on attempt {}/{}", job.getName(), attempt, job.getMaxTries());
            return AttemptOutcome.succeeded();
        } catch (Exception ex) {
            if (!job.shouldRetry(ex)) {
                log.warn("Job {} failed on attempt {} with a non-retryable error: {}",
                        job.getName(), attempt, ex.getMessage());
                return giveUp(job, ex);
            }
            if (attempt >= job.getMaxTries()) {
                log.error("Job {} exhausted after {} attempts: {}", job.getName(), attempt, ex.getMessage());
                return giveUp(job, ex);
            }
            AttemptOutcome retry = AttemptOutcome.retryAfter(job.getBackoff().delayBeforeRetry(attempt));
            log.warn("Job {} failed attempt {}/{}: {} - retrying in {}s",
                    job.getName(), attempt, job.getMaxTries(), ex.getMessage(), retry.getRetryDelay().toSeconds());
            job.retryScheduled(attempt + 1, retry.getRetryDelay());
            return retry;
        }
    }

    private static AttemptOutcome giveUp(QueuedJob job, Exception cause) {
        notifyFailed(job, cause);
        return AttemptOutcome.gaveUp();
    }

    /**
     * Calls {@link QueuedJob#failed(Throwable)}; an exception from the callback
     * is logged and does not reach the worker thread.
     */
    static void notifyFailed(QueuedJob job, Throwable cause) {
        try {
            job.failed(cause);
        } catch (RuntimeException ex) {
            log.error("Job {} failure callback threw: {}", job.getName(), ex.getMessage(), ex);
        }
    }
}
