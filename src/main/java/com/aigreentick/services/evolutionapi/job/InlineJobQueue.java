package com.aigreentick.services.evolutionapi.job;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs jobs on the caller's thread.
 *
 * Attempts run back to back: the backoff delay is logged but not slept, so
 * a failing job finishes (and calls {@code failed}) before push returns.
 * Meant for development, commands and tests.
 */
@Slf4j
public class InlineJobQueue implements JobQueue {

    @Override
    public boolean isSynchronous() {
        return true;
    }

    @Override
    public void push(QueuedJob job) {
        log.debug("Running job {} inline on queue {}", job.getName(), job.getQueue());
        int attempt = 1;
        while (true) {
            AttemptOutcome outcome = JobAttemptRunner.run(job, attempt);
            if (outcome.getKind() != AttemptOutcome.Kind.RETRY) {
                return;
            }
            attempt++;
        }
    }
}
