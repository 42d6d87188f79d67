package com.aigreentick.services.evolutionapi.job;

/**
 * Lifecycle of a message send job.
 *
 * PENDING → SENDING → SUCCEEDED
 *                   → FAILED → PENDING (retry scheduled)
 *                            → EXHAUSTED (tries used up, or failure not retryable)
 */
public enum JobState {
    PENDING,
    SENDING,
    SUCCEEDED,
    FAILED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
