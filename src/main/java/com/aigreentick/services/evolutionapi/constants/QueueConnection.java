package com.aigreentick.services.evolutionapi.constants;

/**
 * Job queue backend selected by {@code evolution-api.queue.connection}
 */
public enum QueueConnection {
    /** Jobs run on a scheduler thread pool, retries scheduled after the backoff delay */
    ASYNC,
    /** Jobs run on the caller's thread, retries back to back */
    SYNC
}
