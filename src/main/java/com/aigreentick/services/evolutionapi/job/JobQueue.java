package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.exception.JobDispatchException;

/**
 * Accepts jobs for execution. Implementations are selected by
 * {@code evolution-api.queue.connection}.
 */
public interface JobQueue {

    /**
     * @throws JobDispatchException when the queue cannot accept the job
     */
    void push(QueuedJob job);

    /** True when push runs the job on the calling thread before returning */
    default boolean isSynchronous() {
        return false;
    }
}
