package com.aigreentick.services.evolutionapi.exception;

/**
 * The job queue could not accept a job (pool shut down, queue full).
 * Callers decide whether to fall back to inline execution.
 */
public class JobDispatchException extends EvolutionServiceException {

    public JobDispatchException(String message, Throwable cause) {
        super(message, "JOB_DISPATCH_FAILED", cause);
    }
}
