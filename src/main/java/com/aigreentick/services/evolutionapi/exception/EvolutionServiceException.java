package com.aigreentick.services.evolutionapi.exception;

import lombok.Getter;

/**
 * Base exception for all Evolution API service exceptions
 */
@Getter
public class EvolutionServiceException extends RuntimeException {

    private final String errorCode;

    public EvolutionServiceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public EvolutionServiceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
