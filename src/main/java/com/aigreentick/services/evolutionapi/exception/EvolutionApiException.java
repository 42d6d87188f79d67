package com.aigreentick.services.evolutionapi.exception;

import lombok.Getter;

/**
 * Thrown when the Evolution API server returns an error or is unavailable
 *
 * Has two types:
 * - EvolutionApiException: server errors (5xx) and I/O failures, retryable
 * - EvolutionApiException.ClientException: client errors (4xx), NOT retried
 */
@Getter
public class EvolutionApiException extends EvolutionServiceException {

    private final int httpStatus;

    public EvolutionApiException(String message) {
        super(message, "EVOLUTION_API_ERROR");
        this.httpStatus = 503;
    }

    public EvolutionApiException(String message, int httpStatus) {
        super(message, "EVOLUTION_API_ERROR");
        this.httpStatus = httpStatus;
    }

    public EvolutionApiException(String message, Throwable cause) {
        super(message, "EVOLUTION_API_ERROR", cause);
        this.httpStatus = 503;
    }

    public static EvolutionApiException serviceUnavailable() {
        return new EvolutionApiException(
                "Evolution API is temporarily unavailable. Please try again later."
        );
    }

    public static EvolutionApiException unauthorized() {
        return new ClientException(
                "Evolution API rejected the API key. Check evolution-api.api-key.", 401
        );
    }

    // ========================
    // INNER CLASS
    // 4xx errors: do NOT retry
    // ========================

    /**
     * Represents a 4xx client error from the Evolution API
     * These should NOT be retried (bad request, invalid key, etc.)
     */
    @Getter
    public static class ClientException extends EvolutionApiException {

        public ClientException(String message, int httpStatus) {
            super(message, httpStatus);
        }
    }
}
