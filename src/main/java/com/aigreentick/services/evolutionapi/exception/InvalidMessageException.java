package com.aigreentick.services.evolutionapi.exception;

/**
 * Outbound message body failed validation (missing number, empty text...)
 */
public class InvalidMessageException extends EvolutionServiceException {

    public InvalidMessageException(String message) {
        super(message, "INVALID_MESSAGE");
    }
}
