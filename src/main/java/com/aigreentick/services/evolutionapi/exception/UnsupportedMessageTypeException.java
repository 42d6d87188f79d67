package com.aigreentick.services.evolutionapi.exception;

/**
 * Message type outside text, media, audio and location. Raised before any
 * network call; a job failing with it is never retried.
 */
public class UnsupportedMessageTypeException extends EvolutionServiceException {

    public UnsupportedMessageTypeException(String type) {
        super("Unsupported message type: " + type, "UNSUPPORTED_MESSAGE_TYPE");
    }
}
