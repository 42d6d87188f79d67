package com.aigreentick.services.evolutionapi.exception;

import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;

/**
 * Webhook body is not a JSON object or has no event name
 */
public class InvalidPayloadException extends EvolutionServiceException {

    public InvalidPayloadException() {
        super(EvolutionConstants.ERROR_INVALID_PAYLOAD, "INVALID_PAYLOAD");
    }

    public InvalidPayloadException(Throwable cause) {
        super(EvolutionConstants.ERROR_INVALID_PAYLOAD, "INVALID_PAYLOAD", cause);
    }
}
