package com.aigreentick.services.evolutionapi.exception;

/**
 * Thrown when an inbound webhook fails signature verification
 */
public class WebhookVerificationException extends EvolutionServiceException {

    public WebhookVerificationException(String message) {
        super(message, "WEBHOOK_VERIFICATION_FAILED");
    }
}
