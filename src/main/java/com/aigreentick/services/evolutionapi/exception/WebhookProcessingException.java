package com.aigreentick.services.evolutionapi.exception;

/**
 * A webhook handler failed. The message of the original failure is kept so
 * the sender sees it in the 500 response.
 */
public class WebhookProcessingException extends EvolutionServiceException {

    public WebhookProcessingException(String message, Throwable cause) {
        super(message, "WEBHOOK_PROCESSING_FAILED", cause);
    }
}
