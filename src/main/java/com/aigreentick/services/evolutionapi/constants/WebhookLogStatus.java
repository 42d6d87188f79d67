package com.aigreentick.services.evolutionapi.constants;

/**
 * Outcome of one webhook processing run
 */
public enum WebhookLogStatus {
    PROCESSED,
    FAILED
}
