package com.aigreentick.services.evolutionapi.constants;

/**
 * Delivery status of a logged message
 */
public enum MessageStatus {
    PENDING,
    SENT,
    DELIVERED,
    READ,
    FAILED
}
