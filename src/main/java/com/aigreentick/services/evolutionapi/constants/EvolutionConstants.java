package com.aigreentick.services.evolutionapi.constants;

/**
 * Application-wide constants for the Evolution API service
 */
public final class EvolutionConstants {

    private EvolutionConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // Webhook
    public static final String DEFAULT_WEBHOOK_PATH = "/api/evolution-api/webhook";
    public static final String WEBHOOK_SERVICE_NAME = "evolution-api-webhook";
    public static final String INSTANCE_PATH_PATTERN = "[a-zA-Z0-9_-]+";
    public static final String WILDCARD_EVENT = "*";

    // Signature headers, in priority order
    public static final String HEADER_WEBHOOK_SIGNATURE = "X-Webhook-Signature";
    public static final String HEADER_EVOLUTION_SIGNATURE = "X-Evolution-Signature";
    public static final String HEADER_SIGNATURE = "X-Signature";

    // Evolution API
    public static final String API_KEY_HEADER = "apikey";
    public static final String DEFAULT_CONNECTION = "default";
    public static final String DEFAULT_SERVER_URL = "http://localhost:8080";
    public static final String DEFAULT_INSTANCE = "default";

    // Queues
    public static final String DEFAULT_MESSAGE_QUEUE = "evolution-api";
    public static final String DEFAULT_WEBHOOK_QUEUE = "default";

    // Response status values
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_OK = "ok";

    // Messages
    public static final String MSG_WEBHOOK_QUEUED = "Webhook queued";
    public static final String MSG_WEBHOOK_PROCESSED = "Webhook processed";
    public static final String ERROR_INVALID_PAYLOAD = "Invalid payload";
    public static final String ERROR_MISSING_SIGNATURE = "Missing signature header";
    public static final String ERROR_INVALID_SIGNATURE = "Invalid signature";
}
