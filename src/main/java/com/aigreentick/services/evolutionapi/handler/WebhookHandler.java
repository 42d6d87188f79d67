package com.aigreentick.services.evolutionapi.handler;

import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;

import java.util.Set;

/**
 * Event-specific webhook logic. Every bean of this type is registered with
 * the WebhookProcessor at startup under the events it names.
 *
 * Throwing fails the webhook: the sender receives a 500 with the message.
 */
public interface WebhookHandler {

    /**
     * Canonical event names (e.g. MESSAGES_UPSERT) this handler runs for.
     * "*" runs it for every event.
     */
    Set<String> events();

    void handle(WebhookPayload payload);
}
