package com.aigreentick.services.evolutionapi.event;

import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import lombok.Value;

/**
 * Published once for every valid webhook, before event-specific handlers run
 */
@Value
public class WebhookReceivedEvent {
    WebhookPayload payload;
}
