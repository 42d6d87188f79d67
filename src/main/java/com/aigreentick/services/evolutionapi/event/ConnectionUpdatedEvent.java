package com.aigreentick.services.evolutionapi.event;

import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import lombok.Value;

@Value
public class ConnectionUpdatedEvent {
    String instanceName;
    InstanceStatus status;
    String rawState;
    WebhookPayload payload;
}
