package com.aigreentick.services.evolutionapi.event;

import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import lombok.Value;

@Value
public class MessageReadEvent {
    String instanceName;
    String messageId;
    String remoteJid;
    WebhookPayload payload;
}
