package com.aigreentick.services.evolutionapi.event;

import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import lombok.Value;

/**
 * WhatsApp message seen on an instance (messages.upsert). fromMe is set for
 * messages sent from the phone or another client of the same instance.
 */
@Value
public class MessageReceivedEvent {
    String instanceName;
    String messageId;
    String remoteJid;
    String messageType;
    String text;
    boolean group;
    boolean fromMe;
    WebhookPayload payload;
}
