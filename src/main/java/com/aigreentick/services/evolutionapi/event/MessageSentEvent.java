package com.aigreentick.services.evolutionapi.event;

import lombok.Value;

import java.util.Map;

/**
 * A message left through the Evolution API.
 *
 * Raised by a send job when the API accepts the message, and by the
 * send.message webhook the server emits afterwards ({@code fromWebhook}).
 * Listeners that persist sends should only take the first kind or they
 * will record every message twice.
 */
@Value
public class MessageSentEvent {
    String instanceName;
    String messageType;
    String recipient;
    Map<String, Object> message;
    Map<String, Object> response;
    boolean fromWebhook;

    /** Message id assigned by WhatsApp, when the response carries one */
    public String getMessageId() {
        if (response != null && response.get("key") instanceof Map<?, ?> key && key.get("id") != null) {
            return String.valueOf(key.get("id"));
        }
        return null;
    }
}
