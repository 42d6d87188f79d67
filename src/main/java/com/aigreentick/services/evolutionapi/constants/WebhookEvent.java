package com.aigreentick.services.evolutionapi.constants;

import java.util.Locale;

/**
 * Webhook events emitted by the Evolution API server.
 *
 * The server sends names either as constants ({@code MESSAGES_UPSERT}) or
 * dotted ({@code messages.upsert}); both normalize to the same value.
 */
public enum WebhookEvent {
    APPLICATION_STARTUP,
    QRCODE_UPDATED,
    CONNECTION_UPDATE,
    MESSAGES_SET,
    MESSAGES_UPSERT,
    MESSAGES_UPDATE,
    MESSAGES_DELETE,
    SEND_MESSAGE,
    CONTACTS_SET,
    CONTACTS_UPSERT,
    CONTACTS_UPDATE,
    PRESENCE_UPDATE,
    CHATS_SET,
    CHATS_UPSERT,
    CHATS_UPDATE,
    CHATS_DELETE,
    GROUPS_UPSERT,
    GROUP_UPDATE,
    GROUP_PARTICIPANTS_UPDATE,
    CALL,
    LABELS_EDIT,
    LABELS_ASSOCIATION,
    TYPEBOT_START,
    TYPEBOT_CHANGE_STATUS,
    UNKNOWN;

    /**
     * Canonical form of a raw event name: trimmed, uppercased, dots and
     * dashes replaced by underscores.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public static WebhookEvent fromString(String raw) {
        String normalized = normalize(raw);
        for (WebhookEvent event : values()) {
            if (event.name().equals(normalized)) {
                return event;
            }
        }
        return UNKNOWN;
    }
}
