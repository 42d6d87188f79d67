package com.aigreentick.services.evolutionapi.constants;

import com.aigreentick.services.evolutionapi.exception.UnsupportedMessageTypeException;

import java.util.Locale;

/**
 * Outbound message kinds a send job can dispatch
 */
public enum MessageType {
    TEXT("text"),
    MEDIA("media"),
    AUDIO("audio"),
    LOCATION("location");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MessageType fromValue(String value) {
        if (value != null) {
            String lower = value.trim().toLowerCase(Locale.ROOT);
            for (MessageType type : values()) {
                if (type.value.equals(lower)) {
                    return type;
                }
            }
        }
        throw new UnsupportedMessageTypeException(value);
    }
}
