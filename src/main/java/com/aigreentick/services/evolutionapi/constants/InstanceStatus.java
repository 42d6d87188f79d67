package com.aigreentick.services.evolutionapi.constants;

import java.util.Locale;

/**
 * Connection state of an Evolution API instance
 */
public enum InstanceStatus {
    OPEN("open"),
    CLOSE("close"),
    CONNECTING("connecting"),
    QRCODE("qrcode"),
    UNKNOWN("unknown");

    private final String value;

    InstanceStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isConnected() {
        return this == OPEN;
    }

    /**
     * Map the state strings the server reports (they differ between
     * webhook payloads and API versions) onto a status. Never throws.
     */
    public static InstanceStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "open", "connected" -> OPEN;
            case "close", "closed", "disconnected" -> CLOSE;
            case "connecting" -> CONNECTING;
            case "qrcode", "qr" -> QRCODE;
            default -> UNKNOWN;
        };
    }
}
