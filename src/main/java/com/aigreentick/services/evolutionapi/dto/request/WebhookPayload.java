package com.aigreentick.services.evolutionapi.dto.request;

import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import com.aigreentick.services.evolutionapi.constants.WebhookEvent;
import com.aigreentick.services.evolutionapi.exception.InvalidPayloadException;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized Evolution API webhook: event name, instance and event data.
 *
 * The server is not consistent about where it puts things. Depending on the
 * version and event the instance arrives as {@code instance} or
 * {@code instanceName}, and the interesting fields sit either under
 * {@code data} or at the top level. The accessors below try the known
 * locations in order.
 */
@Getter
public class WebhookPayload {

    private static final List<String> RESERVED_KEYS = List.of("event", "instance", "instanceName");

    private final String event;
    private final String instanceName;
    private final Map<String, Object> data;
    private final Map<String, Object> raw;

    private WebhookPayload(String event, String instanceName, Map<String, Object> data, Map<String, Object> raw) {
        this.event = event;
        this.instanceName = instanceName;
        this.data = data;
        this.raw = raw;
    }

    /**
     * @throws InvalidPayloadException when {@code event} is missing or empty
     */
    public static WebhookPayload from(Map<String, Object> raw) {
        if (raw == null) {
            throw new InvalidPayloadException();
        }
        Object event = raw.get("event");
        if (!(event instanceof String name) || name.isBlank()) {
            throw new InvalidPayloadException();
        }

        String instance = firstNonEmpty(raw.get("instance"), raw.get("instanceName"));

        Map<String, Object> data;
        if (raw.get("data") instanceof Map<?, ?>) {
            data = asMap(raw.get("data"));
        } else {
            data = new LinkedHashMap<>(raw);
            RESERVED_KEYS.forEach(data::remove);
        }

        return new WebhookPayload(name, instance,
                Collections.unmodifiableMap(data), Collections.unmodifiableMap(raw));
    }

    public WebhookEvent getEventType() {
        return WebhookEvent.fromString(event);
    }

    /** Event name in canonical form, e.g. MESSAGES_UPSERT */
    public String getNormalizedEvent() {
        return WebhookEvent.normalize(event);
    }

    // ========================
    // PATH ACCESS
    // ========================

    /**
     * Read a dot-separated path from the raw payload, e.g. {@code data.key.id}.
     * Returns null when any segment is missing or not an object.
     */
    public Object get(String path) {
        Object current = raw;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    public String getString(String... paths) {
        for (String path : paths) {
            Object value = get(path);
            if (value != null && !String.valueOf(value).isEmpty()) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    // ========================
    // MESSAGE EVENTS
    // ========================

    public String getRemoteJid() {
        return getString("data.key.remoteJid", "key.remoteJid", "data.remoteJid", "remoteJid");
    }

    public String getMessageId() {
        return getString("data.key.id", "key.id", "data.keyId", "data.id", "id");
    }

    public boolean isFromMe() {
        Object fromMe = get("data.key.fromMe");
        if (fromMe == null) {
            fromMe = get("key.fromMe");
        }
        return Boolean.TRUE.equals(fromMe) || "true".equals(String.valueOf(fromMe));
    }

    public boolean isGroupMessage() {
        String jid = getRemoteJid();
        return jid != null && jid.endsWith("@g.us");
    }

    /** Phone number part of the remote JID */
    public String getSenderNumber() {
        String jid = getRemoteJid();
        if (jid == null) {
            return null;
        }
        int at = jid.indexOf('@');
        return at >= 0 ? jid.substring(0, at) : jid;
    }

    public String getPushName() {
        return getString("data.pushName", "pushName");
    }

    public Map<String, Object> getMessageContent() {
        Object message = get("data.message");
        if (message == null) {
            message = get("message");
        }
        return message instanceof Map<?, ?> ? asMap(message) : Map.of();
    }

    /**
     * Message kind derived from the content keys (conversation, imageMessage...).
     */
    public String getMessageType() {
        Map<String, Object> content = getMessageContent();
        if (content.containsKey("conversation") || content.containsKey("extendedTextMessage")) return "text";
        if (content.containsKey("imageMessage")) return "image";
        if (content.containsKey("videoMessage")) return "video";
        if (content.containsKey("audioMessage")) return "audio";
        if (content.containsKey("documentMessage")) return "document";
        if (content.containsKey("stickerMessage")) return "sticker";
        if (content.containsKey("locationMessage")) return "location";
        if (content.containsKey("contactMessage")) return "contact";
        if (content.containsKey("reactionMessage")) return "reaction";
        String declared = getString("data.messageType", "messageType");
        return declared != null ? declared : "unknown";
    }

    /** Text body of a text message, or the caption of a media message */
    public String getText() {
        Map<String, Object> content = getMessageContent();
        if (content.get("conversation") instanceof String text) {
            return text;
        }
        for (String key : List.of("extendedTextMessage", "imageMessage", "videoMessage", "documentMessage")) {
            if (content.get(key) instanceof Map<?, ?> inner) {
                Object text = inner.get("text") != null ? inner.get("text") : inner.get("caption");
                if (text != null) {
                    return String.valueOf(text);
                }
            }
        }
        return null;
    }

    /** Raw ack value of a messages.update event: numeric code or name */
    public String getMessageStatus() {
        return getString("data.status", "status", "data.update.status");
    }

    // ========================
    // CONNECTION EVENTS
    // ========================

    public String getConnectionState() {
        return getString("data.state", "state", "data.status", "status");
    }

    public InstanceStatus getInstanceStatus() {
        return InstanceStatus.fromValue(getConnectionState());
    }

    public String getQrCode() {
        return getString("data.qrcode.base64", "qrcode.base64", "data.qrcode.code", "data.base64", "base64");
    }

    public String getPairingCode() {
        return getString("data.qrcode.pairingCode", "qrcode.pairingCode", "data.pairingCode", "pairingCode");
    }

    // ========================
    // SAFE CAST HELPERS
    // ========================

    private static String firstNonEmpty(Object... values) {
        for (Object value : values) {
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
