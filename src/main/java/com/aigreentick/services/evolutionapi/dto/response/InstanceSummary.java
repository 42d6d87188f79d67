package com.aigreentick.services.evolutionapi.dto.response;

import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One entry of fetchInstances, flattened.
 *
 * v1 servers answer {@code [{"instance": {"instanceName", "status", "owner", ...}}]},
 * v2 servers {@code [{"name", "connectionStatus", "ownerJid", ...}]}. Both are read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstanceSummary {

    private String name;
    private String rawStatus;
    private InstanceStatus status;
    private String owner;
    private String profileName;
    private String profilePictureUrl;

    @SuppressWarnings("unchecked")
    public static InstanceSummary from(Map<String, Object> entry) {
        Map<String, Object> source = entry.get("instance") instanceof Map<?, ?> nested
                ? (Map<String, Object>) nested
                : entry;

        String rawStatus = first(source, "status", "connectionStatus", "state");
        return InstanceSummary.builder()
                .name(first(source, "instanceName", "name"))
                .rawStatus(rawStatus)
                .status(InstanceStatus.fromValue(rawStatus))
                .owner(first(source, "owner", "ownerJid", "number"))
                .profileName(first(source, "profileName"))
                .profilePictureUrl(first(source, "profilePictureUrl", "profilePicUrl"))
                .build();
    }

    /** Phone number part of the owner JID */
    public String getPhoneNumber() {
        if (owner == null) {
            return null;
        }
        int at = owner.indexOf('@');
        return at >= 0 ? owner.substring(0, at) : owner;
    }

    private static String first(Map<String, Object> source, String... keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }
}
