package com.aigreentick.services.evolutionapi.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Wrapper around Evolution API responses.
 *
 * The server answers with different shapes per endpoint:
 *
 *   1. OBJECT (send*, connect, connectionState):
 *      { "key": { "id": "..." }, "status": "PENDING" }
 *      → getDataAsMap()
 *
 *   2. ARRAY (fetchInstances):
 *      [ { "instance": { "instanceName": "...", "status": "open" } } ]
 *      → getDataAsList()
 *
 * {@code data} is typed as Object for that reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvolutionApiResponse {

    private boolean success;
    private int statusCode;
    private Object data;
    private String message;

    public static EvolutionApiResponse success(int statusCode, Object data) {
        return EvolutionApiResponse.builder()
                .success(true)
                .statusCode(statusCode)
                .data(data)
                .build();
    }

    public static EvolutionApiResponse failure(int statusCode, String message) {
        return EvolutionApiResponse.builder()
                .success(false)
                .statusCode(statusCode)
                .message(message)
                .build();
    }

    /** Returns null if data is a List or absent */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getDataAsMap() {
        if (data instanceof Map) {
            return (Map<String, Object>) data;
        }
        return null;
    }

    /** Returns null if data is a Map or absent */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getDataAsList() {
        if (data instanceof List) {
            return (List<Map<String, Object>>) data;
        }
        return null;
    }
}
