package com.aigreentick.services.evolutionapi.dto.response;

import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body of the webhook endpoints.
 *
 * The Evolution API server only looks at the HTTP status, but operators
 * read these bodies in the server's webhook logs, so the shape is fixed:
 * {@code {status, message}}, plus {@code service} and {@code timestamp}
 * on the health probe.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {

    private String status;
    private String message;
    private String service;
    private String timestamp;

    public static StatusResponse success(String message) {
        return StatusResponse.builder()
                .status(EvolutionConstants.STATUS_SUCCESS)
                .message(message)
                .build();
    }

    public static StatusResponse error(String message) {
        return StatusResponse.builder()
                .status(EvolutionConstants.STATUS_ERROR)
                .message(message)
                .build();
    }
}
