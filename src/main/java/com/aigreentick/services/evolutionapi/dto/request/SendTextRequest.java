package com.aigreentick.services.evolutionapi.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST message/sendText/{instance}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendTextRequest {

    /** Recipient: phone number with country code, or a group JID */
    @NotBlank(message = "Recipient number is required")
    private String number;

    @NotBlank(message = "Text is required")
    private String text;

    /** Typing simulation before sending, in milliseconds */
    @PositiveOrZero
    private Integer delay;

    private Boolean linkPreview;
}
