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
 * Body of POST message/sendWhatsAppAudio/{instance} (voice note)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendAudioRequest {

    @NotBlank(message = "Recipient number is required")
    private String number;

    /** URL or base64 content */
    @NotBlank(message = "Audio is required")
    private String audio;

    @PositiveOrZero
    private Integer delay;
}
