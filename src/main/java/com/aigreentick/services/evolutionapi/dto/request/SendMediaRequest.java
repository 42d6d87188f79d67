package com.aigreentick.services.evolutionapi.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST message/sendMedia/{instance}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendMediaRequest {

    @NotBlank(message = "Recipient number is required")
    private String number;

    @NotBlank(message = "Media type is required")
    @Pattern(regexp = "image|video|document|audio", message = "Media type must be image, video, document or audio")
    private String mediatype;

    /** URL or base64 content */
    @NotBlank(message = "Media is required")
    private String media;

    private String mimetype;
    private String caption;
    private String fileName;

    @PositiveOrZero
    private Integer delay;
}
