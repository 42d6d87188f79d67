package com.aigreentick.services.evolutionapi.controller;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import com.aigreentick.services.evolutionapi.dto.response.StatusResponse;
import com.aigreentick.services.evolutionapi.exception.InvalidPayloadException;
import com.aigreentick.services.evolutionapi.exception.WebhookVerificationException;
import com.aigreentick.services.evolutionapi.service.DispatchResult;
import com.aigreentick.services.evolutionapi.service.SignatureVerification;
import com.aigreentick.services.evolutionapi.service.WebhookDispatcher;
import com.aigreentick.services.evolutionapi.service.WebhookSignatureVerifier;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Webhook Controller for Evolution API events.
 *
 * Security:
 *   POST : HMAC-SHA256 signature over the raw body (X-Webhook-Signature,
 *          X-Evolution-Signature or X-Signature). Checked before the body is parsed.
 *   GET /health : unauthenticated liveness probe.
 *
 * Flow: Controller verifies → WebhookDispatcher queues or processes inline
 *       → 200 "Webhook queued" / "Webhook processed".
 */
@RestController
@RequestMapping("${evolution-api.webhook.path:" + EvolutionConstants.DEFAULT_WEBHOOK_PATH + "}")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Evolution API webhook endpoint")
public class WebhookController {

    private final WebhookDispatcher dispatcher;
    private final WebhookSignatureVerifier signatureVerifier;
    private final EvolutionApiProperties properties;
    private final ObjectMapper objectMapper;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * POST : Receive Evolution API webhook events.
     *
     * Raw body is read as bytes so the HMAC is computed over exactly what was sent.
     */
    @PostMapping
    @Operation(summary = "Receive Evolution API webhook events")
    public ResponseEntity<StatusResponse> handleWebhook(
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader HttpHeaders headers) {
        return receive(rawBody, headers, null);
    }

    /**
     * POST : Same as above; the path segment names the instance when the
     * body carries neither instance nor instanceName.
     */
    @PostMapping("/{instance:" + EvolutionConstants.INSTANCE_PATH_PATTERN + "}")
    @Operation(summary = "Receive Evolution API webhook events for an instance")
    public ResponseEntity<StatusResponse> handleInstanceWebhook(
            @PathVariable("instance") String instance,
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader HttpHeaders headers) {
        return receive(rawBody, headers, instance);
    }

    @GetMapping("/health")
    @Operation(summary = "Webhook receiver liveness probe")
    public ResponseEntity<StatusResponse> health() {
        return ResponseEntity.ok(StatusResponse.builder()
                .status(EvolutionConstants.STATUS_OK)
                .service(EvolutionConstants.WEBHOOK_SERVICE_NAME)
                .timestamp(Instant.now().toString())
                .build());
    }

    // ───────────────────────────────────────────────────────────
    // PRIVATE HELPERS
    // ───────────────────────────────────────────────────────────

    private ResponseEntity<StatusResponse> receive(byte[] rawBody, HttpHeaders headers, String instance) {
        log.debug("Webhook received: instance={}, bytes={}", instance, rawBody == null ? 0 : rawBody.length);

        verifySignature(rawBody, headers);

        DispatchResult result = dispatcher.handle(parsePayload(rawBody), instance);
        return ResponseEntity.ok(StatusResponse.success(result.getMessage()));
    }

    private void verifySignature(byte[] rawBody, HttpHeaders headers) {
        EvolutionApiProperties.Webhook webhook = properties.getWebhook();
        SignatureVerification verification = signatureVerifier.verify(
                rawBody, headers, webhook.getSecret(), webhook.isVerifySignature());
        if (!verification.isAllowed()) {
            throw new WebhookVerificationException(verification.getReason());
        }
    }

    private Map<String, Object> parsePayload(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            throw new InvalidPayloadException();
        }
        try {
            return objectMapper.readValue(rawBody, MAP_TYPE);
        } catch (IOException ex) {
            log.warn("Webhook JSON parse error: {}", ex.getMessage());
            throw new InvalidPayloadException(ex);
        }
    }
}
