package com.aigreentick.services.evolutionapi.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.util.Map;
import java.util.Set;

/**
 * Startup validation for the Evolution API configuration.
 *
 * A malformed server URL or an empty backoff table fails the context with
 * an actionable message. A missing API key or webhook secret only warns:
 * the service can still receive webhooks without the first, and an empty
 * secret is the documented way to switch verification off.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class EvolutionConfigValidator {

    private final EvolutionApiProperties properties;

    // Placeholder values that indicate config was not properly set
    private static final Set<String> PLACEHOLDER_VALUES = Set.of(
            "",
            "null",
            "undefined",
            "your-api-key",
            "${EVOLUTION_API_KEY}",
            "${EVOLUTION_WEBHOOK_SECRET}"
    );

    @PostConstruct
    public void validateEvolutionConfig() {
        log.info("Validating Evolution API configuration...");

        validateUrl("evolution-api.server-url", properties.getServerUrl());
        for (Map.Entry<String, EvolutionApiProperties.Connection> entry : properties.getConnections().entrySet()) {
            if (entry.getValue().getServerUrl() != null) {
                validateUrl("evolution-api.connections." + entry.getKey() + ".server-url",
                        entry.getValue().getServerUrl());
            }
        }

        EvolutionApiProperties.Queue queue = properties.getQueue();
        if (queue.getBackoff() == null || queue.getBackoff().isEmpty()) {
            throw new IllegalStateException("evolution-api.queue.backoff must list at least one duration");
        }
        if (queue.getMaxExceptions() < 1) {
            throw new IllegalStateException("evolution-api.queue.max-exceptions must be at least 1");
        }

        if (isNullOrPlaceholder(properties.getApiKey())) {
            log.warn("EVOLUTION_API_KEY is not set. Outbound calls to {} will be rejected " +
                    "until evolution-api.api-key is configured.", properties.getServerUrl());
        }

        EvolutionApiProperties.Webhook webhook = properties.getWebhook();
        if (webhook.isVerifySignature() && isNullOrPlaceholder(webhook.getSecret())) {
            log.warn("Webhook signature verification is enabled but no secret is configured. " +
                    "Inbound webhooks on {} are accepted WITHOUT verification. " +
                    "Set EVOLUTION_WEBHOOK_SECRET to enforce it.", webhook.getPath());
        }

        log.info("Evolution API configuration validated. server={}, queue={}, webhookQueue={}, webhookQueueing={}",
                properties.getServerUrl(), queue.getQueue(), queue.getWebhookQueue(), webhook.isQueue());
    }

    private void validateUrl(String configKey, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(configKey + " must be set, e.g. http://localhost:8080");
        }
        try {
            URI uri = URI.create(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("missing scheme or host");
            }
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(String.format(
                    "Invalid Evolution API URL for %s: '%s' (%s). Expected e.g. http://localhost:8080",
                    configKey, value, ex.getMessage()));
        }
    }

    private boolean isNullOrPlaceholder(String value) {
        if (value == null) return true;
        return PLACEHOLDER_VALUES.contains(value.trim());
    }
}
