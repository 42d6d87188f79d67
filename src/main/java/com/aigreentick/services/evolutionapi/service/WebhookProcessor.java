package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import com.aigreentick.services.evolutionapi.constants.WebhookEvent;
import com.aigreentick.services.evolutionapi.constants.WebhookLogStatus;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.entity.EvolutionWebhookLog;
import com.aigreentick.services.evolutionapi.event.WebhookReceivedEvent;
import com.aigreentick.services.evolutionapi.exception.WebhookProcessingException;
import com.aigreentick.services.evolutionapi.handler.WebhookHandler;
import com.aigreentick.services.evolutionapi.repository.EvolutionWebhookLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Processor for normalized Evolution API webhooks
 *
 * For each payload:
 * 1. WebhookReceivedEvent for generic observers
 * 2. handlers registered for the event, then the "*" handlers
 * 3. optional evolution_webhook_logs row (store-webhooks)
 *
 * The event → handler table is built once from the WebhookHandler beans.
 * Events without handlers are ignored. A handler failure is NOT swallowed:
 * it is logged and rethrown as WebhookProcessingException.
 *
 * NOTE: Not @Transactional. Handlers that write open their own transaction,
 * so the failure log row survives a handler rollback.
 */
@Service
@Slf4j
public class WebhookProcessor {

    private final ApplicationEventPublisher eventPublisher;
    private final EvolutionWebhookLogRepository webhookLogRepository;
    private final EvolutionApiProperties properties;
    private final Clock clock;

    private final Map<String, List<WebhookHandler>> handlersByEvent;
    private final List<WebhookHandler> wildcardHandlers;

    public WebhookProcessor(List<WebhookHandler> handlers,
                            ApplicationEventPublisher eventPublisher,
                            EvolutionWebhookLogRepository webhookLogRepository,
                            EvolutionApiProperties properties,
                            Clock clock) {
        this.eventPublisher = eventPublisher;
        this.webhookLogRepository = webhookLogRepository;
        this.properties = properties;
        this.clock = clock;

        Map<String, List<WebhookHandler>> byEvent = new HashMap<>();
        List<WebhookHandler> wildcard = new ArrayList<>();
        for (WebhookHandler handler : handlers) {
            for (String event : handler.events()) {
                if (EvolutionConstants.WILDCARD_EVENT.equals(event)) {
                    wildcard.add(handler);
                } else {
                    byEvent.computeIfAbsent(WebhookEvent.normalize(event), key -> new ArrayList<>()).add(handler);
                }
            }
        }
        byEvent.replaceAll((event, list) -> List.copyOf(list));
        this.handlersByEvent = Collections.unmodifiableMap(byEvent);
        this.wildcardHandlers = List.copyOf(wildcard);

        log.info("Webhook handlers registered: events={}, wildcard={}",
                handlersByEvent.keySet(), wildcardHandlers.size());
    }

    public void process(WebhookPayload payload) {
        long startedAt = clock.millis();
        String event = payload.getNormalizedEvent();
        log.info("Processing webhook: event={}, instance={}", event, payload.getInstanceName());

        try {
            eventPublisher.publishEvent(new WebhookReceivedEvent(payload));

            List<WebhookHandler> handlers = handlersFor(event);
            if (handlers.isEmpty()) {
                log.debug("No handler for webhook event: {}", event);
            }
            for (WebhookHandler handler : handlers) {
                handler.handle(payload);
            }

            recordLog(payload, WebhookLogStatus.PROCESSED, null, startedAt);
        } catch (RuntimeException ex) {
            log.error("Webhook processing failed: event={}, instance={}: {}",
                    event, payload.getInstanceName(), ex.getMessage(), ex);
            recordLog(payload, WebhookLogStatus.FAILED, ex.getMessage(), startedAt);
            if (ex instanceof WebhookProcessingException processingException) {
                throw processingException;
            }
            throw new WebhookProcessingException(
                    ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), ex);
        }
    }

    List<WebhookHandler> handlersFor(String normalizedEvent) {
        List<WebhookHandler> specific = handlersByEvent.getOrDefault(normalizedEvent, List.of());
        if (wildcardHandlers.isEmpty()) {
            return specific;
        }
        List<WebhookHandler> all = new ArrayList<>(specific);
        all.addAll(wildcardHandlers);
        return all;
    }

    private void recordLog(WebhookPayload payload, WebhookLogStatus status, String error, long startedAt) {
        if (!properties.getDatabase().isStoreWebhooks()) {
            return;
        }
        try {
            webhookLogRepository.save(EvolutionWebhookLog.builder()
                    .instanceName(payload.getInstanceName())
                    .event(payload.getNormalizedEvent())
                    .payload(payload.getRaw())
                    .status(status)
                    .errorMessage(error)
                    .processingTimeMs(clock.millis() - startedAt)
                    .build());
        } catch (RuntimeException ex) {
            // the webhook outcome must not depend on the audit table
            log.error("Could not store webhook log: event={}: {}", payload.getNormalizedEvent(), ex.getMessage());
        }
    }
}
