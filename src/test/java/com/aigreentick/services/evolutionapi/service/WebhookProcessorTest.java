package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.WebhookLogStatus;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.entity.EvolutionWebhookLog;
import com.aigreentick.services.evolutionapi.event.WebhookReceivedEvent;
import com.aigreentick.services.evolutionapi.exception.WebhookProcessingException;
import com.aigreentick.services.evolutionapi.handler.WebhookHandler;
import com.aigreentick.services.evolutionapi.repository.EvolutionWebhookLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookProcessorTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private EvolutionWebhookLogRepository webhookLogRepository;

    @Mock
    private WebhookHandler upsertHandler;

    @Mock
    private WebhookHandler wildcardHandler;

    private final EvolutionApiProperties properties = new EvolutionApiProperties();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private WebhookProcessor processor;

    @BeforeEach
    void setUp() {
        when(upsertHandler.events()).thenReturn(Set.of("messages.upsert"));
        when(wildcardHandler.events()).thenReturn(Set.of("*"));
        processor = new WebhookProcessor(List.of(upsertHandler, wildcardHandler),
                eventPublisher, webhookLogRepository, properties, clock);
    }

    private static WebhookPayload payload(String event) {
        return WebhookPayload.from(Map.of("event", event, "instance", "sales", "data", Map.of("state", "open")));
    }

    @Test
    void testProcess_RoutesByNormalizedEventThenWildcard() {
        WebhookPayload payload = payload("MESSAGES_UPSERT");

        processor.process(payload);

        InOrder order = inOrder(eventPublisher, upsertHandler, wildcardHandler);
        order.verify(eventPublisher).publishEvent(any(WebhookReceivedEvent.class));
        order.verify(upsertHandler).handle(payload);
        order.verify(wildcardHandler).handle(payload);
    }

    @Test
    void testProcess_WhenNoHandlerForEvent_OnlyWildcardRuns() {
        WebhookPayload payload = payload("presence.update");

        assertDoesNotThrow(() -> processor.process(payload));

        verify(upsertHandler, never()).handle(any());
        verify(wildcardHandler).handle(payload);
    }

    @Test
    void testProcess_WhenHandlerFails_ThrowsProcessingException() {
        WebhookPayload payload = payload("messages.upsert");
        doThrow(new IllegalStateException("db down")).when(upsertHandler).handle(payload);

        WebhookProcessingException ex = assertThrows(WebhookProcessingException.class,
                () -> processor.process(payload));

        assertEquals("db down", ex.getMessage());
        verify(wildcardHandler, never()).handle(any());
        verifyNoInteractions(webhookLogRepository);
    }

    @Test
    void testProcess_WhenStoreWebhooksEnabled_RecordsOutcome() {
        properties.getDatabase().setStoreWebhooks(true);
        WebhookPayload failing = payload("messages.upsert");
        doThrow(new IllegalStateException("db down")).when(upsertHandler).handle(failing);

        processor.process(payload("connection.update"));
        assertThrows(WebhookProcessingException.class, () -> processor.process(failing));

        ArgumentCaptor<EvolutionWebhookLog> logs = ArgumentCaptor.forClass(EvolutionWebhookLog.class);
        verify(webhookLogRepository, times(2)).save(logs.capture());
        assertEquals(WebhookLogStatus.PROCESSED, logs.getAllValues().get(0).getStatus());
        assertEquals("CONNECTION_UPDATE", logs.getAllValues().get(0).getEvent());
        assertEquals(WebhookLogStatus.FAILED, logs.getAllValues().get(1).getStatus());
        assertEquals("db down", logs.getAllValues().get(1).getErrorMessage());
    }

    @Test
    void testProcess_WhenLogStoreFails_WebhookStillSucceeds() {
        properties.getDatabase().setStoreWebhooks(true);
        when(webhookLogRepository.save(any())).thenThrow(new IllegalStateException("table missing"));

        assertDoesNotThrow(() -> processor.process(payload("messages.upsert")));
    }

    @Test
    void testHandlersFor_UsesNormalizedRegistrationKeys() {
        assertEquals(List.of(upsertHandler, wildcardHandler), processor.handlersFor("MESSAGES_UPSERT"));
        assertEquals(List.of(wildcardHandler), processor.handlersFor("CALL"));
    }
}
