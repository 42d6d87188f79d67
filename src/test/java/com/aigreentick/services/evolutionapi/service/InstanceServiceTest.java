package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.dto.response.InstanceSummary;
import com.aigreentick.services.evolutionapi.entity.EvolutionInstance;
import com.aigreentick.services.evolutionapi.event.InstanceStatusChangedEvent;
import com.aigreentick.services.evolutionapi.repository.EvolutionInstanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InstanceServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private EvolutionApiClient client;

    @Mock
    private EvolutionInstanceRepository instanceRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final EvolutionApiProperties properties = new EvolutionApiProperties();

    private InstanceService instanceService;

    @BeforeEach
    void setUp() {
        instanceService = new InstanceService(client, instanceRepository, eventPublisher, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testFetchSummaries_ReadsV1AndV2Shapes() {
        when(client.fetchInstances(null)).thenReturn(EvolutionApiResponse.success(200, List.of(
                Map.of("instance", Map.of("instanceName", "sales", "status", "open", "owner", "5511@s.whatsapp.net")),
                Map.of("name", "support", "connectionStatus", "close"),
                Map.of("nameless", true))));

        List<InstanceSummary> summaries = instanceService.fetchSummaries(null);

        assertEquals(2, summaries.size());
        assertEquals("sales", summaries.get(0).getName());
        assertEquals(InstanceStatus.OPEN, summaries.get(0).getStatus());
        assertEquals("5511", summaries.get(0).getPhoneNumber());
        assertEquals(InstanceStatus.CLOSE, summaries.get(1).getStatus());
    }

    @Test
    void testSyncInstances_UpsertsByNameAndPublishesChanges() {
        when(client.fetchInstances("eu")).thenReturn(EvolutionApiResponse.success(200, List.of(
                Map.of("name", "sales", "connectionStatus", "open"),
                Map.of("name", "support", "connectionStatus", "close"))));
        EvolutionInstance existing = EvolutionInstance.builder().id(7L).name("sales").status(InstanceStatus.OPEN).build();
        when(instanceRepository.findByName("sales")).thenReturn(Optional.of(existing));
        when(instanceRepository.findByName("support")).thenReturn(Optional.empty());

        int synced = instanceService.syncInstances("eu");

        assertEquals(2, synced);
        verify(instanceRepository, times(2)).save(any(EvolutionInstance.class));
        ArgumentCaptor<InstanceStatusChangedEvent> event = ArgumentCaptor.forClass(InstanceStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals("support", event.getValue().getInstanceName());
        assertNull(event.getValue().getPrevious());
        assertEquals(InstanceStatus.CLOSE, event.getValue().getCurrent());
    }

    @Test
    void testRecordStatus_WhenStoredAndChanged_UpdatesAndPublishes() {
        EvolutionInstance existing = EvolutionInstance.builder().id(7L).name("sales").status(InstanceStatus.OPEN).build();
        when(instanceRepository.findByName("sales")).thenReturn(Optional.of(existing));

        InstanceStatus previous = instanceService.recordStatus("sales", InstanceStatus.CLOSE);

        assertEquals(InstanceStatus.OPEN, previous);
        verify(instanceRepository).updateStatus("sales", InstanceStatus.CLOSE, LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(eventPublisher).publishEvent(new InstanceStatusChangedEvent("sales", InstanceStatus.OPEN, InstanceStatus.CLOSE));
    }

    @Test
    void testRecordStatus_WhenUnchanged_DoesNotPublish() {
        EvolutionInstance existing = EvolutionInstance.builder().id(7L).name("sales").status(InstanceStatus.OPEN).build();
        when(instanceRepository.findByName("sales")).thenReturn(Optional.of(existing));

        instanceService.recordStatus("sales", InstanceStatus.OPEN);

        verifyNoInteractions(eventPublisher);
    }

    @Test
    void testRecordStatus_WhenUnknownAndStoringDisabled_OnlyPublishes() {
        properties.getDatabase().setStoreInstances(false);
        when(instanceRepository.findByName("new")).thenReturn(Optional.empty());

        instanceService.recordStatus("new", InstanceStatus.QRCODE);

        verify(instanceRepository, never()).save(any());
        verify(instanceRepository, never()).updateStatus(any(), any(), any());
        verify(eventPublisher).publishEvent(any(InstanceStatusChangedEvent.class));
    }

    @Test
    void testRecordStatus_WhenInstanceNameMissing_DoesNothing() {
        assertNull(instanceService.recordStatus(null, InstanceStatus.OPEN));

        verifyNoInteractions(instanceRepository, eventPublisher);
    }
}
