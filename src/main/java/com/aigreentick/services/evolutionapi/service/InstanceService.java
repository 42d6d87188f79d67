package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.dto.response.InstanceSummary;
import com.aigreentick.services.evolutionapi.entity.EvolutionInstance;
import com.aigreentick.services.evolutionapi.event.InstanceStatusChangedEvent;
import com.aigreentick.services.evolutionapi.repository.EvolutionInstanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Instance bookkeeping: server-side listing, local evolution_instances rows,
 * and status change notifications.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstanceService {

    private final EvolutionApiClient client;
    private final EvolutionInstanceRepository instanceRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final EvolutionApiProperties properties;
    private final Clock clock;

    /**
     * Instances known to the server behind {@code connection}.
     */
    public List<InstanceSummary> fetchSummaries(String connection) {
        EvolutionApiResponse response = client.fetchInstances(connection);
        List<Map<String, Object>> entries = response.getDataAsList();
        if (entries == null) {
            log.warn("fetchInstances returned no list: {}", response.getData());
            return List.of();
        }
        List<InstanceSummary> summaries = new ArrayList<>(entries.size());
        for (Map<String, Object> entry : entries) {
            InstanceSummary summary = InstanceSummary.from(entry);
            if (summary.getName() != null) {
                summaries.add(summary);
            }
        }
        return summaries;
    }

    /**
     * Upsert every server instance into evolution_instances by name.
     *
     * @return number of rows written
     */
    @Transactional
    public int syncInstances(String connection) {
        List<InstanceSummary> summaries = fetchSummaries(connection);
        LocalDateTime now = LocalDateTime.now(clock);

        for (InstanceSummary summary : summaries) {
            EvolutionInstance instance = instanceRepository.findByName(summary.getName())
                    .orElseGet(() -> EvolutionInstance.builder().name(summary.getName()).build());
            InstanceStatus previous = instance.getId() == null ? null : instance.getStatus();

            instance.setStatus(summary.getStatus());
            instance.setPhoneNumber(summary.getPhoneNumber());
            instance.setProfileName(summary.getProfileName());
            instance.setProfilePictureUrl(summary.getProfilePictureUrl());
            instance.setLastSeenAt(now);
            instanceRepository.save(instance);

            publishIfChanged(summary.getName(), previous, summary.getStatus());
        }

        log.info("Synced {} instances from connection {}", summaries.size(), connection);
        return summaries.size();
    }

    /**
     * Record a status reported by a webhook or a state poll.
     * Creates the row when evolution-api.database.store-instances is on.
     *
     * @return status held before the update, or null when the instance was unknown
     */
    @Transactional
    public InstanceStatus recordStatus(String instanceName, InstanceStatus status) {
        if (instanceName == null) {
            return null;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        EvolutionInstance existing = instanceRepository.findByName(instanceName).orElse(null);
        InstanceStatus previous = existing != null ? existing.getStatus() : null;

        if (existing != null) {
            instanceRepository.updateStatus(instanceName, status, now);
        } else if (properties.getDatabase().isStoreInstances()) {
            instanceRepository.save(EvolutionInstance.builder()
                    .name(instanceName)
                    .status(status)
                    .lastSeenAt(now)
                    .build());
        }

        publishIfChanged(instanceName, previous, status);
        return previous;
    }

    public List<EvolutionInstance> findStoredInstances() {
        return instanceRepository.findAll();
    }

    private void publishIfChanged(String instanceName, InstanceStatus previous, InstanceStatus current) {
        if (previous != current) {
            log.info("Instance status changed: instance={}, {} -> {}", instanceName, previous, current);
            eventPublisher.publishEvent(new InstanceStatusChangedEvent(instanceName, previous, current));
        }
    }
}
