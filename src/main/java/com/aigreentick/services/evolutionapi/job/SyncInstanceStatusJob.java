package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.service.InstanceService;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Polls the connection state of one instance and records it.
 * A change is published by InstanceService as InstanceStatusChangedEvent.
 */
@Slf4j
public class SyncInstanceStatusJob implements QueuedJob {

    private static final BackoffSchedule BACKOFF = BackoffSchedule.ofSeconds(30);

    private final String instanceName;
    private final EvolutionApiClient client;
    private final InstanceService instanceService;
    private final String queue;

    public SyncInstanceStatusJob(String instanceName, EvolutionApiClient client,
                                 InstanceService instanceService, String queue) {
        this.instanceName = instanceName;
        this.client = client;
        this.instanceService = instanceService;
        this.queue = queue;
    }

    @Override
    public String getName() {
        return "SyncInstanceStatusJob[" + instanceName + "]";
    }

    @Override
    public String getQueue() {
        return queue;
    }

    @Override
    public int getMaxTries() {
        return 2;
    }

    @Override
    public BackoffSchedule getBackoff() {
        return BACKOFF;
    }

    public String getInstanceName() {
        return instanceName;
    }

    @Override
    public void handle(int attempt) {
        EvolutionApiResponse response = client.connectionState(null, instanceName);
        InstanceStatus status = InstanceStatus.fromValue(extractState(response.getDataAsMap()));
        instanceService.recordStatus(instanceName, status);
        log.debug("Instance state polled: instance={}, status={}", instanceName, status);
    }

    @Override
    public void failed(Throwable cause) {
        log.warn("Could not refresh instance state: instance={}: {}", instanceName, cause.getMessage());
    }

    /**
     * connectionState answers {"instance": {"instanceName": "...", "state": "open"}}
     * on current servers and {"state": "open"} on older ones.
     */
    static String extractState(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        if (data.get("instance") instanceof Map<?, ?> instance && instance.get("state") != null) {
            return String.valueOf(instance.get("state"));
        }
        Object state = data.get("state");
        return state != null ? String.valueOf(state) : null;
    }
}
