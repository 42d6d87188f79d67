package com.aigreentick.services.evolutionapi.scheduler;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.entity.EvolutionInstance;
import com.aigreentick.services.evolutionapi.exception.JobDispatchException;
import com.aigreentick.services.evolutionapi.job.JobQueue;
import com.aigreentick.services.evolutionapi.job.SyncInstanceStatusJob;
import com.aigreentick.services.evolutionapi.service.InstanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * ══════════════════════════════════════════════════════════════════
 * Instance Status Scheduler
 * ══════════════════════════════════════════════════════════════════
 *
 * Webhooks are the primary source of connection state, but a missed
 * connection.update leaves a stale row behind. This job re-polls every
 * stored instance and lets InstanceService publish any change.
 *
 * SCHEDULE
 * ─────────
 *   evolution-api.sync.instance-status-interval (default 5 min, fixed delay)
 *   Off unless evolution-api.sync.enabled=true
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InstanceStatusScheduler {

    private final InstanceService instanceService;
    private final EvolutionApiClient client;
    private final JobQueue jobQueue;
    private final EvolutionApiProperties properties;

    @Scheduled(fixedDelayString = "${evolution-api.sync.instance-status-interval:PT5M}",
            initialDelayString = "${evolution-api.sync.instance-status-interval:PT5M}")
    public void syncInstanceStatuses() {
        if (!properties.getSync().isEnabled()) {
            return;
        }

        List<EvolutionInstance> instances = instanceService.findStoredInstances();
        if (instances.isEmpty()) {
            log.debug("No stored instances to sync");
            return;
        }

        int queued = 0;
        String queue = properties.getQueue().getQueue();
        for (EvolutionInstance instance : instances) {
            try {
                jobQueue.push(new SyncInstanceStatusJob(instance.getName(), client, instanceService, queue));
                queued++;
            } catch (JobDispatchException ex) {
                log.error("Could not queue status sync for instance {}: {}", instance.getName(), ex.getMessage());
            }
        }
        log.info("Instance status sync queued: {}/{} instances", queued, instances.size());
    }
}
