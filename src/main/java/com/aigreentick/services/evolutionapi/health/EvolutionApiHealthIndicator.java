package com.aigreentick.services.evolutionapi.health;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.client.EvolutionConnectionResolver;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Actuator health contribution: can the default Evolution API server be reached
 * with the configured key?
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvolutionApiHealthIndicator implements HealthIndicator {

    private final EvolutionApiClient client;
    private final EvolutionConnectionResolver connectionResolver;

    @Override
    public Health health() {
        String serverUrl = connectionResolver.serverUrl(null);
        long start = System.nanoTime();
        try {
            EvolutionApiResponse response = client.fetchInstances(null);
            List<?> instances = response.getDataAsList();
            return Health.up()
                    .withDetail("serverUrl", serverUrl)
                    .withDetail("instances", instances == null ? 0 : instances.size())
                    .withDetail("responseTimeMs", (System.nanoTime() - start) / 1_000_000)
                    .build();
        } catch (RuntimeException ex) {
            log.warn("Evolution API health check failed: {}", ex.getMessage());
            return Health.down()
                    .withDetail("serverUrl", serverUrl)
                    .withDetail("error", ex.getMessage())
                    .build();
        }
    }
}
