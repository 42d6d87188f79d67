package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds send jobs with the configured queue, tries and backoff table
 */
@Component
@RequiredArgsConstructor
public class SendMessageJobFactory {

    private final EvolutionApiClient client;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final EvolutionApiProperties properties;

    public SendMessageJob create(String instanceName, String messageType,
                                 Map<String, Object> message, String connectionName) {
        EvolutionApiProperties.Queue queue = properties.getQueue();
        return new SendMessageJob(
                instanceName,
                messageType,
                message,
                connectionName,
                queue.getQueue(),
                queue.getMaxExceptions(),
                BackoffSchedule.of(queue.getBackoff()),
                client,
                eventPublisher,
                objectMapper,
                validator);
    }
}
