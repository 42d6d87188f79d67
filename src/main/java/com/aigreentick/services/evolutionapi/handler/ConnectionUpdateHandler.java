package com.aigreentick.services.evolutionapi.handler;

import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import com.aigreentick.services.evolutionapi.constants.WebhookEvent;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.event.ConnectionUpdatedEvent;
import com.aigreentick.services.evolutionapi.service.InstanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * connection.update → ConnectionUpdatedEvent, then the stored instance status
 * (InstanceService publishes InstanceStatusChangedEvent on change).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionUpdateHandler implements WebhookHandler {

    private final ApplicationEventPublisher eventPublisher;
    private final InstanceService instanceService;

    @Override
    public Set<String> events() {
        return Set.of(WebhookEvent.CONNECTION_UPDATE.name());
    }

    @Override
    public void handle(WebhookPayload payload) {
        String rawState = payload.getConnectionState();
        if (rawState == null) {
            log.debug("Connection update without state: instance={}", payload.getInstanceName());
            return;
        }
        InstanceStatus status = InstanceStatus.fromValue(rawState);

        log.info("Connection update: instance={}, state={} ({})", payload.getInstanceName(), status, rawState);
        if (status == InstanceStatus.CLOSE) {
            log.warn("Instance {} disconnected from WhatsApp", payload.getInstanceName());
        }

        eventPublisher.publishEvent(new ConnectionUpdatedEvent(
                payload.getInstanceName(), status, rawState, payload));
        instanceService.recordStatus(payload.getInstanceName(), status);
    }
}
