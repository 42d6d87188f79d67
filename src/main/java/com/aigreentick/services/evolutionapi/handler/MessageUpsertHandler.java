package com.aigreentick.services.evolutionapi.handler;

import com.aigreentick.services.evolutionapi.constants.WebhookEvent;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.event.MessageReceivedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * messages.upsert → MessageReceivedEvent, for every message including our own
 * (fromMe) so listeners see messages sent from the phone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageUpsertHandler implements WebhookHandler {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public Set<String> events() {
        return Set.of(WebhookEvent.MESSAGES_UPSERT.name());
    }

    @Override
    public void handle(WebhookPayload payload) {
        log.info("Message received: instance={}, from={}, type={}, group={}, fromMe={}",
                payload.getInstanceName(), payload.getSenderNumber(),
                payload.getMessageType(), payload.isGroupMessage(), payload.isFromMe());

        eventPublisher.publishEvent(new MessageReceivedEvent(
                payload.getInstanceName(),
                payload.getMessageId(),
                payload.getRemoteJid(),
                payload.getMessageType(),
                payload.getText(),
                payload.isGroupMessage(),
                payload.isFromMe(),
                payload));
    }
}
