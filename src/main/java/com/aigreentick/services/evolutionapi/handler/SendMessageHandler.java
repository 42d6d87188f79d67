package com.aigreentick.services.evolutionapi.handler;

import com.aigreentick.services.evolutionapi.constants.WebhookEvent;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.event.MessageSentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * send.message → MessageSentEvent (fromWebhook=true). Covers messages sent
 * from any client of the instance, not only from this service.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendMessageHandler implements WebhookHandler {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public Set<String> events() {
        return Set.of(WebhookEvent.SEND_MESSAGE.name());
    }

    @Override
    public void handle(WebhookPayload payload) {
        log.debug("Message sent notification: instance={}, to={}, id={}",
                payload.getInstanceName(), payload.getRemoteJid(), payload.getMessageId());

        eventPublisher.publishEvent(new MessageSentEvent(
                payload.getInstanceName(),
                payload.getMessageType(),
                payload.getSenderNumber(),
                payload.getMessageContent(),
                payload.getData(),
                true));
    }
}
