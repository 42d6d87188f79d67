package com.aigreentick.services.evolutionapi.handler;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.MessageStatus;
import com.aigreentick.services.evolutionapi.constants.WebhookEvent;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.event.MessageDeliveredEvent;
import com.aigreentick.services.evolutionapi.event.MessageReadEvent;
import com.aigreentick.services.evolutionapi.repository.EvolutionMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * messages.update → delivery / read receipts.
 *
 * Ack values: 3 or DELIVERY_ACK = delivered, 4 / READ (5 / PLAYED for voice
 * notes) = read. Anything else (pending, server ack) is ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageUpdateHandler implements WebhookHandler {

    private final ApplicationEventPublisher eventPublisher;
    private final EvolutionMessageRepository messageRepository;
    private final EvolutionApiProperties properties;

    @Override
    public Set<String> events() {
        return Set.of(WebhookEvent.MESSAGES_UPDATE.name());
    }

    @Override
    public void handle(WebhookPayload payload) {
        MessageStatus status = mapAck(payload.getMessageStatus());
        if (status == null) {
            log.debug("Ignoring message ack: instance={}, status={}",
                    payload.getInstanceName(), payload.getMessageStatus());
            return;
        }

        String messageId = payload.getMessageId();
        String remoteJid = payload.getRemoteJid();
        if (messageId == null || remoteJid == null) {
            log.debug("Message ack without message id or chat: instance={}", payload.getInstanceName());
            return;
        }
        log.info("Message {}: instance={}, id={}", status, payload.getInstanceName(), messageId);

        if (status == MessageStatus.DELIVERED) {
            eventPublisher.publishEvent(new MessageDeliveredEvent(
                    payload.getInstanceName(), messageId, remoteJid, payload));
        } else {
            eventPublisher.publishEvent(new MessageReadEvent(
                    payload.getInstanceName(), messageId, remoteJid, payload));
        }

        if (properties.getDatabase().isStoreMessages()) {
            messageRepository.findFirstByMessageId(messageId).ifPresent(message -> {
                message.advanceStatus(status);
                messageRepository.save(message);
            });
        }
    }

    static MessageStatus mapAck(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "3", "DELIVERY_ACK" -> MessageStatus.DELIVERED;
            case "4", "READ", "5", "PLAYED" -> MessageStatus.READ;
            default -> null;
        };
    }
}
