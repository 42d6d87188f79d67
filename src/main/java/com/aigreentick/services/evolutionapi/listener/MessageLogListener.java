package com.aigreentick.services.evolutionapi.listener;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.MessageStatus;
import com.aigreentick.services.evolutionapi.entity.EvolutionMessage;
import com.aigreentick.services.evolutionapi.event.MessageSentEvent;
import com.aigreentick.services.evolutionapi.repository.EvolutionMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the evolution_messages row for each message a send job delivered
 * to the server. The send.message webhook echo is skipped, otherwise every
 * message would be stored twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageLogListener {

    private final EvolutionMessageRepository messageRepository;
    private final EvolutionApiProperties properties;

    @EventListener
    public void onMessageSent(MessageSentEvent event) {
        if (event.isFromWebhook() || !properties.getDatabase().isStoreMessages()) {
            return;
        }
        try {
            messageRepository.save(EvolutionMessage.builder()
                    .messageId(event.getMessageId())
                    .instanceName(event.getInstanceName())
                    .remoteJid(event.getRecipient())
                    .messageType(event.getMessageType())
                    .status(MessageStatus.SENT)
                    .content(event.getMessage())
                    .response(event.getResponse())
                    .build());
        } catch (RuntimeException ex) {
            // the message is already out; a lost log row must not turn into a resend
            log.error("Could not store sent message: instance={}, messageId={}: {}",
                    event.getInstanceName(), event.getMessageId(), ex.getMessage());
        }
    }
}
