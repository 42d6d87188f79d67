package com.aigreentick.services.evolutionapi.listener;

import com.aigreentick.services.evolutionapi.entity.FailedMessage;
import com.aigreentick.services.evolutionapi.event.MessageFailedEvent;
import com.aigreentick.services.evolutionapi.repository.FailedMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Persists terminally failed sends so the `retry` command can resend them.
 * Per-attempt failures are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FailedMessageRecorder {

    private final FailedMessageRepository failedMessageRepository;

    @EventListener(condition = "#event.terminal")
    public void onMessageFailed(MessageFailedEvent event) {
        FailedMessage record = failedMessageRepository.save(FailedMessage.builder()
                .instanceName(event.getInstanceName())
                .recipient(event.getRecipient())
                .messageType(event.getMessageType())
                .connectionName(event.getConnectionName())
                .payload(event.getMessage())
                .lastError(describe(event.getError()))
                .build());
        log.warn("Recorded failed message: id={}, instance={}, type={}, to={}",
                record.getId(), event.getInstanceName(), event.getMessageType(), event.getRecipient());
    }

    static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
