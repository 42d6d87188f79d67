package com.aigreentick.services.evolutionapi.handler;

import com.aigreentick.services.evolutionapi.constants.WebhookEvent;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.event.QrCodeReceivedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@RequiredArgsConstructor
@Slf4j
public class QrCodeUpdatedHandler implements WebhookHandler {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public Set<String> events() {
        return Set.of(WebhookEvent.QRCODE_UPDATED.name());
    }

    @Override
    public void handle(WebhookPayload payload) {
        if (payload.getQrCode() == null) {
            log.debug("QR code update without code: instance={}", payload.getInstanceName());
            return;
        }
        log.info("QR code updated: instance={}, pairingCode={}",
                payload.getInstanceName(), payload.getPairingCode() != null);
        eventPublisher.publishEvent(new QrCodeReceivedEvent(
                payload.getInstanceName(), payload.getQrCode(), payload.getPairingCode()));
    }
}
