package com.aigreentick.services.evolutionapi.event;

import lombok.Value;

@Value
public class QrCodeReceivedEvent {
    String instanceName;
    String qrCode;
    String pairingCode;
}
