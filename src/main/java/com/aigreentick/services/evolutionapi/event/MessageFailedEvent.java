package com.aigreentick.services.evolutionapi.event;

import lombok.Value;

import java.util.Map;

/**
 * A send attempt failed.
 *
 * Published once per failed attempt with {@code terminal=false}, and once
 * more with {@code terminal=true} when the job is exhausted or the failure
 * is not retryable.
 */
@Value
public class MessageFailedEvent {
    String instanceName;
    String messageType;
    String connectionName;
    String recipient;
    Map<String, Object> message;
    Throwable error;
    int attempt;
    boolean terminal;
}
