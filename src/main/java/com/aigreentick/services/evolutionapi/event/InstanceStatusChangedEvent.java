package com.aigreentick.services.evolutionapi.event;

import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import lombok.Value;

/**
 * Connection state of an instance changed. {@code previous} is null when
 * the instance was not known before.
 */
@Value
public class InstanceStatusChangedEvent {
    String instanceName;
    InstanceStatus previous;
    InstanceStatus current;
}
