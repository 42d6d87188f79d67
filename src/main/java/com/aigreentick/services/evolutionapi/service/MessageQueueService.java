package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.MessageType;
import com.aigreentick.services.evolutionapi.job.JobQueue;
import com.aigreentick.services.evolutionapi.job.SendMessageJob;
import com.aigreentick.services.evolutionapi.job.SendMessageJobFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for application code that wants to send WhatsApp messages.
 *
 * Messages are queued, never sent on the caller's thread (unless the queue
 * connection is sync). Delivery outcome arrives as MessageSentEvent or
 * MessageFailedEvent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageQueueService {

    private final JobQueue jobQueue;
    private final SendMessageJobFactory jobFactory;
    private final EvolutionApiProperties properties;

    public SendMessageJob queueText(String instanceName, String number, String text) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("number", number);
        message.put("text", text);
        return queue(instanceName, MessageType.TEXT.getValue(), message, null);
    }

    public SendMessageJob queueMedia(String instanceName, String number, String mediaType,
                                     String media, String caption) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("number", number);
        message.put("mediatype", mediaType);
        message.put("media", media);
        if (caption != null) {
            message.put("caption", caption);
        }
        return queue(instanceName, MessageType.MEDIA.getValue(), message, null);
    }

    public SendMessageJob queueAudio(String instanceName, String number, String audio) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("number", number);
        message.put("audio", audio);
        return queue(instanceName, MessageType.AUDIO.getValue(), message, null);
    }

    public SendMessageJob queueLocation(String instanceName, String number, double latitude, double longitude,
                                        String name, String address) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("number", number);
        message.put("latitude", latitude);
        message.put("longitude", longitude);
        if (name != null) {
            message.put("name", name);
        }
        if (address != null) {
            message.put("address", address);
        }
        return queue(instanceName, MessageType.LOCATION.getValue(), message, null);
    }

    /**
     * Queue a message of any type. The type is checked here so a typo fails
     * the caller instead of an anonymous worker thread.
     *
     * @param instanceName    null selects evolution-api.default-instance
     * @param connectionName  null selects the default connection
     */
    public SendMessageJob queue(String instanceName, String messageType,
                                Map<String, Object> message, String connectionName) {
        MessageType.fromValue(messageType);
        String instance = instanceName != null ? instanceName : properties.getDefaultInstance();

        SendMessageJob job = jobFactory.create(instance, messageType, message, connectionName);
        jobQueue.push(job);
        log.info("Queued {} message: instance={}, to={}, queue={}",
                messageType, instance, job.getRecipient(), job.getQueue());
        return job;
    }
}
