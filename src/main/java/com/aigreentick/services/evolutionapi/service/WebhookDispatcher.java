package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.exception.InvalidPayloadException;
import com.aigreentick.services.evolutionapi.exception.JobDispatchException;
import com.aigreentick.services.evolutionapi.job.JobQueue;
import com.aigreentick.services.evolutionapi.job.ProcessWebhookJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides how an inbound webhook is processed.
 *
 * Flow:
 *   merge URL instance → validate (no side effects on failure)
 *   → webhook.queue=true:  push ProcessWebhookJob, QUEUED
 *                          (push rejected, or a synchronous queue → inline)
 *   → inline:              WebhookProcessor.process, PROCESSED
 *
 * Queuing is best effort: a rejected push is logged at WARN and the
 * webhook is processed in the request instead. The caller cannot tell the
 * two apart except by the response message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookDispatcher {

    private final WebhookProcessor processor;
    private final JobQueue jobQueue;
    private final EvolutionApiProperties properties;

    /**
     * @param rawPayload      parsed JSON body
     * @param urlInstanceHint instance from the URL path, or null
     * @throws InvalidPayloadException when the event name is missing or empty
     */
    public DispatchResult handle(Map<String, Object> rawPayload, String urlInstanceHint) {
        WebhookPayload payload = WebhookPayload.from(mergeInstance(rawPayload, urlInstanceHint));

        if (properties.getWebhook().isQueue() && jobQueue.isSynchronous()) {
            // inline retries would repeat the handler and hide its failure behind "queued"
            log.debug("Job queue is synchronous, processing webhook in the request: event={}",
                    payload.getNormalizedEvent());
        } else if (properties.getWebhook().isQueue()) {
            String queue = properties.getQueue().getWebhookQueue();
            try {
                jobQueue.push(new ProcessWebhookJob(payload, processor, queue));
                log.debug("Webhook queued: event={}, instance={}, queue={}",
                        payload.getNormalizedEvent(), payload.getInstanceName(), queue);
                return DispatchResult.QUEUED;
            } catch (JobDispatchException ex) {
                log.warn("Webhook queue unavailable, processing inline: event={}, queue={}: {}",
                        payload.getNormalizedEvent(), queue, ex.getMessage());
            }
        }

        processor.process(payload);
        return DispatchResult.PROCESSED;
    }

    /**
     * Payload instance fields win over the URL; the URL value only fills a gap.
     */
    Map<String, Object> mergeInstance(Map<String, Object> rawPayload, String urlInstanceHint) {
        if (rawPayload == null) {
            throw new InvalidPayloadException();
        }
        if (urlInstanceHint == null || urlInstanceHint.isBlank()
                || hasValue(rawPayload, "instance") || hasValue(rawPayload, "instanceName")) {
            return rawPayload;
        }
        Map<String, Object> merged = new LinkedHashMap<>(rawPayload);
        merged.put("instance", urlInstanceHint);
        return merged;
    }

    private boolean hasValue(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value != null && !String.valueOf(value).isBlank();
    }
}
