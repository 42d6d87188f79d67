package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.dto.request.WebhookPayload;
import com.aigreentick.services.evolutionapi.service.WebhookProcessor;
import lombok.extern.slf4j.Slf4j;

/**
 * Queued webhook processing: 3 tries, waiting 10s, 30s, then 60s.
 */
@Slf4j
public class ProcessWebhookJob implements QueuedJob {

    private static final int MAX_TRIES = 3;
    private static final BackoffSchedule BACKOFF = BackoffSchedule.ofSeconds(10, 30, 60);

    private final WebhookPayload payload;
    private final WebhookProcessor processor;
    private final String queue;

    public ProcessWebhookJob(WebhookPayload payload, WebhookProcessor processor, String queue) {
        this.payload = payload;
        this.processor = processor;
        this.queue = queue;
    }

    @Override
    public String getName() {
        return "ProcessWebhookJob[" + payload.getNormalizedEvent() + " for " + payload.getInstanceName() + "]";
    }

    @Override
    public String getQueue() {
        return queue;
    }

    @Override
    public int getMaxTries() {
        return MAX_TRIES;
    }

    @Override
    public BackoffSchedule getBackoff() {
        return BACKOFF;
    }

    public WebhookPayload getPayload() {
        return payload;
    }

    @Override
    public void handle(int attempt) {
        processor.process(payload);
    }

    @Override
    public void failed(Throwable cause) {
        log.error("Webhook permanently failed: event={}, instance={}: {}",
                payload.getNormalizedEvent(), payload.getInstanceName(), cause.getMessage());
    }
}
