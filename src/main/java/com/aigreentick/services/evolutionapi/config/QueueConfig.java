package com.aigreentick.services.evolutionapi.config;

import com.aigreentick.services.evolutionapi.job.InlineJobQueue;
import com.aigreentick.services.evolutionapi.job.JobQueue;
import com.aigreentick.services.evolutionapi.job.ScheduledJobQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Job queue selection.
 *
 * evolution-api.queue.connection
 * ──────────────────────────────
 *   async (default): ScheduledJobQueue, one scheduler pool per queue name
 *                     (evolution-api for sends, default for webhooks).
 *                     Retries wait the configured backoff.
 *   sync           : InlineJobQueue, jobs run on the calling thread and
 *                     retries run back to back. Use for local runs only.
 *                     Webhooks bypass it and are processed in the request
 *                     even with webhook.queue=true.
 */
@Configuration
@EnableScheduling
@Slf4j
public class QueueConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobQueue jobQueue(EvolutionApiProperties properties, Clock clock) {
        EvolutionApiProperties.Queue queue = properties.getQueue();
        log.info("Job queue connection: {}", queue.getConnection());
        return switch (queue.getConnection()) {
            case SYNC -> new InlineJobQueue();
            case ASYNC -> new ScheduledJobQueue(
                    ScheduledJobQueue.threadPoolSchedulers(queue.getPoolSize()), clock);
        };
    }
}
