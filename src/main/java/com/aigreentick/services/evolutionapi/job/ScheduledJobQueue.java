package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.exception.JobDispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Asynchronous job queue: one scheduler pool per queue name.
 *
 * The first attempt is scheduled immediately; after a failure the next
 * attempt is scheduled at {@code now + backoff}. Nothing is persisted, so
 * jobs waiting for a retry are lost on shutdown.
 */
@Slf4j
public class ScheduledJobQueue implements JobQueue, DisposableBean {

    private final Function<String, TaskScheduler> schedulerFactory;
    private final Clock clock;
    private final Map<String, TaskScheduler> schedulers = new ConcurrentHashMap<>();

    public ScheduledJobQueue(Function<String, TaskScheduler> schedulerFactory, Clock clock) {
        this.schedulerFactory = schedulerFactory;
        this.clock = clock;
    }

    /**
     * Production factory: a ThreadPoolTaskScheduler per queue, threads named
     * "evolution-{queue}-N".
     */
    public static Function<String, TaskScheduler> threadPoolSchedulers(int poolSize) {
        return queue -> {
            ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
            scheduler.setPoolSize(poolSize);
            scheduler.setThreadNamePrefix("evolution-" + queue + "-");
            scheduler.setWaitForTasksToCompleteOnShutdown(true);
            scheduler.setAwaitTerminationSeconds(30);
            scheduler.initialize();
            return scheduler;
        };
    }

    @Override
    public void push(QueuedJob job) {
        try {
            scheduler(job.getQueue()).schedule(() -> execute(job, 1), clock.instant());
            log.debug("Job {} queued on {}", job.getName(), job.getQueue());
        } catch (TaskRejectedException | IllegalStateException ex) {
            throw new JobDispatchException("Queue " + job.getQueue() + " rejected job " + job.getName(), ex);
        }
    }

    private void execute(QueuedJob job, int attempt) {
        AttemptOutcome outcome = JobAttemptRunner.run(job, attempt);
        if (outcome.getKind() != AttemptOutcome.Kind.RETRY) {
            return;
        }
        try {
            scheduler(job.getQueue()).schedule(() -> execute(job, attempt + 1),
                    clock.instant().plus(outcome.getRetryDelay()));
        } catch (TaskRejectedException | IllegalStateException ex) {
            log.error("Could not schedule retry {} of job {}: {}", attempt + 1, job.getName(), ex.getMessage());
            JobAttemptRunner.notifyFailed(job, ex);
        }
    }

    private TaskScheduler scheduler(String queue) {
        return schedulers.computeIfAbsent(queue, schedulerFactory);
    }

    @Override
    public void destroy() {
        schedulers.forEach((queue, scheduler) -> {
            if (scheduler instanceof ThreadPoolTaskScheduler pool) {
                log.info("Shutting down job queue {}", queue);
                pool.shutdown();
            }
        });
    }
}
