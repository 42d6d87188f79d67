package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.exception.JobDispatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduledJobQueueTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private TaskScheduler scheduler;

    private ScheduledJobQueue queue;
    private final List<String> requestedQueues = new ArrayList<>();

    @BeforeEach
    void setUp() {
        queue = new ScheduledJobQueue(name -> {
            requestedQueues.add(name);
            return scheduler;
        }, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testPush_SchedulesFirstAttemptImmediately() {
        queue.push(new CountingJob(0, 3));

        verify(scheduler).schedule(any(Runnable.class), eq(NOW));
        assertEquals(List.of("test-queue"), requestedQueues);
    }

    @Test
    void testFailedAttempt_SchedulesRetryAtBackoffDelay() {
        CountingJob job = new CountingJob(5, 3);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);

        queue.push(job);
        verify(scheduler).schedule(task.capture(), eq(NOW));
        task.getValue().run();

        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plus(Duration.ofSeconds(10))));
        assertEquals(1, job.attempts);
        assertEquals(0, job.failures.size());
    }

    @Test
    void testRetriesUntilMaxTries_ThenCallsFailedOnce() {
        CountingJob job = new CountingJob(Integer.MAX_VALUE, 3);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);

        queue.push(job);
        for (int i = 0; i < 3; i++) {
            verify(scheduler, times(i + 1)).schedule(task.capture(), any(Instant.class));
            task.getValue().run();
        }

        assertEquals(3, job.attempts);
        assertEquals(1, job.failures.size());
        // attempt 1 + two retries, nothing after exhaustion
        verify(scheduler, times(3)).schedule(any(Runnable.class), any(Instant.class));
        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plus(Duration.ofSeconds(20))));
    }

    @Test
    void testPush_WhenSchedulerRejects_ThrowsJobDispatchException() {
        when(scheduler.schedule(any(Runnable.class), any(Instant.class)))
                .thenThrow(new TaskRejectedException("pool shut down"));

        assertThrows(JobDispatchException.class, () -> queue.push(new CountingJob(0, 3)));
    }

    @Test
    void testRetry_WhenSchedulerRejects_CallsFailed() {
        CountingJob job = new CountingJob(1, 3);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        when(scheduler.schedule(task.capture(), any(Instant.class)))
                .thenReturn(null)
                .thenThrow(new TaskRejectedException("pool shut down"));

        queue.push(job);
        task.getValue().run();

        assertEquals(1, job.failures.size());
        assertInstanceOf(TaskRejectedException.class, job.failures.get(0));
    }

    @Test
    void testRetry_WhenSchedulerRejectsAndFailureCallbackThrows_DoesNotPropagate() {
        CountingJob job = new CountingJob(1, 3) {
            @Override
            public void failed(Throwable cause) {
                super.failed(cause);
                throw new IllegalStateException("listener broke");
            }
        };
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        when(scheduler.schedule(task.capture(), any(Instant.class)))
                .thenReturn(null)
                .thenThrow(new TaskRejectedException("pool shut down"));

        queue.push(job);
        assertDoesNotThrow(() -> task.getValue().run());

        assertEquals(1, job.failures.size());
    }

    /** Fails the first {@code failuresBeforeSuccess} attempts */
    static class CountingJob implements QueuedJob {
        private final int failuresBeforeSuccess;
        private final int maxTries;
        int attempts;
        final List<Throwable> failures = new ArrayList<>();

        CountingJob(int failuresBeforeSuccess, int maxTries) {
            this.failuresBeforeSuccess = failuresBeforeSuccess;
            this.maxTries = maxTries;
        }

        @Override
        public String getName() {
            return "counting";
        }

        @Override
        public String getQueue() {
            return "test-queue";
        }

        @Override
        public int getMaxTries() {
            return maxTries;
        }

        @Override
        public BackoffSchedule getBackoff() {
            return BackoffSchedule.ofSeconds(10, 20);
        }

        @Override
        public void handle(int attempt) {
            attempts = attempt;
            if (attempt <= failuresBeforeSuccess) {
                throw new IllegalStateException("attempt " + attempt + " failed");
            }
        }

        @Override
        public void failed(Throwable cause) {
            failures.add(cause);
        }
    }
}
