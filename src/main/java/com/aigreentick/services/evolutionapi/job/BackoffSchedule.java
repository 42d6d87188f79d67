package com.aigreentick.services.evolutionapi.job;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * Explicit table of waits between attempts.
 *
 * After failed attempt n (1-based) the job waits {@code delays[min(n-1, size-1)]};
 * once the table runs out the last entry repeats. The table is authoritative,
 * nothing is computed from a formula.
 */
@ToString
@EqualsAndHashCode
public final class BackoffSchedule {

    private final List<Duration> delays;

    private BackoffSchedule(List<Duration> delays) {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("Backoff schedule needs at least one delay");
        }
        for (Duration delay : delays) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("Backoff delays must be zero or positive: " + delays);
            }
        }
        this.delays = List.copyOf(delays);
    }

    public static BackoffSchedule of(List<Duration> delays) {
        return new BackoffSchedule(delays);
    }

    public static BackoffSchedule ofSeconds(long... seconds) {
        Duration[] delays = new Duration[seconds.length];
        for (int i = 0; i < seconds.length; i++) {
            delays[i] = Duration.ofSeconds(seconds[i]);
        }
        return new BackoffSchedule(List.of(delays));
    }

    /**
     * Wait before the attempt that follows failed attempt {@code failedAttempt}.
     */
    public Duration delayBeforeRetry(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("Attempts are numbered from 1, got " + failedAttempt);
        }
        return delays.get(Math.min(failedAttempt - 1, delays.size() - 1));
    }

    public List<Duration> getDelays() {
        return delays;
    }
}
