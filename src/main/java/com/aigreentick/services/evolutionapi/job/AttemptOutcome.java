package com.aigreentick.services.evolutionapi.job;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Result of one job attempt as seen by the queue
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class AttemptOutcome {

    enum Kind { SUCCEEDED, RETRY, GAVE_UP }

    private static final AttemptOutcome SUCCEEDED = new AttemptOutcome(Kind.SUCCEEDED, null);
    private static final AttemptOutcome GAVE_UP = new AttemptOutcome(Kind.GAVE_UP, null);

    private final Kind kind;
    private final Duration retryDelay;

    static AttemptOutcome succeeded() {
        return SUCCEEDED;
    }

    static AttemptOutcome retryAfter(Duration delay) {
        return new AttemptOutcome(Kind.RETRY, delay);
    }

    static AttemptOutcome gaveUp() {
        return GAVE_UP;
    }
}
