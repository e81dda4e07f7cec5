package com.intteq.payment.messaging.retry;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of {@link RetryPolicy#decide(int, int)} for one failed attempt.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetryDecision {

    public enum Action { RETRY, DEAD_LETTER }

    Action action;

    /** Retry count carried by the next envelope (or reached, when dead-lettering). */
    int retryCount;

    /** Backoff before the republish; {@link Duration#ZERO} when dead-lettering. */
    Duration delay;

    static RetryDecision retry(int retryCount, Duration delay) {
        return new RetryDecision(Action.RETRY, retryCount, delay);
    }

    static RetryDecision deadLetter(int retryCount) {
        return new RetryDecision(Action.DEAD_LETTER, retryCount, Duration.ZERO);
    }

    public boolean isRetry() {
        return action == Action.RETRY;
    }
}
