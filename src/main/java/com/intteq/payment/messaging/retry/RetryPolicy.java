package com.intteq.payment.messaging.retry;

import lombok.Getter;

import java.time.Duration;

/**
 * Capped exponential backoff: {@code delay(k) = min(initialDelay * 2^k, maxDelay)}.
 *
 * <p>With the defaults (1s / 60s) the first retry waits 2s, then 4s, 8s, 16s, 32s and
 * every retry from the sixth onward waits 60s.
 */
@Getter
public class RetryPolicy {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private final Duration initialDelay;
    private final Duration maxDelay;

    public RetryPolicy(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than initialDelay");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * Backoff before publishing the envelope that carries {@code retryCount}.
     */
    public Duration delayFor(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        long base = initialDelay.toMillis();
        long cap = maxDelay.toMillis();
        // 2^k overflows long well before k = 63; anything that large is past the cap anyway
        if (retryCount >= 62 || base > (cap >> retryCount)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(base << retryCount, cap));
    }

    /**
     * Decide what happens after a failed attempt.
     *
     * @param previousRetryCount retry count carried by the failed envelope (0 on first delivery)
     * @param maxRetries         total attempts allowed before dead-lettering
     */
    public RetryDecision decide(int previousRetryCount, int maxRetries) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        int previous = Math.max(previousRetryCount, 0);
        if (previous >= maxRetries - 1) {
            // saturate rather than overflow on absurd header values
            return RetryDecision.deadLetter(previous == Integer.MAX_VALUE ? previous : previous + 1);
        }
        int retryCount = previous + 1;
        return RetryDecision.retry(retryCount, delayFor(retryCount));
    }
}
