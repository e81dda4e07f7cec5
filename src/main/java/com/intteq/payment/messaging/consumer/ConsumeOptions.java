package com.intteq.payment.messaging.consumer;

import lombok.Builder;
import lombok.Value;

/**
 * Per-subscription consumer settings.
 */
@Value
@Builder(toBuilder = true)
public class ConsumeOptions {

    public static final int DEFAULT_PREFETCH = 1;
    public static final int DEFAULT_MAX_RETRIES = 3;

    /** Maximum unacknowledged deliveries, and therefore concurrent handler invocations. */
    @Builder.Default
    int prefetch = DEFAULT_PREFETCH;

    /** Total failed attempts before the message is dead-lettered. */
    @Builder.Default
    int maxRetries = DEFAULT_MAX_RETRIES;

    /** Send bodies that are not valid JSON straight to the DLQ instead of retrying them. */
    @Builder.Default
    boolean deadLetterMalformed = true;

    public static ConsumeOptions defaults() {
        return ConsumeOptions.builder().build();
    }

    void validate() {
        if (prefetch < 1) {
            throw new IllegalArgumentException("prefetch must be >= 1, was " + prefetch);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, was " + maxRetries);
        }
    }
}
