package com.intteq.payment.messaging;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.Nullable;

import java.util.concurrent.TimeUnit;

/**
 * Thin Micrometer facade. Every method is a no-op when no {@link MeterRegistry} is present.
 */
public class MessagingMetrics {

    static final String PUBLISH = "payment.messaging.publish";
    static final String CONSUME = "payment.messaging.consume";
    static final String CONSUME_LATENCY = "payment.messaging.consume.latency";

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";
    public static final String BLOCKED = "blocked";
    public static final String RETRY = "retry";
    public static final String DEAD_LETTER = "dead_letter";

    @Nullable
    private final MeterRegistry meterRegistry;

    public MessagingMetrics(@Nullable MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public static MessagingMetrics noop() {
        return new MessagingMetrics(null);
    }

    public void published(String outcome) {
        if (meterRegistry == null) return;
        meterRegistry.counter(PUBLISH, "outcome", outcome).increment();
    }

    public void consumed(String queue, String outcome) {
        if (meterRegistry == null) return;
        meterRegistry.counter(CONSUME, "queue", queue, "outcome", outcome).increment();
    }

    public void handlerLatency(String queue, long durationNs) {
        if (meterRegistry == null) return;
        meterRegistry.timer(CONSUME_LATENCY, "queue", queue).record(durationNs, TimeUnit.NANOSECONDS);
    }
}
