package com.intteq.payment.messaging.publisher;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Per-publish overrides merged over the publisher defaults
 * ({@code contentType=application/json}, persistent delivery, {@code timestamp=now}).
 *
 * <p>Delivery mode is not overridable: every envelope is persistent.
 */
@Value
@Builder
public class PublishOptions {

    private static final PublishOptions NONE = PublishOptions.builder().build();

    @Singular
    Map<String, Object> headers;

    String contentType;
    String messageId;
    String correlationId;

    /** Per-message TTL in milliseconds, as the AMQP string property. */
    String expiration;

    Integer priority;

    public static PublishOptions none() {
        return NONE;
    }
}
