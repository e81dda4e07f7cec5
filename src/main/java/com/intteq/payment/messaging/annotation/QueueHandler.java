package com.intteq.payment.messaging.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Subscribes a method of a {@link MessagingListener} bean to a queue.
 *
 * <p>Signature: {@code (Payload, MessageContext)} returning {@code void} or
 * {@code HandlerResult}. The payload is converted from JSON with Jackson; declare it as
 * {@code JsonNode} to receive the raw tree. A thrown exception counts as a failed attempt.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface QueueHandler {

    /**
     * Queue to consume.
     */
    String queue();

    /**
     * Prefetch for this handler, or 0 for {@code messaging.consumer.prefetch}.
     */
    int prefetch() default 0;

    /**
     * Attempts before dead-lettering, or 0 for {@code messaging.consumer.max-retries}.
     */
    int maxRetries() default 0;
}
