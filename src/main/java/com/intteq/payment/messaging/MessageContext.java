package com.intteq.payment.messaging;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-delivery view handed to message handlers, and the single place a delivery is settled.
 *
 * <p>Usage:
 * <pre>
 *   ctx.getRetryCount();   // 0 on the first attempt
 *   ctx.ack();             // remove from the queue
 *   ctx.deadLetter();      // nack without requeue, broker routes to the DLQ
 * </pre>
 *
 * <p>Exactly one of {@link #ack()} / {@link #deadLetter()} may be issued per delivery; a
 * second settlement attempt fails with {@link IllegalStateException}. Handlers normally
 * leave settlement to the consumer engine and report their outcome through
 * {@code HandlerResult}.
 *
 * <p>Channel I/O failures are wrapped in {@link MessagingOperationException}.
 */
@Getter
@Slf4j
public class MessageContext {

    /** Header carrying the number of failed attempts behind this envelope. */
    public static final String RETRY_COUNT_HEADER = "retry-count";

    /** Header name used by older producers; read, never written. */
    public static final String LEGACY_RETRY_COUNT_HEADER = "x-retry-count";

    private final String queue;
    private final long deliveryTag;
    private final boolean redelivered;
    private final AMQP.BasicProperties properties;
    private final int retryCount;

    @Getter(AccessLevel.NONE)
    private final byte[] body;

    @Getter(AccessLevel.NONE)
    private final Channel channel;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean settled = new AtomicBoolean();

    private MessageContext(String queue, Channel channel, long deliveryTag, boolean redelivered,
                           AMQP.BasicProperties properties, byte[] body) {
        this.queue = queue;
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.properties = properties != null ? properties : new AMQP.BasicProperties();
        this.body = body != null ? body : new byte[0];
        this.retryCount = retryCountOf(this.properties.getHeaders());
    }

    /**
     * Create a context for a RabbitMQ manual-ack delivery.
     */
    public static MessageContext forDelivery(String queue, Channel channel, Envelope envelope,
                                             AMQP.BasicProperties properties, byte[] body) {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(envelope, "envelope must not be null");
        return new MessageContext(queue, channel, envelope.getDeliveryTag(), envelope.isRedeliver(),
                properties, body);
    }

    /**
     * Retry count carried by {@code headers}. An absent, negative or unparseable header means 0;
     * values beyond {@code int} range saturate at {@link Integer#MAX_VALUE}.
     */
    public static int retryCountOf(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object value = headers.get(RETRY_COUNT_HEADER);
        if (value == null) {
            value = headers.get(LEGACY_RETRY_COUNT_HEADER);
        }
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return saturate(number);
        }
        // LongString and plain strings
        try {
            return saturate(new BigDecimal(value.toString().trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable {} header value '{}'", RETRY_COUNT_HEADER, value);
            return 0;
        }
    }

    private static int saturate(Number number) {
        double value = number.doubleValue();
        if (!(value > 0)) {
            return 0;
        }
        if (value >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return number.intValue();
    }

    // -----------------------
    // Accessors
    // -----------------------

    public Map<String, Object> getHeaders() {
        Map<String, Object> headers = properties.getHeaders();
        return headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
    }

    /** Raw message body, exactly as delivered. */
    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isSettled() {
        return settled.get();
    }

    // -----------------------
    // Settlement
    // -----------------------

    /**
     * Acknowledge the delivery; the broker removes it from the queue.
     */
    public void ack() {
        markSettled("ack");
        try {
            channel.basicAck(deliveryTag, false);
            log.debug("RabbitMQ ack successful (queue={} tag={})", queue, deliveryTag);
        } catch (Exception e) {
            throw new MessagingOperationException("Failed to ack message (queue=" + queue + " tag=" + deliveryTag + ")", e);
        }
    }

    /**
     * Negatively acknowledge without requeue. The queue's dead-letter arguments route the
     * message to the DLQ.
     */
    public void deadLetter() {
        markSettled("dead-letter");
        try {
            channel.basicNack(deliveryTag, false, false);
            log.debug("RabbitMQ nack without requeue issued (queue={} tag={})", queue, deliveryTag);
        } catch (Exception e) {
            throw new MessagingOperationException("Failed to dead-letter message (queue=" + queue + " tag=" + deliveryTag + ")", e);
        }
    }

    private void markSettled(String operation) {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException("Delivery " + deliveryTag + " on " + queue
                    + " is already settled; cannot " + operation);
        }
    }

    /**
     * Runtime exception wrapping channel I/O failures during ack / nack.
     */
    public static class MessagingOperationException extends RuntimeException {
        public MessagingOperationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
