package com.intteq.payment.messaging.publisher;

/**
 * Publishes JSON work items for durable delivery.
 *
 * <p>Every method returns {@code false} instead of throwing. {@code false} means either that
 * the broker applied flow control (backpressure, the caller decides to retry, drop or
 * block) or that serialization or the broker call failed; the cause is logged. Nothing is
 * retried at publish time.
 */
public interface MessagePublisher {

    /**
     * Serialize {@code payload} to JSON and deliver it straight to {@code queue}.
     */
    boolean publishToQueue(String queue, Object payload, PublishOptions options);

    /**
     * Serialize {@code payload} to JSON and route it through {@code exchange}. Fan-out or
     * topic semantics follow from the declared exchange type.
     */
    boolean publishToExchange(String exchange, String routingKey, Object payload, PublishOptions options);

    /**
     * Deliver an already serialized JSON body to {@code queue} without re-encoding it.
     */
    boolean publishRawToQueue(String queue, byte[] body, PublishOptions options);

    default boolean publishToQueue(String queue, Object payload) {
        return publishToQueue(queue, payload, PublishOptions.none());
    }

    default boolean publishToExchange(String exchange, String routingKey, Object payload) {
        return publishToExchange(exchange, routingKey, payload, PublishOptions.none());
    }
}
