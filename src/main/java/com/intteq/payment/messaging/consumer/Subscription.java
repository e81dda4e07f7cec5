package com.intteq.payment.messaging.consumer;

import com.intteq.payment.messaging.exception.MessagingSetupException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Handle to one queue subscription created by {@link RetryingConsumer}.
 *
 * <p>A subscription outlives channels: after a reconnect it is bound again to the new
 * channel. Deliveries are handed to a pool sized to the prefetch count, so at most
 * {@code prefetch} handler invocations are in flight.
 */
@Slf4j
public class Subscription {

    private final RetryingConsumer owner;
    private final String queue;
    private final MessageHandler handler;
    private final ConsumeOptions options;
    private final Executor handlerExecutor;

    private volatile Channel boundChannel;
    private volatile String consumerTag;
    private volatile boolean active = true;

    Subscription(RetryingConsumer owner, String queue, MessageHandler handler,
                 ConsumeOptions options, Executor handlerExecutor) {
        this.owner = owner;
        this.queue = queue;
        this.handler = handler;
        this.options = options;
        this.handlerExecutor = handlerExecutor;
    }

    /**
     * Start consuming on {@code channel}. A no-op when already bound to it.
     */
    synchronized void bind(Channel channel) {
        if (!active || channel == boundChannel) {
            return;
        }
        try {
            channel.basicQos(options.getPrefetch(), false);
            consumerTag = channel.basicConsume(queue, false, new DeliveryConsumer(channel));
            boundChannel = channel;
        } catch (IOException | RuntimeException e) {
            throw new MessagingSetupException("Failed to start consuming queue " + queue, e);
        }
    }

    /**
     * Cancel the broker consumer and stop the handler pool. Deliveries not yet acked are
     * redelivered by the broker.
     */
    public synchronized void cancel() {
        if (!active) {
            return;
        }
        active = false;

        Channel channel = boundChannel;
        String tag = consumerTag;
        if (channel != null && tag != null && channel.isOpen()) {
            try {
                channel.basicCancel(tag);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to cancel consumer {} on queue {}", tag, queue, e);
            }
        }
        if (handlerExecutor instanceof ExecutorService executorService) {
            executorService.shutdown();
        }
        owner.remove(this);
        log.info("Stopped consuming queue {}", queue);
    }

    void shutdownExecutor() {
        if (handlerExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }

    public boolean isActive() {
        return active;
    }

    public String getQueue() {
        return queue;
    }

    public ConsumeOptions getOptions() {
        return options;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    MessageHandler getHandler() {
        return handler;
    }

    private final class DeliveryConsumer extends DefaultConsumer {

        DeliveryConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            Channel channel = getChannel();
            try {
                handlerExecutor.execute(() -> owner.process(Subscription.this, channel, envelope, properties, body));
            } catch (RejectedExecutionException e) {
                log.warn("Subscription to {} is stopping, delivery {} left for broker redelivery",
                        queue, envelope.getDeliveryTag());
            }
        }

        @Override
        public void handleCancel(String tag) {
            log.warn("Broker cancelled consumer {} on queue {} (queue deleted?)", tag, queue);
        }
    }
}
