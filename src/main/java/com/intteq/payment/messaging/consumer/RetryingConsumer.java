package com.intteq.payment.messaging.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.payment.messaging.MessageContext;
import com.intteq.payment.messaging.MessagingMetrics;
import com.intteq.payment.messaging.connection.BrokerConnectionManager;
import com.intteq.payment.messaging.connection.ConnectionListener;
import com.intteq.payment.messaging.exception.MessagingSetupException;
import com.intteq.payment.messaging.retry.TwoTierRetryStrategy;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Consumer engine: subscribes handlers to queues and drives each delivery to exactly one
 * of ack or nack.
 *
 * <pre>
 * Delivered -> Handling -> success -----------------------------> ack
 *                       -> failure, retryCount &lt; maxRetries ---> schedule republish, ack
 *                       -> failure, retryCount &gt;= maxRetries --> nack(requeue=false) -> DLQ
 * </pre>
 *
 * <p>Handler failures never reach the caller and never stop the subscription. Errors while
 * <em>setting up</em> a subscription do propagate.
 *
 * <p>Registered as a {@link ConnectionListener}: after a reconnect every active
 * subscription is bound to the new channel.
 */
@Slf4j
public class RetryingConsumer implements ConnectionListener, AutoCloseable {

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final BrokerConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final TwoTierRetryStrategy retryStrategy;
    private final MessagingMetrics metrics;
    private final IntFunction<Executor> handlerExecutors;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public RetryingConsumer(BrokerConnectionManager connectionManager,
                            ObjectMapper objectMapper,
                            TwoTierRetryStrategy retryStrategy,
                            MessagingMetrics metrics) {
        this(connectionManager, objectMapper, retryStrategy, metrics, RetryingConsumer::newHandlerPool);
    }

    /**
     * @param handlerExecutors creates the handler executor of a subscription from its prefetch
     */
    public RetryingConsumer(BrokerConnectionManager connectionManager,
                            ObjectMapper objectMapper,
                            TwoTierRetryStrategy retryStrategy,
                            MessagingMetrics metrics,
                            IntFunction<Executor> handlerExecutors) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.retryStrategy = retryStrategy;
        this.metrics = metrics;
        this.handlerExecutors = handlerExecutors;
        connectionManager.addListener(this);
    }

    // =====================================================================
    // SUBSCRIBE
    // =====================================================================

    /**
     * Start consuming {@code queue}. Connects lazily.
     *
     * @throws MessagingSetupException if consumption cannot be set up (e.g. missing queue)
     * @throws com.intteq.payment.messaging.exception.BrokerConnectionException if the broker is unreachable
     */
    public Subscription subscribe(String queue, MessageHandler handler, ConsumeOptions options) {
        ConsumeOptions opts = options != null ? options : ConsumeOptions.defaults();
        opts.validate();

        Subscription subscription = new Subscription(this, queue, handler, opts,
                handlerExecutors.apply(opts.getPrefetch()));
        subscriptions.add(subscription);
        try {
            subscription.bind(connectionManager.connect());
        } catch (RuntimeException e) {
            subscriptions.remove(subscription);
            subscription.shutdownExecutor();
            log.error("Error consuming queue {}", queue, e);
            throw e;
        }

        log.info("Started consuming queue {} (prefetch={} maxRetries={})",
                queue, opts.getPrefetch(), opts.getMaxRetries());
        return subscription;
    }

    /**
     * Fire-and-forget form of {@link #subscribe}.
     */
    public void consume(String queue, MessageHandler handler, ConsumeOptions options) {
        subscribe(queue, handler, options);
    }

    @Override
    public void onConnected(Channel channel) {
        for (Subscription subscription : subscriptions) {
            if (!subscription.isActive()) {
                continue;
            }
            try {
                subscription.bind(channel);
                log.info("Resumed consuming queue {} on new channel", subscription.getQueue());
            } catch (MessagingSetupException e) {
                log.error("Failed to resume consuming queue {}", subscription.getQueue(), e);
            }
        }
    }

    public List<Subscription> getSubscriptions() {
        return List.copyOf(subscriptions);
    }

    void remove(Subscription subscription) {
        subscriptions.remove(subscription);
    }

    // =====================================================================
    // DELIVERY STATE MACHINE
    // =====================================================================

    void process(Subscription subscription, Channel channel, Envelope envelope,
                 AMQP.BasicProperties properties, byte[] body) {
        String queue = subscription.getQueue();
        MessageContext context = MessageContext.forDelivery(queue, channel, envelope, properties, body);
        ConsumeOptions options = subscription.getOptions();

        try {
            JsonNode payload = parse(body);
            if (payload == null) {
                onMalformed(context, options);
                return;
            }

            log.debug("Processing message from queue {} (retry-count={})", queue, context.getRetryCount());
            HandlerResult result = invoke(subscription.getHandler(), payload, context);

            if (context.isSettled()) {
                // handler settled the delivery itself through the context
                return;
            }
            if (result.isSuccess()) {
                context.ack();
                metrics.consumed(queue, MessagingMetrics.SUCCESS);
                log.debug("Message acknowledged from queue {}", queue);
            } else {
                log.error("Error processing message from queue {} (attempt {})",
                        queue, context.getRetryCount() + 1L, result.getCause());
                retryStrategy.onFailure(context, result.getCause(), options.getMaxRetries());
            }
        } catch (MessageContext.MessagingOperationException e) {
            // at-least-once boundary: the broker redelivers the unsettled message
            log.warn("Could not settle delivery {} on queue {}, broker will redeliver it",
                    envelope.getDeliveryTag(), queue, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error settling delivery {} on queue {}", envelope.getDeliveryTag(), queue, e);
            deadLetterUnsettled(context);
        }
    }

    private void deadLetterUnsettled(MessageContext context) {
        if (context.isSettled()) {
            return;
        }
        try {
            context.deadLetter();
            metrics.consumed(context.getQueue(), MessagingMetrics.DEAD_LETTER);
            log.error("Delivery {} on queue {} sent to DLQ", context.getDeliveryTag(), context.getQueue());
        } catch (MessageContext.MessagingOperationException e) {
            log.warn("Could not dead-letter delivery {} on queue {}, broker will redeliver it",
                    context.getDeliveryTag(), context.getQueue(), e);
        }
    }

    private JsonNode parse(byte[] body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node == null || node.isMissingNode() ? null : node;
        } catch (IOException e) {
            log.debug("Body is not valid JSON: {}", e.getMessage());
            return null;
        }
    }

    private void onMalformed(MessageContext context, ConsumeOptions options) {
        if (options.isDeadLetterMalformed()) {
            context.deadLetter();
            metrics.consumed(context.getQueue(), MessagingMetrics.DEAD_LETTER);
            log.error("Malformed JSON on queue {} (tag={}), sent to DLQ without retry",
                    context.getQueue(), context.getDeliveryTag());
        } else {
            retryStrategy.onFailure(context,
                    new IllegalArgumentException("Message body on " + context.getQueue() + " is not valid JSON"),
                    options.getMaxRetries());
        }
    }

    private HandlerResult invoke(MessageHandler handler, JsonNode payload, MessageContext context) {
        long start = System.nanoTime();
        try {
            HandlerResult result = handler.handle(payload, context);
            return result != null ? result : HandlerResult.success();
        } catch (Throwable t) {
            // errors thrown by a handler still go through retry and dead-lettering
            return HandlerResult.failure(t);
        } finally {
            metrics.handlerLatency(context.getQueue(), System.nanoTime() - start);
        }
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    @Override
    public void close() {
        subscriptions.forEach(Subscription::cancel);
        connectionManager.removeListener(this);
    }

    private static Executor newHandlerPool(int size) {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger thread = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "messaging-handler-" + pool + "-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
