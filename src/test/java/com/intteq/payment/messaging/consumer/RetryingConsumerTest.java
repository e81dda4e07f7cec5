package com.intteq.payment.messaging.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.payment.messaging.MessageContext;
import com.intteq.payment.messaging.MessagingMetrics;
import com.intteq.payment.messaging.connection.BrokerConnectionManager;
import com.intteq.payment.messaging.deadletter.DeadLetterQueue;
import com.intteq.payment.messaging.deadletter.DeathRecord;
import com.intteq.payment.messaging.exception.BrokerConnectionException;
import com.intteq.payment.messaging.exception.MessagingSetupException;
import com.intteq.payment.messaging.publisher.RabbitMessagePublisher;
import com.intteq.payment.messaging.retry.RetryPolicy;
import com.intteq.payment.messaging.retry.TwoTierRetryStrategy;
import com.intteq.payment.messaging.support.InMemoryBroker;
import com.intteq.payment.messaging.support.ManualDelayScheduler;
import com.intteq.payment.messaging.topology.PaymentQueues;
import com.intteq.payment.messaging.topology.TopologyDescriptor;
import com.rabbitmq.client.AMQP;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

class RetryingConsumerTest {

    private static final String QUEUE = PaymentQueues.PAYMENT_PROCESSING;
    private static final Map<String, Object> PAYMENT = Map.of("amount", 100, "currency", "USD");

    private final InMemoryBroker broker = new InMemoryBroker();
    private final ManualDelayScheduler scheduler = new ManualDelayScheduler();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Runnable> deferred = new ArrayList<>();

    private BrokerConnectionManager manager;
    private RabbitMessagePublisher publisher;
    private TwoTierRetryStrategy strategy;
    private MessagingMetrics metrics;

    @BeforeEach
    void setUp() {
        manager = new BrokerConnectionManager(broker.connectionFactory(),
                TopologyDescriptor.paymentTopology(Duration.ofHours(24)),
                scheduler, Duration.ofSeconds(5), 0, "test");
        metrics = new MessagingMetrics(registry);
        publisher = new RabbitMessagePublisher(manager, objectMapper, metrics,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        strategy = new TwoTierRetryStrategy(RetryPolicy.defaults(), scheduler, publisher, metrics);
    }

    @AfterEach
    void tearDown() {
        manager.close();
        assertThat(broker.protocolErrors()).isEmpty();
    }

    @Test
    void successfulHandlerAcksTheDelivery() {
        List<JsonNode> received = new ArrayList<>();
        RetryingConsumer consumer = directConsumer();
        consumer.subscribe(QUEUE, (payload, ctx) -> {
            received.add(payload);
            return HandlerResult.success();
        }, ConsumeOptions.defaults());

        assertThat(publisher.publishToQueue(QUEUE, PAYMENT)).isTrue();

        assertThat(received).hasSize(1);
        assertThat(received.get(0).get("amount").asInt()).isEqualTo(100);
        assertThat(broker.depth(QUEUE)).isZero();
        assertThat(broker.unacknowledged()).isZero();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isZero();
        assertThat(registry.counter("payment.messaging.consume", "queue", QUEUE, "outcome", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void payloadArrivesByteIdenticalAndPersistent() {
        List<MessageContext> contexts = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            contexts.add(ctx);
            return null;
        }, ConsumeOptions.defaults());

        publisher.publishToQueue(QUEUE, PAYMENT);

        MessageContext ctx = contexts.get(0);
        assertThat(ctx.getBodyAsString()).isIn("{\"amount\":100,\"currency\":\"USD\"}", "{\"currency\":\"USD\",\"amount\":100}");
        assertThat(ctx.getProperties().getDeliveryMode()).isEqualTo(2);
        assertThat(ctx.getProperties().getContentType()).isEqualTo("application/json");
        assertThat(ctx.getRetryCount()).isZero();
        assertThat(ctx.isSettled()).isTrue();
    }

    @Test
    void transientFailuresAreRetriedWithBackoffUntilSuccess() {
        List<Integer> attempts = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            attempts.add(ctx.getRetryCount());
            if (attempts.size() < 3) {
                throw new IllegalStateException("acquirer timeout");
            }
            return HandlerResult.success();
        }, ConsumeOptions.builder().maxRetries(3).build());

        publisher.publishToQueue(QUEUE, PAYMENT);
        assertThat(attempts).containsExactly(0);
        assertThat(broker.depth(QUEUE)).isZero();

        scheduler.advance(Duration.ofMillis(1999));
        assertThat(attempts).containsExactly(0);

        scheduler.advance(Duration.ofMillis(1));
        assertThat(attempts).containsExactly(0, 1);

        scheduler.advance(Duration.ofSeconds(4));
        assertThat(attempts).containsExactly(0, 1, 2);

        assertThat(scheduler.requestedDelays()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(broker.depth(QUEUE)).isZero();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isZero();
        assertThat(broker.unacknowledged()).isZero();
    }

    @Test
    void exhaustedRetriesEndInTheDeadLetterQueue() {
        List<Integer> attempts = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            attempts.add(ctx.getRetryCount());
            return HandlerResult.failure("card declined by issuer");
        }, ConsumeOptions.builder().maxRetries(3).build());

        publisher.publishToQueue(QUEUE, PAYMENT);
        scheduler.advance(Duration.ofSeconds(2));
        scheduler.advance(Duration.ofSeconds(4));

        assertThat(attempts).containsExactly(0, 1, 2);
        assertThat(broker.depth(QUEUE)).isZero();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isEqualTo(1);
        assertThat(scheduler.pendingCount()).isZero();

        InMemoryBroker.StoredMessage dead = broker.messages(PaymentQueues.PAYMENT_DLQ).get(0);
        assertThat(dead.header(MessageContext.RETRY_COUNT_HEADER)).isEqualTo(2);
        DeathRecord death = DeadLetterQueue.lastDeath(dead.getProperties().getHeaders()).orElseThrow();
        assertThat(death.getQueue()).isEqualTo(QUEUE);
        assertThat(death.getReason()).isEqualTo("rejected");
        assertThat(registry.counter("payment.messaging.consume", "queue", QUEUE, "outcome", "dead_letter").count())
                .isEqualTo(1.0);
    }

    @Test
    void malformedJsonIsDeadLetteredWithoutCallingTheHandler() {
        List<JsonNode> received = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            received.add(payload);
            return null;
        }, ConsumeOptions.defaults());

        broker.inject(QUEUE, new AMQP.BasicProperties(), "not-json{".getBytes(StandardCharsets.UTF_8));

        assertThat(received).isEmpty();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isEqualTo(1);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void malformedJsonCanBeRetriedInstead() {
        directConsumer().subscribe(QUEUE, (payload, ctx) -> null,
                ConsumeOptions.builder().deadLetterMalformed(false).build());

        broker.inject(QUEUE, new AMQP.BasicProperties(), new byte[0]);

        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isZero();
        assertThat(scheduler.pendingCount()).isEqualTo(1);
    }

    @Test
    void handlerMaySettleTheDeliveryItself() {
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            ctx.deadLetter();
            return HandlerResult.success();
        }, ConsumeOptions.defaults());

        publisher.publishToQueue(QUEUE, PAYMENT);

        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isEqualTo(1);
        assertThat(broker.unacknowledged()).isZero();
    }

    @Test
    void prefetchBoundsUnacknowledgedDeliveries() throws Exception {
        RetryingConsumer consumer = deferredConsumer();
        consumer.subscribe(QUEUE, (payload, ctx) -> null, ConsumeOptions.builder().prefetch(2).build());
        verify(manager.connect()).basicQos(2, false);

        publisher.publishToQueue(QUEUE, Map.of("n", 1));
        publisher.publishToQueue(QUEUE, Map.of("n", 2));
        publisher.publishToQueue(QUEUE, Map.of("n", 3));

        assertThat(deferred).hasSize(2);
        assertThat(broker.unacknowledged()).isEqualTo(2);
        assertThat(broker.depth(QUEUE)).isEqualTo(1);

        deferred.get(0).run();

        assertThat(deferred).hasSize(3);
        assertThat(broker.depth(QUEUE)).isZero();
    }

    @Test
    void subscriptionsResumeAfterTheConnectionDrops() {
        List<Boolean> redelivered = new ArrayList<>();
        RetryingConsumer consumer = deferredConsumer();
        consumer.subscribe(QUEUE, (payload, ctx) -> {
            redelivered.add(ctx.isRedelivered());
            return HandlerResult.success();
        }, ConsumeOptions.defaults());
        publisher.publishToQueue(QUEUE, PAYMENT);
        assertThat(deferred).hasSize(1);

        broker.dropConnections();
        // the ack of the first attempt fails on the dead channel; the broker still owns the message
        deferred.get(0).run();
        assertThat(broker.depth(QUEUE)).isEqualTo(1);

        scheduler.advance(Duration.ofSeconds(5));

        assertThat(manager.isConnected()).isTrue();
        assertThat(deferred).hasSize(2);
        deferred.get(1).run();
        assertThat(redelivered).containsExactly(false, true);
        assertThat(broker.depth(QUEUE)).isZero();
        assertThat(broker.consumerCount(QUEUE)).isEqualTo(1);
        assertThat(broker.unacknowledged()).isZero();
    }

    @Test
    void missingQueueFailsTheSubscription() {
        RetryingConsumer consumer = directConsumer();

        assertThatThrownBy(() -> consumer.subscribe("no.such.queue", (payload, ctx) -> null, ConsumeOptions.defaults()))
                .isInstanceOf(MessagingSetupException.class)
                .hasMessageContaining("no.such.queue");
        assertThat(consumer.getSubscriptions()).isEmpty();
    }

    @Test
    void unreachableBrokerFailsTheSubscription() {
        broker.setReachable(false);
        RetryingConsumer consumer = directConsumer();

        assertThatThrownBy(() -> consumer.subscribe(QUEUE, (payload, ctx) -> null, ConsumeOptions.defaults()))
                .isInstanceOf(BrokerConnectionException.class);
        assertThat(consumer.getSubscriptions()).isEmpty();
    }

    @Test
    void invalidOptionsAreRejected() {
        RetryingConsumer consumer = directConsumer();

        assertThatThrownBy(() -> consumer.subscribe(QUEUE, (payload, ctx) -> null,
                ConsumeOptions.builder().prefetch(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> consumer.subscribe(QUEUE, (payload, ctx) -> null,
                ConsumeOptions.builder().maxRetries(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelledSubscriptionStopsReceiving() {
        RetryingConsumer consumer = directConsumer();
        Subscription subscription = consumer.subscribe(QUEUE, (payload, ctx) -> null, ConsumeOptions.defaults());

        subscription.cancel();
        publisher.publishToQueue(QUEUE, PAYMENT);

        assertThat(subscription.isActive()).isFalse();
        assertThat(consumer.getSubscriptions()).isEmpty();
        assertThat(broker.depth(QUEUE)).isEqualTo(1);
    }

    @Test
    void closeCancelsEverySubscription() {
        RetryingConsumer consumer = directConsumer();
        consumer.consume(QUEUE, (payload, ctx) -> null, ConsumeOptions.defaults());
        consumer.consume(PaymentQueues.FRAUD_DETECTION, (payload, ctx) -> null, ConsumeOptions.defaults());

        consumer.close();

        assertThat(consumer.getSubscriptions()).isEmpty();
        assertThat(broker.consumerCount(QUEUE)).isZero();
        assertThat(broker.consumerCount(PaymentQueues.FRAUD_DETECTION)).isZero();
    }

    @Test
    void retryRepublishWaitsForTheBrokerToUnblock() throws Exception {
        List<Integer> attempts = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            attempts.add(ctx.getRetryCount());
            if (attempts.size() == 1) {
                throw new IllegalStateException("acquirer timeout");
            }
            return HandlerResult.success();
        }, ConsumeOptions.builder().maxRetries(3).build());

        publisher.publishToQueue(QUEUE, PAYMENT);
        broker.block("low on disk");
        scheduler.advance(Duration.ofSeconds(2));

        assertThat(attempts).containsExactly(0);
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        broker.unblock();
        scheduler.advance(Duration.ofSeconds(2));

        assertThat(attempts).containsExactly(0, 1);
        assertThat(broker.depth(QUEUE)).isZero();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isZero();
        assertThat(broker.unacknowledged()).isZero();
    }

    @Test
    void outOfRangeRetryCountHeaderIsDeadLetteredInsteadOfStalling() {
        List<Integer> attempts = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            attempts.add(ctx.getRetryCount());
            return HandlerResult.failure("card declined by issuer");
        }, ConsumeOptions.defaults());

        broker.inject(QUEUE, withRetryCount(Integer.MAX_VALUE), "{\"amount\":100}".getBytes(StandardCharsets.UTF_8));
        broker.inject(QUEUE, withRetryCount((1L << 32) + 1), "{\"amount\":200}".getBytes(StandardCharsets.UTF_8));

        assertThat(attempts).containsExactly(Integer.MAX_VALUE, Integer.MAX_VALUE);
        assertThat(broker.unacknowledged()).isZero();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isEqualTo(2);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void handlerErrorIsRetriedLikeAnyOtherFailure() {
        List<Integer> attempts = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            attempts.add(ctx.getRetryCount());
            if (attempts.size() == 1) {
                throw new AssertionError("ledger out of balance");
            }
            return HandlerResult.success();
        }, ConsumeOptions.builder().maxRetries(3).build());

        publisher.publishToQueue(QUEUE, PAYMENT);

        assertThat(broker.unacknowledged()).isZero();
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        scheduler.advance(Duration.ofSeconds(2));

        assertThat(attempts).containsExactly(0, 1);
        assertThat(broker.depth(QUEUE)).isZero();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isZero();
    }

    @Test
    void failedAckAfterHandlerFailureLeavesOnlyTheBrokerRedelivery() {
        List<Integer> attempts = new ArrayList<>();
        directConsumer().subscribe(QUEUE, (payload, ctx) -> {
            attempts.add(ctx.getRetryCount());
            if (attempts.size() == 1) {
                broker.failChannels();
                throw new IllegalStateException("acquirer timeout");
            }
            return HandlerResult.success();
        }, ConsumeOptions.builder().maxRetries(3).build());

        publisher.publishToQueue(QUEUE, PAYMENT);

        // only the reconnect is pending, no republish
        assertThat(scheduler.requestedDelays()).containsExactly(Duration.ofSeconds(5));

        scheduler.advance(Duration.ofMinutes(1));

        assertThat(attempts).containsExactly(0, 0);
        assertThat(broker.depth(QUEUE)).isZero();
        assertThat(broker.depth(PaymentQueues.PAYMENT_DLQ)).isZero();
        assertThat(broker.unacknowledged()).isZero();
    }

    private static AMQP.BasicProperties withRetryCount(Object retryCount) {
        return new AMQP.BasicProperties.Builder()
                .contentType("application/json")
                .headers(Map.of(MessageContext.RETRY_COUNT_HEADER, retryCount))
                .build();
    }

    private RetryingConsumer directConsumer() {
        return newConsumer(prefetch -> Runnable::run);
    }

    private RetryingConsumer deferredConsumer() {
        return newConsumer(prefetch -> deferred::add);
    }

    private RetryingConsumer newConsumer(IntFunction<Executor> executors) {
        return new RetryingConsumer(manager, objectMapper, strategy, metrics, executors);
    }
}
