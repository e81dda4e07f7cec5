package com.intteq.payment.messaging.topology;

import com.intteq.payment.messaging.exception.TopologyMismatchException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static declaration of the broker topology:
 * <ul>
 *     <li>the dead-letter queue, with a message TTL and no dead-letter wiring of its own</li>
 *     <li>durable work queues, dead-lettering into the DLQ through the default exchange</li>
 *     <li>durable topic / fan-out exchanges</li>
 *     <li>queue bindings</li>
 * </ul>
 *
 * <p>Declarables are kept in exactly that order. Brokers that validate dead-letter targets
 * eagerly would otherwise reject a queue declared before its DLQ.
 *
 * <p>This class holds no runtime state. {@link #declare(Channel)} is applied once per
 * connection establishment and is a no-op when the broker already matches.
 */
@Slf4j
public class TopologyDescriptor {

    public static final Duration DEFAULT_DEAD_LETTER_TTL = Duration.ofHours(24);

    static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";
    static final String MESSAGE_TTL_ARG = "x-message-ttl";

    private final String deadLetterQueue;
    private final Duration deadLetterTtl;
    private final Declarables declarables;

    private TopologyDescriptor(String deadLetterQueue, Duration deadLetterTtl, List<Declarable> ordered) {
        this.deadLetterQueue = deadLetterQueue;
        this.deadLetterTtl = deadLetterTtl;
        this.declarables = new Declarables(ordered);
    }

    /**
     * The fixed payment topology.
     */
    public static TopologyDescriptor paymentTopology(Duration deadLetterTtl) {
        return builder()
                .deadLetterQueue(PaymentQueues.PAYMENT_DLQ, deadLetterTtl)
                .queues(PaymentQueues.WORK_QUEUES)
                .topicExchange(PaymentExchanges.PAYMENT)
                .fanoutExchange(PaymentExchanges.NOTIFICATION)
                .binding(PaymentQueues.PAYMENT_PROCESSING, PaymentExchanges.PAYMENT, "payment.#")
                .binding(PaymentQueues.WEBHOOK_DELIVERY, PaymentExchanges.NOTIFICATION, "")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public Duration getDeadLetterTtl() {
        return deadLetterTtl;
    }

    /**
     * Declarables in declaration order.
     */
    public Collection<Declarable> getDeclarables() {
        return declarables.getDeclarables();
    }

    /**
     * Apply the topology to {@code channel}.
     *
     * @throws TopologyMismatchException if the broker refuses a declaration
     * @throws IOException               on a connection-level failure
     */
    public void declare(Channel channel) throws IOException {
        for (Declarable declarable : getDeclarables()) {
            String name = describe(declarable);
            try {
                if (declarable instanceof Queue queue) {
                    channel.queueDeclare(queue.getName(), queue.isDurable(), queue.isExclusive(),
                            queue.isAutoDelete(), queue.getArguments());
                } else if (declarable instanceof Exchange exchange) {
                    channel.exchangeDeclare(exchange.getName(), exchange.getType(), exchange.isDurable(),
                            exchange.isAutoDelete(), exchange.isInternal(), exchange.getArguments());
                } else if (declarable instanceof Binding binding) {
                    channel.queueBind(binding.getDestination(), binding.getExchange(),
                            binding.getRoutingKey(), binding.getArguments());
                }
                log.debug("Declared {}", name);
            } catch (IOException e) {
                if (isChannelLevelRefusal(e)) {
                    log.error("Broker refused declaration of {}", name, e);
                    throw new TopologyMismatchException(name, e);
                }
                throw e;
            }
        }
        log.info("RabbitMQ topology declared: {} declarables, dlq={}", getDeclarables().size(), deadLetterQueue);
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    /**
     * A channel-level close (406 PRECONDITION_FAILED, 404, 403...) means the declaration
     * itself was refused. A hard (connection-level) error is a transport problem.
     */
    private static boolean isChannelLevelRefusal(IOException e) {
        return e.getCause() instanceof ShutdownSignalException sse && !sse.isHardError();
    }

    private static String describe(Declarable declarable) {
        if (declarable instanceof Queue queue) {
            return "queue '" + queue.getName() + "'";
        }
        if (declarable instanceof Exchange exchange) {
            return exchange.getType() + " exchange '" + exchange.getName() + "'";
        }
        if (declarable instanceof Binding binding) {
            return "binding '" + binding.getDestination() + "' <- '" + binding.getExchange()
                    + "' (" + binding.getRoutingKey() + ")";
        }
        return String.valueOf(declarable);
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {

        private String deadLetterQueue;
        private Duration deadLetterTtl = DEFAULT_DEAD_LETTER_TTL;
        private final Map<String, Queue> queues = new LinkedHashMap<>();
        private final Map<String, Exchange> exchanges = new LinkedHashMap<>();
        private final List<String[]> bindings = new ArrayList<>();

        private Builder() {
        }

        public Builder deadLetterQueue(String name, Duration ttl) {
            Objects.requireNonNull(name, "dead-letter queue name must not be null");
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("dead-letter TTL must be positive");
            }
            this.deadLetterQueue = name;
            this.deadLetterTtl = ttl;
            return this;
        }

        public Builder queue(String name) {
            Objects.requireNonNull(name, "queue name must not be null");
            queues.put(name, null);
            return this;
        }

        public Builder queues(Collection<String> names) {
            names.forEach(this::queue);
            return this;
        }

        public Builder topicExchange(String name) {
            exchanges.put(name, ExchangeBuilder.topicExchange(name).durable(true).build());
            return this;
        }

        public Builder fanoutExchange(String name) {
            exchanges.put(name, ExchangeBuilder.fanoutExchange(name).durable(true).build());
            return this;
        }

        public Builder directExchange(String name) {
            exchanges.put(name, ExchangeBuilder.directExchange(name).durable(true).build());
            return this;
        }

        public Builder binding(String queue, String exchange, String routingKey) {
            bindings.add(new String[]{queue, exchange, routingKey == null ? "" : routingKey});
            return this;
        }

        public TopologyDescriptor build() {
            if (deadLetterQueue == null) {
                throw new IllegalStateException("A dead-letter queue must be declared");
            }
            if (queues.containsKey(deadLetterQueue)) {
                throw new IllegalStateException("Dead-letter queue '" + deadLetterQueue
                        + "' must not be declared as a work queue; it is terminal");
            }

            List<Declarable> ordered = new ArrayList<>();

            // 1. DLQ first: it is the dead-letter target of everything else
            Queue dlq = QueueBuilder.durable(deadLetterQueue)
                    .withArgument(MESSAGE_TTL_ARG, Math.toIntExact(deadLetterTtl.toMillis()))
                    .build();
            ordered.add(dlq);

            // 2. Work queues, dead-lettered to the DLQ through the default exchange
            Map<String, Queue> declaredQueues = new LinkedHashMap<>();
            declaredQueues.put(deadLetterQueue, dlq);
            for (String name : queues.keySet()) {
                Queue queue = QueueBuilder.durable(name)
                        .withArgument(DEAD_LETTER_EXCHANGE_ARG, "")
                        .withArgument(DEAD_LETTER_ROUTING_KEY_ARG, deadLetterQueue)
                        .build();
                declaredQueues.put(name, queue);
                ordered.add(queue);
            }

            // 3. Exchanges
            ordered.addAll(exchanges.values());

            // 4. Bindings
            for (String[] entry : bindings) {
                Queue queue = declaredQueues.get(entry[0]);
                Exchange exchange = exchanges.get(entry[1]);
                if (queue == null) {
                    throw new IllegalStateException("Binding references undeclared queue '" + entry[0] + "'");
                }
                if (exchange == null) {
                    throw new IllegalStateException("Binding references undeclared exchange '" + entry[1] + "'");
                }
                ordered.add(bind(queue, exchange, entry[2]));
            }

            return new TopologyDescriptor(deadLetterQueue, deadLetterTtl, ordered);
        }

        private static Binding bind(Queue queue, Exchange exchange, String routingKey) {
            if (exchange instanceof FanoutExchange fanout) {
                return BindingBuilder.bind(queue).to(fanout);
            }
            if (exchange instanceof TopicExchange topic) {
                return BindingBuilder.bind(queue).to(topic).with(routingKey);
            }
            return BindingBuilder.bind(queue).to((DirectExchange) exchange).with(routingKey);
        }
    }
}
