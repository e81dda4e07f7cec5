package com.intteq.payment.messaging.admin;

import com.intteq.payment.messaging.connection.BrokerConnectionManager;
import com.intteq.payment.messaging.support.InMemoryBroker;
import com.intteq.payment.messaging.support.ManualDelayScheduler;
import com.intteq.payment.messaging.topology.PaymentQueues;
import com.intteq.payment.messaging.topology.TopologyDescriptor;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class QueueAdministratorTest {

    private final InMemoryBroker broker = new InMemoryBroker();
    private final BrokerConnectionManager manager = new BrokerConnectionManager(broker.connectionFactory(),
            TopologyDescriptor.paymentTopology(Duration.ofHours(24)), new ManualDelayScheduler());
    private final QueueAdministrator administrator = new QueueAdministrator(manager);

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void reportsQueueCounters() {
        manager.connect();
        broker.inject(PaymentQueues.SETTLEMENT_CALCULATION, new AMQP.BasicProperties(), bytes("{}"));
        broker.inject(PaymentQueues.SETTLEMENT_CALCULATION, new AMQP.BasicProperties(), bytes("{}"));

        assertThat(administrator.stats(PaymentQueues.SETTLEMENT_CALCULATION))
                .contains(new QueueStats(PaymentQueues.SETTLEMENT_CALCULATION, 2, 0));
    }

    @Test
    void missingQueueYieldsEmptyStatsWithoutHurtingTheSharedChannel() {
        Channel shared = manager.connect();

        assertThat(administrator.stats("no.such.queue")).isEmpty();
        assertThat(shared.isOpen()).isTrue();
        assertThat(manager.isConnected()).isTrue();
    }

    @Test
    void purgeEmptiesTheQueue() {
        manager.connect();
        broker.inject(PaymentQueues.CURRENCY_UPDATE, new AMQP.BasicProperties(), bytes("{}"));

        assertThat(administrator.purge(PaymentQueues.CURRENCY_UPDATE)).isTrue();
        assertThat(broker.depth(PaymentQueues.CURRENCY_UPDATE)).isZero();
    }

    @Test
    void purgeOfMissingQueueFails() {
        assertThat(administrator.purge("no.such.queue")).isFalse();
    }

    @Test
    void unreachableBrokerYieldsEmptyStats() {
        broker.setReachable(false);

        assertThat(administrator.stats(PaymentQueues.PAYMENT_DLQ)).isEmpty();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
