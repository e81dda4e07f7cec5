package com.intteq.payment.messaging.admin;

import com.intteq.payment.messaging.connection.BrokerConnectionManager;
import com.rabbitmq.client.AMQP;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Queue inspection and purge for operational tooling.
 *
 * <p>Calls run on a temporary channel: a passive declare of a missing queue closes its
 * channel, and that must not take the shared publish / consume channel down with it.
 */
@Slf4j
@RequiredArgsConstructor
public class QueueAdministrator {

    private final BrokerConnectionManager connectionManager;

    /**
     * Current counters of {@code queue}; empty when the queue does not exist or the broker
     * is unreachable.
     */
    public Optional<QueueStats> stats(String queue) {
        try {
            AMQP.Queue.DeclareOk ok = connectionManager.withTemporaryChannel(ch -> ch.queueDeclarePassive(queue));
            return Optional.of(new QueueStats(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount()));
        } catch (Exception e) {
            log.error("Error getting stats for queue {}", queue, e);
            return Optional.empty();
        }
    }

    /**
     * Remove every ready message from {@code queue}.
     *
     * @return {@code false} if the purge failed
     */
    public boolean purge(String queue) {
        try {
            int purged = connectionManager.withTemporaryChannel(ch -> ch.queuePurge(queue).getMessageCount());
            log.info("Queue {} purged ({} messages)", queue, purged);
            return true;
        } catch (Exception e) {
            log.error("Error purging queue {}", queue, e);
            return false;
        }
    }
}
