package com.intteq.payment.messaging.admin;

import lombok.Value;

/**
 * Point-in-time queue counters as reported by a passive declare.
 */
@Value
public class QueueStats {
    String queue;
    long messageCount;
    long consumerCount;
}
