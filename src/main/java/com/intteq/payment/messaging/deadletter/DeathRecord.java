package com.intteq.payment.messaging.deadletter;

import lombok.Value;

import java.util.List;

/**
 * One entry of the broker-maintained {@code x-death} header.
 */
@Value
public class DeathRecord {
    String queue;
    String reason;
    long count;
    String exchange;
    List<String> routingKeys;
}
