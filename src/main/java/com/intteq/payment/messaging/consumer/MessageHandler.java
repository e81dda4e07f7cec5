package com.intteq.payment.messaging.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.intteq.payment.messaging.MessageContext;

/**
 * Business callback for one delivery.
 *
 * <p>Handlers report their outcome through the returned {@link HandlerResult}. A thrown
 * exception is treated as {@link HandlerResult#failure(Throwable)}. A {@code null} return
 * counts as success.
 *
 * <p>Delivery is at-least-once, so handlers must be idempotent. With a prefetch above 1
 * they must also be safe under concurrent invocation.
 */
@FunctionalInterface
public interface MessageHandler {

    HandlerResult handle(JsonNode payload, MessageContext context) throws Exception;
}
