package com.intteq.payment.messaging.retry;

import com.intteq.payment.messaging.MessageContext;
import com.intteq.payment.messaging.MessagingMetrics;
import com.intteq.payment.messaging.publisher.MessagePublisher;
import com.intteq.payment.messaging.publisher.PublishOptions;
import com.rabbitmq.client.AMQP;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Failure path of the consumer engine. Retries happen in two tiers:
 *
 * <ol>
 *     <li><b>Application tier</b>: while {@code retryCount < maxRetries} the same body is
 *     republished to the same queue after a capped exponential backoff, carrying
 *     {@code retry-count = retryCount}, and the failed delivery is acked. The broker's
 *     dead-letter TTL tricks cannot provide per-attempt backoff, so this tier is ours.</li>
 *     <li><b>Broker tier</b>: once retries are exhausted the delivery is nacked without
 *     requeue and the queue's dead-letter arguments route it to the DLQ.</li>
 * </ol>
 *
 * <p>This is not broker auto-retry: nothing is ever requeued in place.
 *
 * <p>The failed delivery is acked first and the republish is scheduled only once the ack went
 * through; if the ack fails the broker still owns the message and redelivers it, so no
 * second copy is ever scheduled. The ack does not wait for the republish to be
 * <em>sent</em>: a process crash inside the backoff window loses that work item.
 *
 * <p>A republish the publisher refuses (broker blocked, connection down) is attempted again
 * after the same backoff until it goes through or the scheduler is shut down.
 */
@Slf4j
@RequiredArgsConstructor
public class TwoTierRetryStrategy {

    private final RetryPolicy policy;
    private final DelayScheduler scheduler;
    private final MessagePublisher publisher;
    private final MessagingMetrics metrics;

    /**
     * Settle a failed delivery: schedule a republish and ack, or dead-letter.
     *
     * @return the decision that was applied
     */
    public RetryDecision onFailure(MessageContext context, Throwable cause, int maxRetries) {
        RetryDecision decision = policy.decide(context.getRetryCount(), maxRetries);
        String queue = context.getQueue();

        if (decision.isRetry()) {
            context.ack();
            scheduleRepublish(context, decision);
            metrics.consumed(queue, MessagingMetrics.RETRY);
            log.info("Message requeued to {} (retry {}/{}) in {}ms",
                    queue, decision.getRetryCount(), maxRetries, decision.getDelay().toMillis());
        } else {
            context.deadLetter();
            metrics.consumed(queue, MessagingMetrics.DEAD_LETTER);
            log.error("Message sent to DLQ after {} failed attempts (queue={} tag={})",
                    decision.getRetryCount(), queue, context.getDeliveryTag(), cause);
        }
        return decision;
    }

    private void scheduleRepublish(MessageContext context, RetryDecision decision) {
        String queue = context.getQueue();
        byte[] body = context.getBody();
        PublishOptions options = republishOptions(context, decision.getRetryCount());
        scheduler.schedule(() -> republish(queue, body, options, decision), decision.getDelay());
    }

    private void republish(String queue, byte[] body, PublishOptions options, RetryDecision decision) {
        if (publisher.publishRawToQueue(queue, body, options)) {
            return;
        }
        log.warn("Retry {} for queue {} could not be republished, trying again in {}ms (messageId={} bytes={})",
                decision.getRetryCount(), queue, decision.getDelay().toMillis(), options.getMessageId(), body.length);
        scheduler.schedule(() -> republish(queue, body, options, decision), decision.getDelay());
    }

    /**
     * Carry the original headers and identifiers over, replacing the retry count and
     * dropping broker-owned death records.
     */
    static PublishOptions republishOptions(MessageContext context, int retryCount) {
        Map<String, Object> headers = new HashMap<>(context.getHeaders());
        headers.remove("x-death");
        headers.remove(MessageContext.LEGACY_RETRY_COUNT_HEADER);
        headers.put(MessageContext.RETRY_COUNT_HEADER, retryCount);

        AMQP.BasicProperties original = context.getProperties();
        return PublishOptions.builder()
                .headers(headers)
                .contentType(original.getContentType())
                .messageId(original.getMessageId())
                .correlationId(original.getCorrelationId())
                .priority(original.getPriority())
                .build();
    }
}
