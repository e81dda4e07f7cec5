package com.intteq.payment.messaging.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.payment.messaging.MessagingMetrics;
import com.intteq.payment.messaging.connection.BrokerConnectionManager;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.MessageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link MessagePublisher} on the shared channel of a {@link BrokerConnectionManager}.
 *
 * <p>The channel is looked up on every publish, which also connects lazily. If it turns out
 * to have been closed underneath us, the publish is retried once on the channel the
 * manager establishes next. Publishes are serialized because interleaved frames on one
 * channel corrupt each other.
 */
@Slf4j
@RequiredArgsConstructor
public class RabbitMessagePublisher implements MessagePublisher {

    public static final String CONTENT_TYPE_JSON = "application/json";

    private static final String DEFAULT_EXCHANGE = "";

    private final BrokerConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final MessagingMetrics metrics;
    private final Clock clock;

    private final Object publishLock = new Object();

    @Override
    public boolean publishToQueue(String queue, Object payload, PublishOptions options) {
        return publishPayload(DEFAULT_EXCHANGE, queue, payload, options, "queue " + queue);
    }

    @Override
    public boolean publishToExchange(String exchange, String routingKey, Object payload, PublishOptions options) {
        return publishPayload(exchange, routingKey, payload, options,
                "exchange " + exchange + " with routing key '" + routingKey + "'");
    }

    @Override
    public boolean publishRawToQueue(String queue, byte[] body, PublishOptions options) {
        return send(DEFAULT_EXCHANGE, queue, body, options, "queue " + queue);
    }

    // ========================================================================
    //   Internals
    // ========================================================================

    private boolean publishPayload(String exchange, String routingKey, Object payload,
                                   PublishOptions options, String target) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            metrics.published(MessagingMetrics.FAILURE);
            log.error("Error serializing message for {}: {}",
                    target, payload == null ? "null" : payload.getClass().getName(), e);
            return false;
        }
        return send(exchange, routingKey, body, options, target);
    }

    private boolean send(String exchange, String routingKey, byte[] body, PublishOptions options, String target) {
        try {
            Channel channel = connectionManager.connect();

            if (connectionManager.isBlocked()) {
                metrics.published(MessagingMetrics.BLOCKED);
                log.warn("Message not sent to {}, channel buffer full (broker flow control)", target);
                return false;
            }

            AMQP.BasicProperties properties = buildProperties(options);
            try {
                basicPublish(channel, exchange, routingKey, properties, body);
            } catch (AlreadyClosedException e) {
                log.warn("Channel closed while publishing to {}, retrying on a fresh channel", target);
                basicPublish(connectionManager.connect(), exchange, routingKey, properties, body);
            }

            metrics.published(MessagingMetrics.SUCCESS);
            log.debug("Message published to {}", target);
            return true;

        } catch (Exception e) {
            metrics.published(MessagingMetrics.FAILURE);
            log.error("Error publishing to {}", target, e);
            return false;
        }
    }

    private void basicPublish(Channel channel, String exchange, String routingKey,
                              AMQP.BasicProperties properties, byte[] body) throws IOException {
        synchronized (publishLock) {
            channel.basicPublish(exchange, routingKey, properties, body);
        }
    }

    AMQP.BasicProperties buildProperties(PublishOptions options) {
        PublishOptions opts = options != null ? options : PublishOptions.none();

        Map<String, Object> headers = opts.getHeaders().isEmpty() ? null : new HashMap<>(opts.getHeaders());

        return MessageProperties.PERSISTENT_BASIC.builder()
                .contentType(opts.getContentType() != null ? opts.getContentType() : CONTENT_TYPE_JSON)
                .timestamp(Date.from(clock.instant()))
                .headers(headers)
                .messageId(opts.getMessageId())
                .correlationId(opts.getCorrelationId())
                .expiration(opts.getExpiration())
                .priority(opts.getPriority())
                .build();
    }
}
