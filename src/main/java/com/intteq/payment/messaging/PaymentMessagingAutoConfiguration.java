package com.intteq.payment.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.payment.messaging.admin.QueueAdministrator;
import com.intteq.payment.messaging.connection.BrokerConnectionManager;
import com.intteq.payment.messaging.connection.BrokerHealthIndicator;
import com.intteq.payment.messaging.consumer.RetryingConsumer;
import com.intteq.payment.messaging.deadletter.DeadLetterQueue;
import com.intteq.payment.messaging.exception.BrokerConnectionException;
import com.intteq.payment.messaging.internal.QueueListenerProcessor;
import com.intteq.payment.messaging.publisher.MessagePublisher;
import com.intteq.payment.messaging.publisher.RabbitMessagePublisher;
import com.intteq.payment.messaging.retry.DelayScheduler;
import com.intteq.payment.messaging.retry.ExecutorDelayScheduler;
import com.intteq.payment.messaging.retry.RetryPolicy;
import com.intteq.payment.messaging.retry.TwoTierRetryStrategy;
import com.intteq.payment.messaging.topology.TopologyDescriptor;
import com.rabbitmq.client.ConnectionFactory;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.RabbitConnectionFactoryBean;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import java.time.Clock;

/**
 * Auto-configuration for payment messaging.
 *
 * <p>Enabled by default; disable with:
 *
 * <pre>
 *   messaging.enabled = false
 * </pre>
 *
 * <p>Every bean backs off when the application defines its own. The application's
 * {@link ObjectMapper}, {@link MeterRegistry} and {@link Clock} are used when present.
 *
 * <p>Shutdown (SIGINT / SIGTERM through the Spring shutdown hook) destroys subscriptions
 * first, then closes channel and connection, then stops the scheduler.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(MessagingProperties.class)
@ConditionalOnProperty(prefix = "messaging", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PaymentMessagingAutoConfiguration {

    /**
     * RabbitMQ client factory built from {@code messaging.uri}. Client-side automatic
     * recovery is off; {@link BrokerConnectionManager} drives reconnects itself.
     */
    @Bean
    @ConditionalOnMissingBean
    public ConnectionFactory paymentMessagingConnectionFactory(MessagingProperties props) throws Exception {
        RabbitConnectionFactoryBean factoryBean = new RabbitConnectionFactoryBean();
        factoryBean.setUri(props.getUri());
        factoryBean.setConnectionTimeout((int) props.getConnectionTimeout().toMillis());
        factoryBean.setRequestedHeartbeat((int) props.getHeartbeat().getSeconds());
        factoryBean.setAutomaticRecoveryEnabled(false);
        factoryBean.setTopologyRecoveryEnabled(false);
        factoryBean.afterPropertiesSet();

        ConnectionFactory factory = factoryBean.getObject();
        log.info("RabbitMQ ConnectionFactory initialized: host={} port={} vhost={}",
                factory.getHost(), factory.getPort(), factory.getVirtualHost());
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagingMetrics messagingMetrics(@Nullable MeterRegistry meterRegistry) {
        // Metrics are a no-op when Micrometer is not configured by the application.
        return new MessagingMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DelayScheduler messagingDelayScheduler() {
        return new ExecutorDelayScheduler("messaging-scheduler");
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyDescriptor topologyDescriptor(MessagingProperties props) {
        return TopologyDescriptor.paymentTopology(props.getTopology().getDeadLetterTtl());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public BrokerConnectionManager brokerConnectionManager(ConnectionFactory connectionFactory,
                                                           TopologyDescriptor topology,
                                                           DelayScheduler scheduler,
                                                           MessagingProperties props) {
        return new BrokerConnectionManager(connectionFactory, topology, scheduler,
                props.getReconnectDelay(), props.getMaxReconnectAttempts(), props.getConnectionName());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePublisher messagePublisher(BrokerConnectionManager connectionManager,
                                             @Nullable ObjectMapper objectMapper,
                                             @Nullable Clock clock,
                                             MessagingMetrics metrics) {
        return new RabbitMessagePublisher(connectionManager, mapperOrDefault(objectMapper),
                metrics, clock != null ? clock : Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(MessagingProperties props) {
        return new RetryPolicy(props.getRetry().getInitialDelay(), props.getRetry().getMaxDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public TwoTierRetryStrategy twoTierRetryStrategy(RetryPolicy retryPolicy,
                                                     DelayScheduler scheduler,
                                                     MessagePublisher publisher,
                                                     MessagingMetrics metrics) {
        return new TwoTierRetryStrategy(retryPolicy, scheduler, publisher, metrics);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RetryingConsumer retryingConsumer(BrokerConnectionManager connectionManager,
                                             @Nullable ObjectMapper objectMapper,
                                             TwoTierRetryStrategy retryStrategy,
                                             MessagingMetrics metrics) {
        return new RetryingConsumer(connectionManager, mapperOrDefault(objectMapper), retryStrategy, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueAdministrator queueAdministrator(BrokerConnectionManager connectionManager) {
        return new QueueAdministrator(connectionManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterQueue deadLetterQueue(TopologyDescriptor topology, QueueAdministrator administrator) {
        return DeadLetterQueue.of(topology, administrator);
    }

    @Bean
    public QueueListenerProcessor queueListenerProcessor(ApplicationContext context,
                                                         RetryingConsumer consumer,
                                                         BrokerConnectionManager connectionManager,
                                                         @Nullable ObjectMapper objectMapper,
                                                         MessagingProperties props) {
        return new QueueListenerProcessor(context, consumer, connectionManager, mapperOrDefault(objectMapper), props);
    }

    /**
     * Connects and declares the topology during startup. An unreachable broker only
     * delays this to the background reconnect loop; a refused topology aborts startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "messaging", name = "connect-on-startup", havingValue = "true", matchIfMissing = true)
    public SmartInitializingSingleton messagingStartupConnector(BrokerConnectionManager connectionManager) {
        return () -> {
            try {
                connectionManager.connect();
            } catch (BrokerConnectionException e) {
                log.warn("RabbitMQ unavailable at startup, connecting in the background");
            }
        };
    }

    private static ObjectMapper mapperOrDefault(@Nullable ObjectMapper objectMapper) {
        return objectMapper != null ? objectMapper : new ObjectMapper();
    }

    // ========================================================================
    // Actuator
    // ========================================================================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "paymentMessagingHealthIndicator")
        public BrokerHealthIndicator paymentMessagingHealthIndicator(BrokerConnectionManager connectionManager) {
            return new BrokerHealthIndicator(connectionManager);
        }
    }
}
