package com.intteq.payment.messaging.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.payment.messaging.MessageContext;
import com.intteq.payment.messaging.MessagingProperties;
import com.intteq.payment.messaging.annotation.MessagingListener;
import com.intteq.payment.messaging.annotation.QueueHandler;
import com.intteq.payment.messaging.connection.BrokerConnectionManager;
import com.intteq.payment.messaging.connection.ConnectionListener;
import com.intteq.payment.messaging.consumer.ConsumeOptions;
import com.intteq.payment.messaging.consumer.HandlerResult;
import com.intteq.payment.messaging.consumer.MessageHandler;
import com.intteq.payment.messaging.consumer.RetryingConsumer;
import com.intteq.payment.messaging.consumer.Subscription;
import com.intteq.payment.messaging.exception.BrokerConnectionException;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Discovers {@link MessagingListener} beans and subscribes their {@link QueueHandler}
 * methods through the {@link RetryingConsumer}.
 *
 * <p><b>Responsibilities:</b></p>
 * <ul>
 *     <li>Validates handler signatures and fails startup on invalid ones</li>
 *     <li>Converts JSON payloads to the declared parameter type</li>
 *     <li>Maps return values and exceptions to {@link HandlerResult}</li>
 *     <li>Keeps handlers pending while the broker is unreachable and subscribes them on
 *     the first successful connection</li>
 *     <li>Cancels subscriptions on shutdown</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class QueueListenerProcessor implements SmartInitializingSingleton, DisposableBean, ConnectionListener {

    private final ApplicationContext context;
    private final RetryingConsumer consumer;
    private final BrokerConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final MessagingProperties properties;

    private final List<Registration> pending = new CopyOnWriteArrayList<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    // =====================================================================
    // INITIALIZATION
    // =====================================================================

    @Override
    public void afterSingletonsInstantiated() {
        log.info("Scanning for @MessagingListener beans...");

        context.getBeansWithAnnotation(MessagingListener.class)
                .values()
                .forEach(this::registerListenerBean);

        if (pending.isEmpty()) {
            return;
        }
        connectionManager.addListener(this);
        subscribePending();
    }

    @Override
    public void onConnected(Channel channel) {
        if (!pending.isEmpty()) {
            subscribePending();
        }
    }

    private void registerListenerBean(Object bean) {
        Class<?> clazz = ClassUtils.getUserClass(bean);
        MessagingListener listener = AnnotationUtils.findAnnotation(clazz, MessagingListener.class);
        if (listener == null) {
            return;
        }

        for (Method method : clazz.getDeclaredMethods()) {
            QueueHandler handler = AnnotationUtils.findAnnotation(method, QueueHandler.class);
            if (handler == null) {
                continue;
            }
            validateHandlerSignature(clazz, method);
            ReflectionUtils.makeAccessible(method);

            pending.add(new Registration(handler.queue(), adapt(bean, method), optionsFor(handler),
                    clazz.getSimpleName() + "#" + method.getName()));
            log.info("Registered queue handler {}#{} -> queue={} {}", clazz.getSimpleName(), method.getName(),
                    handler.queue(), listener.description());
        }
    }

    private synchronized void subscribePending() {
        for (Registration registration : pending) {
            try {
                subscriptions.add(consumer.subscribe(registration.getQueue(), registration.getHandler(), registration.getOptions()));
                pending.remove(registration);
            } catch (BrokerConnectionException e) {
                log.warn("RabbitMQ unavailable, {} will subscribe to {} once connected",
                        registration.getName(), registration.getQueue());
                return;
            }
        }
    }

    // =====================================================================
    // ADAPTATION
    // =====================================================================

    private ConsumeOptions optionsFor(QueueHandler handler) {
        MessagingProperties.Consumer defaults = properties.getConsumer();
        return ConsumeOptions.builder()
                .prefetch(handler.prefetch() > 0 ? handler.prefetch() : defaults.getPrefetch())
                .maxRetries(handler.maxRetries() > 0 ? handler.maxRetries() : defaults.getMaxRetries())
                .deadLetterMalformed(defaults.isDeadLetterMalformed())
                .build();
    }

    private MessageHandler adapt(Object bean, Method method) {
        Class<?> payloadType = method.getParameterTypes()[0];
        return (payload, ctx) -> {
            Object argument = payloadType.isAssignableFrom(JsonNode.class)
                    ? payload
                    : objectMapper.treeToValue(payload, payloadType);
            try {
                Object result = method.invoke(bean, argument, ctx);
                return result instanceof HandlerResult handlerResult ? handlerResult : HandlerResult.success();
            } catch (InvocationTargetException e) {
                return HandlerResult.failure(e.getTargetException());
            }
        };
    }

    private void validateHandlerSignature(Class<?> clazz, Method method) {
        Class<?>[] params = method.getParameterTypes();
        Class<?> returnType = method.getReturnType();
        boolean validParams = params.length == 2 && params[1] == MessageContext.class;
        boolean validReturn = returnType == void.class || returnType == HandlerResult.class;
        if (!validParams || !validReturn) {
            throw new IllegalStateException(
                    "Invalid @QueueHandler signature: "
                            + clazz.getName() + "#" + method.getName()
                            + " - expected (Payload, MessageContext) returning void or HandlerResult"
            );
        }
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    @Override
    public void destroy() {
        log.info("Stopping queue handler subscriptions...");
        connectionManager.removeListener(this);
        subscriptions.forEach(Subscription::cancel);
        subscriptions.clear();
        pending.clear();
    }

    public List<Subscription> getSubscriptions() {
        return List.copyOf(subscriptions);
    }

    public int getPendingCount() {
        return pending.size();
    }

    @Value
    private static class Registration {
        String queue;
        MessageHandler handler;
        ConsumeOptions options;
        String name;
    }
}
