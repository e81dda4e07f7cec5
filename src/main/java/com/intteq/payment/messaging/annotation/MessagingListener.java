package com.intteq.payment.messaging.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean whose {@link QueueHandler} methods consume payment queues.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @Component
 * @MessagingListener(description = "Fraud scoring")
 * public class FraudListener {
 *
 *     @QueueHandler(queue = PaymentQueues.FRAUD_DETECTION, maxRetries = 5)
 *     public void onPayment(PaymentCheck payload, MessageContext ctx) {
 *         // business logic...
 *     }
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessagingListener {

    /**
     * Optional human-readable description, logged when the listener is registered.
     */
    String description() default "";
}
