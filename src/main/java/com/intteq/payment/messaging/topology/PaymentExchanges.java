package com.intteq.payment.messaging.topology;

/**
 * Exchange names shared by every payment service.
 */
public final class PaymentExchanges {

    /** Topic exchange; routing keys follow {@code payment.<event>}. */
    public static final String PAYMENT = "payment.exchange";

    /** Fan-out exchange; broadcasts to every bound queue. */
    public static final String NOTIFICATION = "notification.exchange";

    private PaymentExchanges() {
    }
}
