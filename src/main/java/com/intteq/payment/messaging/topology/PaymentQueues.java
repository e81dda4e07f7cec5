package com.intteq.payment.messaging.topology;

import java.util.List;

/**
 * Queue names shared by every payment service.
 */
public final class PaymentQueues {

    public static final String PAYMENT_PROCESSING = "payment.processing";
    public static final String PAYMENT_RETRY = "payment.retry";
    public static final String PAYMENT_DLQ = "payment.dlq";
    public static final String SETTLEMENT_CALCULATION = "settlement.calculation";
    public static final String FRAUD_DETECTION = "fraud.detection";
    public static final String WEBHOOK_DELIVERY = "webhook.delivery";
    public static final String SUBSCRIPTION_BILLING = "subscription.billing";
    public static final String CURRENCY_UPDATE = "currency.update";
    public static final String CHARGEBACK_NOTIFICATION = "chargeback.notification";

    /** Every queue except the DLQ; all of them dead-letter into {@link #PAYMENT_DLQ}. */
    public static final List<String> WORK_QUEUES = List.of(
            PAYMENT_PROCESSING,
            PAYMENT_RETRY,
            SETTLEMENT_CALCULATION,
            FRAUD_DETECTION,
            WEBHOOK_DELIVERY,
            SUBSCRIPTION_BILLING,
            CURRENCY_UPDATE,
            CHARGEBACK_NOTIFICATION
    );

    private PaymentQueues() {
    }
}
