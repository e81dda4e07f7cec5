package com.intteq.payment.messaging.connection;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports UP while the shared connection and channel are open.
 */
@RequiredArgsConstructor
public class BrokerHealthIndicator implements HealthIndicator {

    private final BrokerConnectionManager connectionManager;

    @Override
    public Health health() {
        Health.Builder builder = connectionManager.isConnected() ? Health.up() : Health.down();
        return builder
                .withDetail("state", connectionManager.getState().name())
                .withDetail("blocked", connectionManager.isBlocked())
                .build();
    }
}
