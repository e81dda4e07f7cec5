package com.intteq.payment.messaging.connection;

/**
 * Lifecycle states of the broker connection.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> (ERROR | connection lost) -> RECONNECTING -> CONNECTING ...
 *                                          -> CLOSED (application shutdown, terminal)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    ERROR,
    CLOSED
}
