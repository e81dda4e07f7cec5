package com.intteq.payment.messaging.exception;

/**
 * Transport-level failure: the broker is unreachable or the connection dropped.
 *
 * <p>Never fatal to the process. The connection manager has already scheduled a
 * reconnect by the time this is thrown.
 */
public class BrokerConnectionException extends RuntimeException {

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
