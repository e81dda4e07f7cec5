package com.intteq.payment.messaging.exception;

/**
 * Thrown when messaging infrastructure cannot be set up: a topology declaration is
 * refused by the broker, a binding is invalid, or a consumer cannot be registered.
 *
 * <p>Setup errors are fatal to the setup path. They are propagated to the caller of
 * {@code connect()} / {@code subscribe()} so the application can abort startup.
 */
public class MessagingSetupException extends RuntimeException {

    public MessagingSetupException(String message) {
        super(message);
    }

    public MessagingSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
