package com.intteq.payment.messaging.exception;

/**
 * Thrown when the broker refuses a declaration, typically because an exchange or queue
 * already exists with different arguments ({@code PRECONDITION_FAILED}).
 */
public class TopologyMismatchException extends MessagingSetupException {

    private final String declarable;

    public TopologyMismatchException(String declarable, Throwable cause) {
        super("Broker refused declaration of '" + declarable + "'. "
                + "Existing broker topology does not match the declared one.", cause);
        this.declarable = declarable;
    }

    public String getDeclarable() {
        return declarable;
    }
}
