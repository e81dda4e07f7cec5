package com.intteq.payment.messaging.consumer;

import lombok.ToString;

import java.util.Objects;

/**
 * Outcome reported by a {@link MessageHandler}. The consumer engine acks on success and
 * enters the retry / dead-letter path on failure.
 */
@ToString
public final class HandlerResult {

    private static final HandlerResult SUCCESS = new HandlerResult(null);

    private final Throwable cause;

    private HandlerResult(Throwable cause) {
        this.cause = cause;
    }

    public static HandlerResult success() {
        return SUCCESS;
    }

    public static HandlerResult failure(Throwable cause) {
        return new HandlerResult(Objects.requireNonNull(cause, "cause must not be null"));
    }

    public static HandlerResult failure(String reason) {
        return failure(new MessageHandlingException(reason));
    }

    public boolean isSuccess() {
        return cause == null;
    }

    /** Failure cause, or {@code null} on success. */
    public Throwable getCause() {
        return cause;
    }

    /**
     * Failure reported by reason only.
     */
    public static class MessageHandlingException extends RuntimeException {
        public MessageHandlingException(String message) {
            super(message);
        }
    }
}
