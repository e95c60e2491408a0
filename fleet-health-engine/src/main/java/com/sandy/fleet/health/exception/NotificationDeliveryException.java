package com.sandy.fleet.health.exception;

import lombok.Getter;

/**
 * A notification channel could not deliver. Non-retryable failures end the task immediately.
 */
@Getter
public class NotificationDeliveryException extends Exception {
    private final Integer statusCode;
    private final boolean retryable;

    public NotificationDeliveryException(String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public NotificationDeliveryException(String message, boolean retryable) {
        this(message, null, retryable, null);
    }
}
