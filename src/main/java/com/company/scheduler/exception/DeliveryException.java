package com.company.scheduler.exception;

/**
 * Delivery service rejected or could not accept a message.
 * Recoverable: the job stays pending and is retried on a later pass.
 */
public class DeliveryException extends RuntimeException {
    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
