package com.postq;

/**
 * Thrown by a {@link MessageTransport} when retrying can not help: the target is
 * unknown or blocked us, or the content was rejected.
 */
public class PermanentDeliveryException extends RuntimeException {

    public PermanentDeliveryException(String message) {
        super(message);
    }

    public PermanentDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
