package com.postq;

/**
 * Thrown when a scheduled message is rejected before it is stored.
 */
public class MessageValidationException extends IllegalArgumentException {

    public MessageValidationException(String message) {
        super(message);
    }

    public MessageValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
