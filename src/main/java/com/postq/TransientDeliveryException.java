package com.postq;

import java.time.Duration;

/**
 * Thrown by a {@link MessageTransport} when a send may succeed if tried again,
 * for example when the platform rate-limits the sender.
 */
public class TransientDeliveryException extends RuntimeException {

    private final Duration retryAfter;

    public TransientDeliveryException(String message) {
        this(message, null, null);
    }

    public TransientDeliveryException(String message, Duration retryAfter) {
        this(message, retryAfter, null);
    }

    public TransientDeliveryException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Minimum wait requested by the platform, or {@code null} when it did not say.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
