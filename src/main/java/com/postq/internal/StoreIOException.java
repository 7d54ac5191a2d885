package com.postq.internal;

/**
 * The message store could not be read or written. The operation may succeed on
 * a later tick.
 */
public class StoreIOException extends RuntimeException {

    public StoreIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
