package com.postq;

/**
 * Recorded outcome for one target of one execution. All values are terminal.
 */
public enum DeliveryStatus {
    SENT,
    FAILED_TRANSIENT,
    FAILED_PERMANENT;

    public boolean isSuccess() {
        return this == SENT;
    }
}
