package com.postq.internal;

import com.postq.MessageStatus;

import java.util.UUID;

/**
 * What happened to one attempt at executing a message.
 *
 * @param messageId   the message
 * @param executionId execution id used for delivery dedup, {@code null} if no claim was obtained
 * @param disposition how the attempt ended
 * @param status      lifecycle status persisted for the message, {@code null} unless completed
 * @param outcome     per-target results, {@code null} if nothing was dispatched
 * @param error       description of the failure, if any
 */
public record ExecutionReport(
        UUID messageId,
        String executionId,
        Disposition disposition,
        MessageStatus status,
        DispatchOutcome outcome,
        String error) {

    public enum Disposition {
        /** Every target has a recorded outcome and the new state was stored. */
        COMPLETED,
        /** Some targets were abandoned or unrecorded; the claim was released for a replay. */
        INCOMPLETE,
        /** Another worker held the lease, or the message was no longer due. */
        SKIPPED,
        /** The lease was taken over before the result could be stored. */
        LEASE_LOST,
        /** The message store failed; the lease is left to expire. */
        STORE_FAILURE,
        NOT_FOUND,
        FAILED
    }

    static ExecutionReport skipped(UUID messageId) {
        return new ExecutionReport(messageId, null, Disposition.SKIPPED, null, null, null);
    }

    static ExecutionReport notFound(UUID messageId) {
        return new ExecutionReport(messageId, null, Disposition.NOT_FOUND, null, null, null);
    }

    static ExecutionReport storeFailure(UUID messageId, String executionId, String error) {
        return new ExecutionReport(messageId, executionId, Disposition.STORE_FAILURE, null, null, error);
    }

    public boolean isCompleted() {
        return disposition == Disposition.COMPLETED;
    }
}
