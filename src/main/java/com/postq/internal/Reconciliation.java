package com.postq.internal;

import com.postq.MessageStatus;

import java.time.OffsetDateTime;

/**
 * State a message moves to after one execution.
 *
 * @param status      new lifecycle status
 * @param lastOutcome outcome of the execution that just finished
 * @param disable     whether the message must be disabled
 * @param nextRunAt   next due instant, {@code null} when the message will not run again
 * @param lastRunAt   the slot the execution was due at
 * @param lastError   description of a scheduling problem, if any
 */
public record Reconciliation(
        MessageStatus status,
        MessageStatus lastOutcome,
        boolean disable,
        OffsetDateTime nextRunAt,
        OffsetDateTime lastRunAt,
        String lastError) {
}
