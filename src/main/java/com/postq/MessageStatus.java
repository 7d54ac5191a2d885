package com.postq;

/**
 * Lifecycle status of a {@link ScheduledMessage}.
 */
public enum MessageStatus {
    /** Enabled and waiting for its next run. */
    SCHEDULED,
    /** Claimed by a node and currently dispatching. */
    RUNNING,
    /** Recurring tick outcome: at least one target received the message. */
    SENT,
    /** Once job finished with at least one successful delivery. */
    DONE,
    /** Every attempted target failed, or the schedule could not be evaluated. */
    ERROR,
    /** The target set resolved to nothing, no sends were attempted. */
    NO_TARGETS,
    /** Recurring job has no further occurrence before its end. */
    ENDED
}
