package com.postq.internal;

/**
 * Conditions a claim has to satisfy besides the absence of a live lease.
 */
public enum ClaimMode {
    /** The message must still be enabled and due. */
    SCHEDULED,
    /** Run-now: the due check is bypassed. */
    MANUAL
}
