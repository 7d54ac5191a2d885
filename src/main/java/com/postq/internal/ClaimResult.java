package com.postq.internal;

public enum ClaimResult {
    CLAIMED,
    ALREADY_CLAIMED
}
