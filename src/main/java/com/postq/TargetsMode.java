package com.postq;

public enum TargetsMode {
    /** Every target currently marked active. */
    ALL,
    /** Only the identifiers configured on the message. */
    EXPLICIT
}
