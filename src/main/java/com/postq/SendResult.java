package com.postq;

import java.time.Duration;
import java.util.List;

/**
 * Result of a single send attempt to one target.
 */
public record SendResult(Outcome outcome, List<String> transportMessageIds, String error, Duration retryAfter) {

    public enum Outcome {
        SENT,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    public SendResult {
        transportMessageIds = transportMessageIds == null ? List.of() : List.copyOf(transportMessageIds);
    }

    public static SendResult sent(List<String> transportMessageIds) {
        return new SendResult(Outcome.SENT, transportMessageIds, null, null);
    }

    public static SendResult transientFailure(String error) {
        return new SendResult(Outcome.TRANSIENT_FAILURE, List.of(), error, null);
    }

    public static SendResult transientFailure(String error, Duration retryAfter) {
        return new SendResult(Outcome.TRANSIENT_FAILURE, List.of(), error, retryAfter);
    }

    public static SendResult permanentFailure(String error) {
        return new SendResult(Outcome.PERMANENT_FAILURE, List.of(), error, null);
    }
}
