package com.postq.schedule;

/**
 * The expression has no occurrence within the search horizon, e.g. the 31st of
 * February.
 */
public class UnsatisfiableScheduleException extends RuntimeException {

    private final String expression;

    public UnsatisfiableScheduleException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
