package com.postq.schedule;

import com.postq.MessageValidationException;

public class InvalidRecurrenceException extends MessageValidationException {

    public InvalidRecurrenceException(String message) {
        super(message);
    }
}
