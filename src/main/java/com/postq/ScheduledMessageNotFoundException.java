package com.postq;

import java.util.UUID;

public class ScheduledMessageNotFoundException extends RuntimeException {

    private final UUID messageId;

    public ScheduledMessageNotFoundException(UUID messageId) {
        super("Scheduled message " + messageId + " does not exist");
        this.messageId = messageId;
    }

    public UUID getMessageId() {
        return messageId;
    }
}
