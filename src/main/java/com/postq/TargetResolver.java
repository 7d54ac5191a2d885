package com.postq;

import java.util.Set;

/**
 * Turns the targeting settings of a message into concrete destinations.
 */
public interface TargetResolver {

    /**
     * Returns the destinations for the message in delivery order, without
     * duplicates. An empty set means there is nobody to deliver to.
     */
    Set<String> resolve(ScheduledMessage message);
}
