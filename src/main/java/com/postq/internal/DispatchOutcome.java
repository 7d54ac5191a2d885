package com.postq.internal;

import com.postq.DeliveryStatus;
import com.postq.MessageStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Aggregated result of sending one execution of a message to its targets.
 *
 * @param status            {@link MessageStatus#SENT}, {@link MessageStatus#ERROR} or
 *                          {@link MessageStatus#NO_TARGETS}
 * @param deliveries        recorded status per target, including records found from an earlier attempt
 * @param incompleteTargets targets that were abandoned or whose outcome could not be recorded
 * @param replayedTargets   targets skipped because the execution already had a record for them
 */
public record DispatchOutcome(
        MessageStatus status,
        Map<String, DeliveryStatus> deliveries,
        Set<String> incompleteTargets,
        Set<String> replayedTargets) {

    public DispatchOutcome {
        deliveries = Collections.unmodifiableMap(new LinkedHashMap<>(deliveries));
        incompleteTargets = Collections.unmodifiableSet(new LinkedHashSet<>(incompleteTargets));
        replayedTargets = Collections.unmodifiableSet(new LinkedHashSet<>(replayedTargets));
    }

    static DispatchOutcome noTargets() {
        return new DispatchOutcome(MessageStatus.NO_TARGETS, Map.of(), Set.of(), Set.of());
    }

    static DispatchOutcome aggregate(Map<String, DeliveryStatus> deliveries, Set<String> incompleteTargets,
            Set<String> replayedTargets) {
        boolean anySent = deliveries.values().stream().anyMatch(DeliveryStatus::isSuccess);
        MessageStatus status = anySent ? MessageStatus.SENT : MessageStatus.ERROR;
        return new DispatchOutcome(status, deliveries, incompleteTargets, replayedTargets);
    }

    /**
     * Whether every target has a recorded outcome. Only complete executions are
     * reconciled; incomplete ones are replayed later under the same execution id.
     */
    public boolean isComplete() {
        return incompleteTargets.isEmpty();
    }

    public long sentCount() {
        return deliveries.values().stream().filter(DeliveryStatus::isSuccess).count();
    }

    public long failedCount() {
        return deliveries.values().stream().filter(status -> !status.isSuccess()).count();
    }
}
