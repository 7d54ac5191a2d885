package com.postq.internal;

import com.postq.MessageStatus;
import com.postq.MessageValidationException;
import com.postq.ScheduledMessage;
import com.postq.config.PostQProperties;
import com.postq.schedule.RecurrenceEvaluator;
import com.postq.schedule.RecurrenceExpression;
import com.postq.schedule.UnsatisfiableScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Decides the state a message moves to once an execution has a recorded
 * outcome for every target.
 */
@Component
public class LifecycleReconciler {

    private static final Logger log = LoggerFactory.getLogger(LifecycleReconciler.class);

    private final RecurrenceEvaluator evaluator;
    private final PostQProperties properties;

    public LifecycleReconciler(RecurrenceEvaluator evaluator, PostQProperties properties) {
        this.evaluator = evaluator;
        this.properties = properties;
    }

    /**
     * @param slot the {@code nextRunAt} the execution was due at, or {@code now} for a manual run
     */
    public Reconciliation reconcile(ScheduledMessage message, DispatchOutcome outcome, OffsetDateTime slot,
            OffsetDateTime now) {
        MessageStatus tickOutcome = outcome.status();
        String deliveryError = tickOutcome == MessageStatus.ERROR
                ? "Delivery failed for all " + outcome.deliveries().size() + " targets"
                : null;

        if (!message.isRecurring()) {
            MessageStatus status = tickOutcome == MessageStatus.SENT ? MessageStatus.DONE : tickOutcome;
            return new Reconciliation(status, tickOutcome, true, null, slot, deliveryError);
        }

        RecurrenceExpression expression;
        ZoneId zone;
        try {
            expression = RecurrenceExpression.parse(message.getCron());
            zone = ZoneId.of(zoneOf(message));
        } catch (MessageValidationException | DateTimeException e) {
            log.error("Recurring message {} has an invalid schedule '{}' in '{}', disabling it", message.getId(),
                    message.getCron(), message.getTimeZone(), e);
            return new Reconciliation(MessageStatus.ERROR, tickOutcome, true, null, slot,
                    "Invalid schedule: " + e.getMessage());
        }

        Instant base = slot.isAfter(now) ? slot.toInstant() : now.toInstant();
        Instant next;
        try {
            next = evaluator.nextOccurrence(expression, zone, base);
        } catch (UnsatisfiableScheduleException e) {
            log.info("Recurring message {} has no further occurrence of '{}', ending it", message.getId(),
                    message.getCron());
            return new Reconciliation(MessageStatus.ENDED, tickOutcome, true, null, slot, deliveryError);
        }

        if (message.getEndAt() != null && next.isAfter(message.getEndAt().toInstant())) {
            log.info("Recurring message {} reached its end at {}, ending it", message.getId(), message.getEndAt());
            return new Reconciliation(MessageStatus.ENDED, tickOutcome, true, null, slot, deliveryError);
        }

        return new Reconciliation(MessageStatus.SCHEDULED, tickOutcome, false,
                OffsetDateTime.ofInstant(next, ZoneOffset.UTC), slot, deliveryError);
    }

    private String zoneOf(ScheduledMessage message) {
        String zone = message.getTimeZone();
        return zone == null || zone.isBlank() ? properties.getDefaults().getTimeZone() : zone;
    }
}
