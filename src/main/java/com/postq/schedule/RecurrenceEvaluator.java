package com.postq.schedule;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;

/**
 * Computes the next instant at which a {@link RecurrenceExpression} fires in a
 * given time zone.
 * <p>
 * Candidates are local wall-clock minutes. Each matching minute is resolved
 * against the zone rules on its own date: minutes skipped by a spring-forward
 * transition never fire. Minutes repeated by a fall-back transition fire only
 * at their earlier instant, unless the hour field is {@code *} or a step: those
 * expressions keep their cadence through the repeated hour, as cron does.
 */
@Component
public class RecurrenceEvaluator {

    static final long HORIZON_YEARS = 4;

    public Instant nextOccurrence(String expression, ZoneId zone, Instant after) {
        return nextOccurrence(RecurrenceExpression.parse(expression), zone, after);
    }

    /**
     * Returns the first instant strictly after {@code after} whose local
     * wall-clock time in {@code zone} matches every field of the expression.
     *
     * @throws UnsatisfiableScheduleException if nothing matches within four years
     */
    public Instant nextOccurrence(RecurrenceExpression expression, ZoneId zone, Instant after) {
        ZoneRules rules = zone.getRules();
        if (expression.isEveryHour()) {
            Instant inRepeatedHour = nextInsideOverlap(expression, rules, zone, after);
            if (inRepeatedHour != null) {
                return inRepeatedHour;
            }
        }

        Instant firstCandidate = after.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        LocalDateTime candidate = LocalDateTime.ofInstant(firstCandidate, zone);
        LocalDateTime horizon = candidate.plusYears(HORIZON_YEARS);

        while (!candidate.isAfter(horizon)) {
            if (!expression.matchesMonth(candidate.getMonthValue())) {
                candidate = candidate.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!expression.matchesDay(candidate.toLocalDate())) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!expression.matchesHour(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (expression.matchesMinute(candidate.getMinute())) {
                List<ZoneOffset> offsets = rules.getValidOffsets(candidate);
                if (!offsets.isEmpty()) {
                    Instant instant = candidate.toInstant(earliestInstantOffset(offsets));
                    if (instant.isAfter(after)) {
                        return instant;
                    }
                }
            }
            candidate = candidate.plusMinutes(1);
        }

        throw new UnsatisfiableScheduleException(expression.expression(), "Recurrence expression '"
                + expression.expression() + "' has no occurrence within " + HORIZON_YEARS + " years after " + after);
    }

    /**
     * When {@code after} lies in a fall-back overlap, returns the earliest
     * matching instant after it at either offset of the overlap, or
     * {@code null}.
     */
    private Instant nextInsideOverlap(RecurrenceExpression expression, ZoneRules rules, ZoneId zone,
            Instant after) {
        ZoneOffsetTransition transition = rules.getTransition(LocalDateTime.ofInstant(after, zone));
        if (transition == null || !transition.isOverlap()) {
            return null;
        }
        LocalDateTime candidate = transition.getDateTimeAfter();
        if (!expression.matchesMonth(candidate.getMonthValue()) || !expression.matchesDay(candidate.toLocalDate())) {
            return null;
        }

        Instant best = null;
        for (; candidate.isBefore(transition.getDateTimeBefore()); candidate = candidate.plusMinutes(1)) {
            if (!expression.matchesHour(candidate.getHour()) || !expression.matchesMinute(candidate.getMinute())) {
                continue;
            }
            for (ZoneOffset offset : List.of(transition.getOffsetBefore(), transition.getOffsetAfter())) {
                Instant instant = candidate.toInstant(offset);
                if (instant.isAfter(after) && (best == null || instant.isBefore(best))) {
                    best = instant;
                }
            }
        }
        return best;
    }

    private ZoneOffset earliestInstantOffset(List<ZoneOffset> offsets) {
        // The larger offset maps a local time to the earlier instant.
        ZoneOffset best = offsets.get(0);
        for (ZoneOffset offset : offsets) {
            if (offset.getTotalSeconds() > best.getTotalSeconds()) {
                best = offset;
            }
        }
        return best;
    }
}
