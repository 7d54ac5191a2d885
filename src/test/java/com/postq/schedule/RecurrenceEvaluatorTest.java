package com.postq.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceEvaluatorTest {

    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");
    private static final ZoneId UTC = ZoneId.of("UTC");

    private final RecurrenceEvaluator evaluator = new RecurrenceEvaluator();

    @Test
    void shouldReturnNextMatchingMinuteStrictlyAfterInput() {
        Instant after = Instant.parse("2026-10-19T10:15:00Z");

        Instant next = evaluator.nextOccurrence("*/15 * * * *", UTC, after);

        assertThat(next).isEqualTo(Instant.parse("2026-10-19T10:30:00Z"));
    }

    @Test
    void shouldSkipSecondsWithinTheCurrentMinute() {
        Instant after = Instant.parse("2026-10-19T10:14:59.500Z");

        Instant next = evaluator.nextOccurrence("*/15 * * * *", UTC, after);

        assertThat(next).isEqualTo(Instant.parse("2026-10-19T10:15:00Z"));
    }

    @Test
    void shouldEvaluateInTheGivenZone() {
        Instant after = Instant.parse("2026-10-19T20:00:00Z");

        Instant next = evaluator.nextOccurrence("0 9 * * *", LOS_ANGELES, after);

        // 09:00 PDT is 16:00 UTC on the following day
        assertThat(next).isEqualTo(Instant.parse("2026-10-20T16:00:00Z"));
    }

    @Test
    void shouldFireOnceAtLocalNineAcrossSpringForward() {
        Instant afterSaturdayRun = ZonedDateTime.of(LocalDateTime.of(2026, 3, 7, 9, 0), LOS_ANGELES).toInstant();

        Instant sunday = evaluator.nextOccurrence("0 9 * * *", LOS_ANGELES, afterSaturdayRun);
        Instant monday = evaluator.nextOccurrence("0 9 * * *", LOS_ANGELES, sunday);

        assertThat(sunday.atZone(LOS_ANGELES).toLocalDateTime()).isEqualTo(LocalDateTime.of(2026, 3, 8, 9, 0));
        assertThat(sunday).isEqualTo(Instant.parse("2026-03-08T16:00:00Z"));
        assertThat(monday.atZone(LOS_ANGELES).toLocalDateTime()).isEqualTo(LocalDateTime.of(2026, 3, 9, 9, 0));
    }

    @Test
    void shouldSkipLocalTimesInsideTheSpringForwardGap() {
        Instant after = ZonedDateTime.of(LocalDateTime.of(2026, 3, 7, 12, 0), LOS_ANGELES).toInstant();

        Instant next = evaluator.nextOccurrence("30 2 * * *", LOS_ANGELES, after);

        // 2026-03-08 02:30 does not exist in Los Angeles
        assertThat(next.atZone(LOS_ANGELES).toLocalDateTime()).isEqualTo(LocalDateTime.of(2026, 3, 9, 2, 30));
    }

    @Test
    void shouldFireRepeatedLocalTimeOnceAtTheEarlierInstantOnFallBack() {
        Instant after = Instant.parse("2026-10-31T20:00:00Z");

        Instant first = evaluator.nextOccurrence("30 1 * * *", LOS_ANGELES, after);
        Instant second = evaluator.nextOccurrence("30 1 * * *", LOS_ANGELES, first);

        // 01:30 PDT (UTC-7), not 01:30 PST (UTC-8)
        assertThat(first).isEqualTo(Instant.parse("2026-11-01T08:30:00Z"));
        assertThat(second.atZone(LOS_ANGELES).toLocalDateTime()).isEqualTo(LocalDateTime.of(2026, 11, 2, 1, 30));
    }

    @Test
    void shouldNotRefireDuringTheRepeatedHour() {
        // 01:10 PST, inside the repeated hour, after 01:30 PDT already fired
        Instant after = Instant.parse("2026-11-01T09:10:00Z");

        Instant next = evaluator.nextOccurrence("30 1 * * *", LOS_ANGELES, after);

        assertThat(next.atZone(LOS_ANGELES).toLocalDateTime()).isEqualTo(LocalDateTime.of(2026, 11, 2, 1, 30));
    }

    @Test
    void shouldKeepAQuarterHourCadenceThroughTheRepeatedHour() {
        Instant current = Instant.parse("2026-11-01T07:50:00Z");
        List<Instant> occurrences = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            current = evaluator.nextOccurrence("*/15 * * * *", LOS_ANGELES, current);
            occurrences.add(current);
        }

        assertThat(occurrences.get(0)).isEqualTo(Instant.parse("2026-11-01T08:00:00Z"));
        for (int i = 1; i < occurrences.size(); i++) {
            assertThat(Duration.between(occurrences.get(i - 1), occurrences.get(i))).isEqualTo(Duration.ofMinutes(15));
        }
        // 01:00 PST, the second pass of 01:00
        assertThat(occurrences).contains(Instant.parse("2026-11-01T09:00:00Z"));
        assertThat(occurrences.get(8)).isEqualTo(Instant.parse("2026-11-01T10:00:00Z"));
    }

    @Test
    void shouldFireInTheSecondPassAfterTheLastEarlierOccurrence() {
        Instant next = evaluator.nextOccurrence("*/15 * * * *", LOS_ANGELES, Instant.parse("2026-11-01T08:45:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2026-11-01T09:00:00Z"));
    }

    @Test
    void shouldFireHourlyExpressionInBothPassesOfTheRepeatedHour() {
        Instant first = evaluator.nextOccurrence("0 * * * *", LOS_ANGELES, Instant.parse("2026-11-01T07:30:00Z"));
        Instant second = evaluator.nextOccurrence("0 * * * *", LOS_ANGELES, first);
        Instant third = evaluator.nextOccurrence("0 * * * *", LOS_ANGELES, second);

        assertThat(first).isEqualTo(Instant.parse("2026-11-01T08:00:00Z"));
        assertThat(second).isEqualTo(Instant.parse("2026-11-01T09:00:00Z"));
        assertThat(third).isEqualTo(Instant.parse("2026-11-01T10:00:00Z"));
        assertThat(third.atZone(LOS_ANGELES).toLocalDateTime()).isEqualTo(LocalDateTime.of(2026, 11, 1, 2, 0));
    }

    @Test
    void shouldPreferTheEarlierInstantInsideTheRepeatedHour() {
        // 01:50 PDT: 01:55 PDT comes before 01:00 PST
        Instant next = evaluator.nextOccurrence("0,55 * * * *", LOS_ANGELES, Instant.parse("2026-11-01T08:50:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2026-11-01T08:55:00Z"));
    }

    @Test
    void shouldProduceStrictlyIncreasingOccurrences() {
        Instant current = Instant.parse("2026-10-19T00:00:00Z");
        for (int i = 0; i < 200; i++) {
            Instant next = evaluator.nextOccurrence("*/7 */5 * * *", LOS_ANGELES, current);
            assertThat(next).isAfter(current);
            current = next;
        }
    }

    @Test
    void shouldFindLeapDay() {
        Instant after = Instant.parse("2026-10-19T00:00:00Z");

        Instant next = evaluator.nextOccurrence("0 0 29 2 *", UTC, after);

        assertThat(next).isEqualTo(Instant.parse("2028-02-29T00:00:00Z"));
    }

    @Test
    void shouldThrowWhenNothingMatchesWithinHorizon() {
        Instant after = Instant.parse("2026-10-19T00:00:00Z");

        assertThatThrownBy(() -> evaluator.nextOccurrence("0 0 31 2 *", UTC, after))
                .isInstanceOf(UnsatisfiableScheduleException.class)
                .satisfies(e -> assertThat(((UnsatisfiableScheduleException) e).getExpression())
                        .isEqualTo("0 0 31 2 *"));
    }
}
