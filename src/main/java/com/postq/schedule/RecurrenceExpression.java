package com.postq.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.BitSet;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed five-field recurrence expression:
 * {@code minute hour day-of-month month day-of-week}.
 * <p>
 * Each field is {@code *}, a literal, a step {@code *}{@code /N} counted from the
 * field minimum, or a comma separated list of literals. Day-of-week runs from
 * 0 (Sunday) to 6 (Saturday); 7 is accepted as Sunday. When both day fields
 * are restricted a day has to match both.
 */
public final class RecurrenceExpression {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("[0-9]{1,2}");

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean everyHour;

    private RecurrenceExpression(String expression, BitSet minutes, BitSet hours, BitSet daysOfMonth, BitSet months,
            BitSet daysOfWeek, boolean everyHour) {
        this.expression = expression;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
        this.everyHour = everyHour;
    }

    public static RecurrenceExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidRecurrenceException("Recurrence expression must not be blank");
        }
        String[] fields = WHITESPACE.split(expression.trim());
        String normalized = String.join(" ", fields);
        if (fields.length != 5) {
            throw new InvalidRecurrenceException(
                    "Recurrence expression '" + normalized + "' must have exactly 5 fields but has " + fields.length);
        }

        BitSet minutes = parseField(normalized, fields[0], Field.MINUTE);
        BitSet hours = parseField(normalized, fields[1], Field.HOUR);
        BitSet daysOfMonth = parseField(normalized, fields[2], Field.DAY_OF_MONTH);
        BitSet months = parseField(normalized, fields[3], Field.MONTH);
        BitSet daysOfWeek = parseField(normalized, fields[4], Field.DAY_OF_WEEK);
        if (daysOfWeek.get(7)) {
            daysOfWeek.clear(7);
            daysOfWeek.set(0);
        }
        boolean everyHour = fields[1].equals("*") || fields[1].startsWith("*/");
        return new RecurrenceExpression(normalized, minutes, hours, daysOfMonth, months, daysOfWeek, everyHour);
    }

    public boolean matchesMinute(int minute) {
        return minutes.get(minute);
    }

    public boolean matchesHour(int hour) {
        return hours.get(hour);
    }

    public boolean matchesMonth(int month) {
        return months.get(month);
    }

    public boolean matchesDay(LocalDate date) {
        return daysOfMonth.get(date.getDayOfMonth()) && daysOfWeek.get(sundayBasedIndex(date.getDayOfWeek()));
    }

    /**
     * Whether the hour field is {@code *} or a step. Such expressions also fire
     * in the second pass of an hour repeated by a fall-back transition.
     */
    public boolean isEveryHour() {
        return everyHour;
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static int sundayBasedIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    private static BitSet parseField(String expression, String token, Field field) {
        BitSet values = new BitSet(field.max + 1);
        if (token.equals("*")) {
            values.set(field.min, field.max + 1);
            return values;
        }

        if (token.startsWith("*/")) {
            int step = parseNumber(expression, token.substring(2), field, "step");
            if (step < 1) {
                throw new InvalidRecurrenceException(
                        "Step in " + field.label + " field of '" + expression + "' must be at least 1");
            }
            for (int value = field.min; value <= field.max; value += step) {
                values.set(value);
            }
            return values;
        }

        for (String part : token.split(",", -1)) {
            int value = parseNumber(expression, part, field, "value");
            if (value < field.min || value > field.max) {
                throw new InvalidRecurrenceException("Value " + value + " in " + field.label + " field of '"
                        + expression + "' is outside " + field.min + "-" + field.max);
            }
            values.set(value);
        }
        return values;
    }

    private static int parseNumber(String expression, String raw, Field field, String what) {
        if (!NUMBER.matcher(raw).matches()) {
            throw new InvalidRecurrenceException("Unsupported " + what + " '" + raw + "' in " + field.label
                    + " field of '" + expression + "'");
        }
        return Integer.parseInt(raw);
    }

    private enum Field {
        MINUTE(0, 59),
        HOUR(0, 23),
        DAY_OF_MONTH(1, 31),
        MONTH(1, 12),
        DAY_OF_WEEK(0, 7);

        private final int min;
        private final int max;
        private final String label;

        Field(int min, int max) {
            this.min = min;
            this.max = max;
            this.label = name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }
}
