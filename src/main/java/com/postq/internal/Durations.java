package com.postq.internal;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses configured durations given either as ISO-8601 ({@code PT30S}) or as
 * shorthand ({@code 500ms}, {@code 30s}, {@code 10m}, {@code 36h}, {@code 7d}).
 */
public final class Durations {

    private Durations() {
    }

    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration value must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
        }

        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        try {
            if (shorthand.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(shorthand.substring(0, shorthand.length() - 2)));
            }
            long amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
            return switch (shorthand.charAt(shorthand.length() - 1)) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                default -> throw new IllegalArgumentException("Unsupported duration value: " + value);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported duration value: " + value, e);
        }
    }
}
