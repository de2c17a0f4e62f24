package io.cronkit4j.utils;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Parses human interval text into a {@link Duration}, for {@code every} schedules.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "90"</li>
 *   <li>Compact: "30s", "5m", "2h", "1d", "1w"</li>
 *   <li>Pairs: "5 minutes", "1 day 3 hours", "2 hours 30 minutes"</li>
 * </ul>
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    private enum Unit {
        WEEK(Duration.ofDays(7)),
        DAY(Duration.ofDays(1)),
        HOUR(Duration.ofHours(1)),
        MINUTE(Duration.ofMinutes(1)),
        SECOND(Duration.ofSeconds(1));

        private final Duration size;

        Unit(Duration size) {
            this.size = size;
        }

        static Unit fromWord(String word) {
            String w = word.endsWith("s") ? word.substring(0, word.length() - 1) : word;
            return switch (w) {
                case "week" -> WEEK;
                case "day" -> DAY;
                case "hour" -> HOUR;
                case "minute", "min" -> MINUTE;
                case "second", "sec" -> SECOND;
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + word);
            };
        }

        static Unit fromLetter(char c) {
            return switch (c) {
                case 'w' -> WEEK;
                case 'd' -> DAY;
                case 'h' -> HOUR;
                case 'm' -> MINUTE;
                case 's' -> SECOND;
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + c);
            };
        }
    }

    /**
     * @return a positive duration
     * @throws IllegalArgumentException when the text cannot be parsed or totals zero
     */
    public static Duration parseDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        Duration total;
        if (s.matches("^\\d+$")) {
            total = Duration.ofSeconds(parseCount(s, input));
        } else if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            total = Unit.fromLetter(s.charAt(s.length() - 1)).size.multipliedBy(parseCount(digits, input));
        } else {
            total = parsePairs(s, input);
        }

        if (total.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return total;
    }

    private static Duration parsePairs(String s, String input) {
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Set<Unit> seen = EnumSet.noneOf(Unit.class);
        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseCount(parts[i], input);
            Unit unit = Unit.fromWord(parts[i + 1]);
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit.name().toLowerCase(Locale.ROOT));
            }
            total = total.plus(unit.size.multipliedBy(n));
        }
        return total;
    }

    private static long parseCount(String digits, String input) {
        try {
            long n = Long.parseLong(digits);
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative: " + input);
            }
            return n;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number in interval: " + input);
        }
    }
}
