package io.cronkit4j.utils;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.cronkit4j.core.InvalidScheduleException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Standard cron expression backed by cron-utils.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5 fields: {@code minute hour day-of-month month day-of-week} (fires at second 0)</li>
 *   <li>6 fields: {@code second minute hour day-of-month month day-of-week}</li>
 * </ul>
 * Months and weekdays accept three-letter English names, weekday {@code 7} is Sunday and
 * {@code ?} is read as {@code *} in the day fields.
 * <p>
 * Day-of-month and day-of-week are OR-combined when both are restricted (neither starts with
 * {@code *} or {@code ?}), as in Vixie cron.
 * <p>
 * Matching runs on the zone's wall clock. Local times inside a spring-forward gap are skipped, and
 * a local time repeated by a fall-back overlap fires only at its earliest offset.
 */
public final class CronExpression {

    // Feb 29 restricted by day-of-month alone recurs at most 8 years apart.
    private static final int SEARCH_YEARS = 10;
    private static final Pattern ZERO_STEP = Pattern.compile("/0+(?![0-9])");

    private static final CronParser FIVE_FIELDS = new CronParser(definition(false));
    private static final CronParser SIX_FIELDS = new CronParser(definition(true));

    private final String expression;
    private final List<ExecutionTime> executionTimes;

    private CronExpression(String expression, List<ExecutionTime> executionTimes) {
        this.expression = expression;
        this.executionTimes = executionTimes;
    }

    /**
     * Parses a five- or six-field expression.
     *
     * @throws InvalidScheduleException when the expression is malformed or a value is out of range
     */
    public static CronExpression parse(String expression) {
        if (expression == null) {
            throw new InvalidScheduleException("cron expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new InvalidScheduleException("cron expression must not be empty");
        }
        String[] fields = s.toUpperCase(Locale.ROOT).split("\\s+");
        if (fields.length != 5 && fields.length != 6) {
            throw new InvalidScheduleException(
                    "Invalid cron expression '" + expression + "': expected 5 or 6 fields but found " + fields.length);
        }
        if (ZERO_STEP.matcher(s).find()) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': step must be positive");
        }
        CronParser parser = fields.length == 6 ? SIX_FIELDS : FIVE_FIELDS;
        int dayOfMonth = fields.length - 3;
        int dayOfWeek = fields.length - 1;

        try {
            Cron cron = parser.parse(String.join(" ", fields)).validate();
            List<ExecutionTime> times = new ArrayList<>(2);
            if (isStar(fields[dayOfMonth]) || isStar(fields[dayOfWeek])) {
                times.add(ExecutionTime.forCron(cron));
            } else {
                // Either day field alone is enough: one schedule per field, the earlier one wins.
                times.add(ExecutionTime.forCron(parser.parse(withField(fields, dayOfWeek, "*"))));
                times.add(ExecutionTime.forCron(parser.parse(withField(fields, dayOfMonth, "*"))));
            }
            return new CronExpression(s, List.copyOf(times));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /**
     * Smallest matching instant strictly after {@code reference}, evaluated in {@code zone}.
     *
     * @return the next instant, or {@code null} when nothing matches within the search horizon
     * (for example {@code 0 0 30 2 *})
     */
    public Instant nextAfter(Instant reference, ZoneId zone) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        LocalDateTime local = LocalDateTime.ofInstant(reference, zone).withNano(0);
        LocalDateTime limit = local.plusYears(SEARCH_YEARS);

        while (true) {
            LocalDateTime candidate = nextLocal(local);
            if (candidate == null || !candidate.isBefore(limit)) {
                return null;
            }
            List<ZoneOffset> offsets = zone.getRules().getValidOffsets(candidate);
            // Empty inside a gap; an overlap lists the earliest offset first.
            if (!offsets.isEmpty()) {
                Instant instant = candidate.toInstant(offsets.get(0));
                if (instant.isAfter(reference)) {
                    return instant;
                }
            }
            local = candidate;
        }
    }

    /** Next wall-clock match strictly after {@code local}, computed on a zone without transitions. */
    private LocalDateTime nextLocal(LocalDateTime local) {
        ZonedDateTime wallClock = local.atZone(ZoneOffset.UTC);
        LocalDateTime best = null;
        for (ExecutionTime executionTime : executionTimes) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(wallClock);
            if (next.isPresent()) {
                LocalDateTime candidate = next.get().toLocalDateTime();
                if (best == null || candidate.isBefore(best)) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static boolean isStar(String field) {
        return field.startsWith("*") || field.startsWith("?");
    }

    private static String withField(String[] fields, int index, String value) {
        String[] copy = fields.clone();
        copy[index] = value;
        return String.join(" ", copy);
    }

    private static CronDefinition definition(boolean withSeconds) {
        CronDefinitionBuilder builder = CronDefinitionBuilder.defineCron();
        if (withSeconds) {
            builder.withSeconds().withValidRange(0, 59).withStrictRange().and();
        }
        return builder
                .withMinutes().withValidRange(0, 59).withStrictRange().and()
                .withHours().withValidRange(0, 23).withStrictRange().and()
                .withDayOfMonth().withValidRange(1, 31).supportsQuestionMark().withStrictRange().and()
                .withMonth().withValidRange(1, 12).withStrictRange().and()
                .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).supportsQuestionMark()
                .withIntMapping(7, 0).withStrictRange().and()
                .instance();
    }
}
