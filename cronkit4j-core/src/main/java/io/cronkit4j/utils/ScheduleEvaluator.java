package io.cronkit4j.utils;

import io.cronkit4j.core.InvalidScheduleException;
import io.cronkit4j.core.Schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Computes when a schedule fires next. Stateless.
 */
public final class ScheduleEvaluator {
    private ScheduleEvaluator() {
    }

    /**
     * Next eligible execution instant strictly after {@code reference}.
     *
     * <ul>
     *   <li>at: the timestamp if still in the future, otherwise {@code null}</li>
     *   <li>every: {@code reference + everyMs}, no wall-clock alignment</li>
     *   <li>cron: the first matching wall-clock time in {@code zone}</li>
     * </ul>
     *
     * @return next instant, or {@code null} when an {@code at} schedule has already elapsed
     * @throws InvalidScheduleException when the schedule is invalid or a cron expression never matches
     */
    public static Instant computeNext(Schedule schedule, Instant reference, ZoneId zone) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        validate(schedule);

        return switch (schedule.kind()) {
            case AT -> {
                long atMs = ((Schedule.At) schedule).atMs();
                yield atMs > reference.toEpochMilli() ? Instant.ofEpochMilli(atMs) : null;
            }
            case EVERY -> reference.plusMillis(((Schedule.Every) schedule).everyMs());
            case CRON -> {
                String expr = ((Schedule.Cron) schedule).expr();
                Instant next = CronExpression.parse(expr).nextAfter(reference, zone);
                if (next == null) {
                    throw new InvalidScheduleException("Cron expression produced no next execution time: " + expr);
                }
                yield next;
            }
        };
    }

    /**
     * Epoch-millisecond variant of {@link #computeNext(Schedule, Instant, ZoneId)}.
     */
    public static Long computeNextRunAtMs(Schedule schedule, long referenceMs, ZoneId zone) {
        Instant next = computeNext(schedule, Instant.ofEpochMilli(referenceMs), zone);
        return next == null ? null : next.toEpochMilli();
    }

    public static void validate(Schedule schedule) {
        if (schedule == null) {
            throw new InvalidScheduleException("schedule must not be null");
        }
        switch (schedule.kind()) {
            case AT -> {
                if (((Schedule.At) schedule).atMs() <= 0) {
                    throw new InvalidScheduleException("at timestamp must be positive: " + ((Schedule.At) schedule).atMs());
                }
            }
            case EVERY -> {
                if (((Schedule.Every) schedule).everyMs() <= 0) {
                    throw new InvalidScheduleException("every interval must be positive: " + ((Schedule.Every) schedule).everyMs());
                }
            }
            case CRON -> CronExpression.parse(((Schedule.Cron) schedule).expr());
        }
    }

    /**
     * Resolves a per-job IANA zone id, falling back when it is absent.
     *
     * @throws InvalidScheduleException when {@code timezone} is not a known zone id
     */
    public static ZoneId resolveZone(String timezone, ZoneId fallback) {
        if (timezone == null || timezone.isBlank()) {
            return Objects.requireNonNull(fallback, "fallback must not be null");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone: " + timezone, e);
        }
    }
}
