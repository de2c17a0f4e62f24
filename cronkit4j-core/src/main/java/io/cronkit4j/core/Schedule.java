package io.cronkit4j.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Recurrence rule attached to a job.
 *
 * <ul>
 *   <li>{@link At}: fires once at an absolute epoch-millisecond timestamp</li>
 *   <li>{@link Every}: fires repeatedly, {@code everyMs} after creation or the last run</li>
 *   <li>{@link Cron}: fires at every instant matching a cron expression</li>
 * </ul>
 *
 * <p>Values are immutable. Validation of the parameters happens in
 * {@link io.cronkit4j.utils.ScheduleEvaluator#validate(Schedule)}, not here, so that a record
 * read from disk can always be materialized.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Schedule.At.class, name = "at"),
        @JsonSubTypes.Type(value = Schedule.Every.class, name = "every"),
        @JsonSubTypes.Type(value = Schedule.Cron.class, name = "cron")
})
public sealed interface Schedule permits Schedule.At, Schedule.Every, Schedule.Cron {

    @JsonIgnore
    ScheduleKind kind();

    static At at(long atMs) {
        return new At(atMs);
    }

    static Every every(long everyMs) {
        return new Every(everyMs);
    }

    static Cron cron(String expr) {
        return new Cron(expr);
    }

    record At(long atMs) implements Schedule {
        @Override
        public ScheduleKind kind() {
            return ScheduleKind.AT;
        }
    }

    record Every(long everyMs) implements Schedule {
        @Override
        public ScheduleKind kind() {
            return ScheduleKind.EVERY;
        }
    }

    record Cron(String expr) implements Schedule {
        public Cron {
            expr = expr == null ? "" : expr.trim();
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.CRON;
        }
    }
}
