package io.cronkit4j.internal;

import io.cronkit4j.JobBuilder;
import io.cronkit4j.core.CronJob;
import io.cronkit4j.core.JobSpec;
import io.cronkit4j.core.Payload;
import io.cronkit4j.core.Schedule;
import io.cronkit4j.utils.IntervalParser;
import io.cronkit4j.utils.ScheduleEvaluator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by {@link DefaultCronService}.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String name;
    private final Clock clock;
    private final Function<JobSpec, CronJob> persister;

    private Schedule schedule;
    private Payload payload;
    private String timezone;
    private boolean deleteAfterRun;

    public SimpleJobBuilder(String name, Clock clock, Function<JobSpec, CronJob> persister) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder at(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        return schedule(Schedule.at(time.toEpochMilli()));
    }

    @Override
    public JobBuilder in(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isZero() || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be a positive duration");
        }
        return at(clock.instant().plus(delay));
    }

    @Override
    public JobBuilder every(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        return schedule(Schedule.every(interval.toMillis()));
    }

    @Override
    public JobBuilder every(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        return every(IntervalParser.parseDuration(interval));
    }

    @Override
    public JobBuilder cron(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return schedule(Schedule.cron(expression));
    }

    @Override
    public JobBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ScheduleEvaluator.resolveZone(timezone, ZoneId.systemDefault());
        this.timezone = timezone;
        return this;
    }

    @Override
    public JobBuilder message(String message) {
        return payload(Payload.message(message));
    }

    @Override
    public JobBuilder message(String message, String channel, String to) {
        boolean deliver = to != null && !to.isBlank();
        return payload(new Payload.Message(message, deliver, channel, to));
    }

    @Override
    public JobBuilder taskRun(String taskName) {
        return taskRun(taskName, Map.of());
    }

    @Override
    public JobBuilder taskRun(String taskName, Map<String, Object> args) {
        Objects.requireNonNull(taskName, "taskName must not be null");
        return payload(new Payload.TaskRun(taskName, args));
    }

    @Override
    public JobBuilder deleteAfterRun() {
        this.deleteAfterRun = true;
        return this;
    }

    @Override
    public JobSpec build() {
        if (schedule == null) {
            throw new IllegalStateException("schedule must be set: call at, in, every or cron");
        }
        if (payload == null) {
            throw new IllegalStateException("payload must be set: call message or taskRun");
        }
        return new JobSpec(name, schedule, timezone, deleteAfterRun, payload);
    }

    @Override
    public CronJob save() {
        return persister.apply(build());
    }

    private JobBuilder schedule(Schedule schedule) {
        if (this.schedule != null) {
            throw new IllegalStateException("schedule already set to " + this.schedule.kind());
        }
        this.schedule = schedule;
        return this;
    }

    private JobBuilder payload(Payload payload) {
        if (this.payload != null) {
            throw new IllegalStateException("payload already set to " + this.payload.kind().key());
        }
        this.payload = payload;
        return this;
    }
}
