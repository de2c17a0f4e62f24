package io.cronkit4j.core;

/**
 * Partial update for an existing job. Fields left {@code null} keep their current value.
 *
 * <p>{@link #clearTimezone()} is distinct from "no change": it drops a per-job zone so the job
 * falls back to the service default.
 */
public final class JobUpdate {

    private final String name;
    private final Schedule schedule;
    private final Payload payload;
    private final String timezone;
    private final boolean clearTimezone;

    private JobUpdate(String name, Schedule schedule, Payload payload, String timezone, boolean clearTimezone) {
        this.name = (name == null || name.isBlank()) ? null : name;
        this.schedule = schedule;
        this.payload = payload;
        this.timezone = (timezone == null || timezone.isBlank()) ? null : timezone;
        this.clearTimezone = clearTimezone;
    }

    public String name() {
        return name;
    }

    public Schedule schedule() {
        return schedule;
    }

    public Payload payload() {
        return payload;
    }

    public String timezone() {
        return timezone;
    }

    public boolean clearTimezone() {
        return clearTimezone;
    }

    /**
     * True when applying this update can move the next run time.
     */
    public boolean affectsSchedule() {
        return schedule != null || timezone != null || clearTimezone;
    }

    public boolean isEmpty() {
        return name == null && schedule == null && payload == null && timezone == null && !clearTimezone;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private Schedule schedule;
        private Payload payload;
        private String timezone;
        private boolean clearTimezone;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder payload(Payload payload) {
            this.payload = payload;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            this.clearTimezone = false;
            return this;
        }

        public Builder clearTimezone() {
            this.timezone = null;
            this.clearTimezone = true;
            return this;
        }

        public JobUpdate build() {
            JobUpdate update = new JobUpdate(name, schedule, payload, timezone, clearTimezone);
            if (update.isEmpty()) {
                throw new IllegalStateException(
                        "JobUpdate must contain at least one change: name, schedule, payload, or timezone"
                );
            }
            return update;
        }
    }
}
