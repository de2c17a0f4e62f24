package io.cronkit4j.core;

import java.util.Objects;

/**
 * Persisted job record.
 *
 * <p>Fields keep their defaults when absent from a stored record, so older files load without
 * migration code: {@code enabled=true}, {@code deleteAfterRun=false}, a fresh {@link JobState}.
 */
public class CronJob {

    private String id;
    private String name;
    private Schedule schedule;
    private Payload payload;
    private boolean enabled = true;
    private String timezone;
    private boolean deleteAfterRun;
    private long createdAtMs;
    private long updatedAtMs;
    private JobState state = new JobState();

    public CronJob() {
    }

    /**
     * Detached copy; callers can hold it without seeing later scheduler writes.
     */
    public CronJob copy() {
        CronJob c = new CronJob();
        c.id = id;
        c.name = name;
        c.schedule = schedule;
        c.payload = payload;
        c.enabled = enabled;
        c.timezone = timezone;
        c.deleteAfterRun = deleteAfterRun;
        c.createdAtMs = createdAtMs;
        c.updatedAtMs = updatedAtMs;
        c.state = state.copy();
        return c;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Payload getPayload() {
        return payload;
    }

    public void setPayload(Payload payload) {
        this.payload = payload;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isDeleteAfterRun() {
        return deleteAfterRun;
    }

    public void setDeleteAfterRun(boolean deleteAfterRun) {
        this.deleteAfterRun = deleteAfterRun;
    }

    public long getCreatedAtMs() {
        return createdAtMs;
    }

    public void setCreatedAtMs(long createdAtMs) {
        this.createdAtMs = createdAtMs;
    }

    public long getUpdatedAtMs() {
        return updatedAtMs;
    }

    public void setUpdatedAtMs(long updatedAtMs) {
        this.updatedAtMs = updatedAtMs;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state == null ? new JobState() : state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronJob that)) return false;
        return enabled == that.enabled
                && deleteAfterRun == that.deleteAfterRun
                && createdAtMs == that.createdAtMs
                && updatedAtMs == that.updatedAtMs
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(schedule, that.schedule)
                && Objects.equals(payload, that.payload)
                && Objects.equals(timezone, that.timezone)
                && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, schedule, payload, enabled, timezone, deleteAfterRun, createdAtMs, updatedAtMs, state);
    }

    @Override
    public String toString() {
        return "CronJob{id=" + id
                + ", name=" + name
                + ", schedule=" + schedule
                + ", payloadKind=" + (payload == null ? null : payload.kind())
                + ", enabled=" + enabled
                + ", timezone=" + timezone
                + ", state=" + state + "}";
    }
}
