package io.cronkit4j.core;

import java.util.Objects;

/**
 * Mutable run state of a job. Only the cron service writes it.
 *
 * <p>{@code nextRunAtMs == null} means the job will not fire again until something recomputes it
 * (exhausted one-shot, disabled job).
 */
public class JobState {

    private Long nextRunAtMs;
    private Long lastRunAtMs;
    private RunStatus lastStatus = RunStatus.NEVER_RUN;
    private String lastError;
    private Long lastDurationMs;
    private long runCount;

    public JobState() {
    }

    public JobState copy() {
        JobState c = new JobState();
        c.nextRunAtMs = nextRunAtMs;
        c.lastRunAtMs = lastRunAtMs;
        c.lastStatus = lastStatus;
        c.lastError = lastError;
        c.lastDurationMs = lastDurationMs;
        c.runCount = runCount;
        return c;
    }

    public Long getNextRunAtMs() {
        return nextRunAtMs;
    }

    public void setNextRunAtMs(Long nextRunAtMs) {
        this.nextRunAtMs = nextRunAtMs;
    }

    public Long getLastRunAtMs() {
        return lastRunAtMs;
    }

    public void setLastRunAtMs(Long lastRunAtMs) {
        this.lastRunAtMs = lastRunAtMs;
    }

    public RunStatus getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(RunStatus lastStatus) {
        this.lastStatus = lastStatus == null ? RunStatus.NEVER_RUN : lastStatus;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Long getLastDurationMs() {
        return lastDurationMs;
    }

    public void setLastDurationMs(Long lastDurationMs) {
        this.lastDurationMs = lastDurationMs;
    }

    public long getRunCount() {
        return runCount;
    }

    public void setRunCount(long runCount) {
        this.runCount = runCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobState that)) return false;
        return runCount == that.runCount
                && Objects.equals(nextRunAtMs, that.nextRunAtMs)
                && Objects.equals(lastRunAtMs, that.lastRunAtMs)
                && lastStatus == that.lastStatus
                && Objects.equals(lastError, that.lastError)
                && Objects.equals(lastDurationMs, that.lastDurationMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nextRunAtMs, lastRunAtMs, lastStatus, lastError, lastDurationMs, runCount);
    }

    @Override
    public String toString() {
        return "JobState{nextRunAtMs=" + nextRunAtMs
                + ", lastRunAtMs=" + lastRunAtMs
                + ", lastStatus=" + lastStatus
                + ", lastError=" + lastError
                + ", runCount=" + runCount + "}";
    }
}
