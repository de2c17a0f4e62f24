package io.cronkit4j.core;

/**
 * Point-in-time summary of the scheduler.
 *
 * running      : dispatch loop is active
 * jobs         : number of stored jobs
 * enabledJobs  : number of enabled jobs
 * nextWakeAtMs : earliest next_run_at_ms among enabled jobs, or null
 */
public record CronStatus(
        boolean running,
        int jobs,
        int enabledJobs,
        Long nextWakeAtMs
) {
}
