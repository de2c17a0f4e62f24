package io.cronkit4j;

import io.cronkit4j.core.CronJob;
import io.cronkit4j.core.CronStatus;
import io.cronkit4j.core.JobSpec;
import io.cronkit4j.core.JobUpdate;
import io.cronkit4j.core.Payload;
import io.cronkit4j.core.Schedule;
import io.cronkit4j.hooks.HookRegistry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Owns the job set, persists every change through its store, and runs a dispatch loop that
 * fires due jobs through the registered {@link PayloadHandler}s while notifying hooks.
 *
 * <p>Returned {@link CronJob} instances are detached copies.
 */
public interface CronService extends AutoCloseable {

    /**
     * Load persisted jobs and start the dispatch loop. Idempotent.
     */
    void start();

    /**
     * Stop the dispatch loop, waiting up to the job timeout for running handlers. Idempotent.
     */
    void stop();

    /**
     * Stop and release the hook registry. The service cannot be restarted afterwards.
     */
    @Override
    void close();

    /**
     * Fluent builder; nothing is persisted until {@code save()}.
     */
    JobBuilder create(String name);

    /**
     * @param timezone IANA zone id; null means the service default
     * @throws io.cronkit4j.core.InvalidScheduleException on an invalid schedule or zone
     */
    CronJob addJob(String name, Schedule schedule, Payload payload, String timezone);

    CronJob addJob(JobSpec spec);

    /**
     * @throws io.cronkit4j.core.JobNotFoundException for an unknown id
     */
    CronJob updateJob(String id, JobUpdate update);

    /**
     * @return the removed job
     */
    CronJob removeJob(String id);

    CronJob enableJob(String id);

    CronJob disableJob(String id);

    Optional<CronJob> getJob(String id);

    /**
     * Every job, ordered by next run time (jobs without one last), then id.
     */
    List<CronJob> listJobs();

    List<CronJob> listJobs(boolean includeDisabled);

    /**
     * One tick: dispatch every enabled job whose next run is at or before {@code now}, earliest
     * first (ties by id).
     *
     * @return ids of the dispatched jobs, in dispatch order
     */
    List<String> runDue(Instant now);

    /**
     * Dispatch one job immediately.
     *
     * @param force run even when the job is disabled
     * @return false when the job is disabled and {@code force} is false
     */
    boolean runJob(String id, boolean force);

    CronStatus status();

    HookRegistry hooks();
}
