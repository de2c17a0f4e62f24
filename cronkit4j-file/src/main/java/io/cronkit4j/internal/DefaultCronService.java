package io.cronkit4j.internal;

import io.cronkit4j.CronService;
import io.cronkit4j.JobBuilder;
import io.cronkit4j.config.CronProperties;
import io.cronkit4j.core.CronJob;
import io.cronkit4j.core.CronStatus;
import io.cronkit4j.core.InvalidScheduleException;
import io.cronkit4j.core.JobNotFoundException;
import io.cronkit4j.core.JobSpec;
import io.cronkit4j.core.JobState;
import io.cronkit4j.core.JobStore;
import io.cronkit4j.core.JobUpdate;
import io.cronkit4j.core.Payload;
import io.cronkit4j.core.PayloadHandlerRegistry;
import io.cronkit4j.core.RunStatus;
import io.cronkit4j.core.Schedule;
import io.cronkit4j.core.StoreCorruptException;
import io.cronkit4j.hooks.HookEvent;
import io.cronkit4j.hooks.HookEvents;
import io.cronkit4j.hooks.HookRegistry;
import io.cronkit4j.internal.JobRunner.Run;
import io.cronkit4j.internal.JobRunner.RunResult;
import io.cronkit4j.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * File-backed cron service.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-shot jobs ({@code at}), fixed intervals ({@code every}) and zoned cron expressions</li>
 *   <li>Every CRUD change is persisted before it becomes visible</li>
 *   <li>A single ticker thread fires due jobs on a bounded worker pool with a per-job timeout</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * cron.start();
 *
 * cron.create("daily-report")
 *     .cron("0 9 * * MON-FRI")
 *     .timezone("Asia/Shanghai")
 *     .taskRun("report", Map.of("format", "pdf"))
 *     .save();
 *
 * cron.stop();
 * }</pre>
 */
public class DefaultCronService implements CronService {
    private static final Logger log = LoggerFactory.getLogger(DefaultCronService.class);

    private static final Comparator<CronJob> BY_NEXT_RUN = Comparator
            .comparing((CronJob j) -> j.getState().getNextRunAtMs(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CronJob::getId);

    private final CronProperties props;
    private final JobStore jobStore;
    private final PayloadHandlerRegistry handlerRegistry;
    private final HookRegistry hooks;
    private final Clock clock;
    private final JobRunner runner;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean loaded = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // ticks and manual runs
    private final ReentrantLock tickLock = new ReentrantLock();
    // job map writes and the dirty flag
    private final ReentrantLock stateLock = new ReentrantLock();

    private volatile Map<String, CronJob> jobs = Map.of();
    private boolean dirty;

    private Thread tickerThread;
    private int systemErrorCount = 0;

    public DefaultCronService(CronProperties props, JobStore jobStore, PayloadHandlerRegistry handlerRegistry) {
        this(props, jobStore, handlerRegistry, new HookRegistry(props.getHookTimeout()), Clock.systemUTC());
    }

    public DefaultCronService(CronProperties props,
                              JobStore jobStore,
                              PayloadHandlerRegistry handlerRegistry,
                              HookRegistry hooks,
                              Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.runner = new JobRunner(props, handlerRegistry);
    }

    /**
     * Load the job set and start the ticker. Idempotent.
     */
    @Override
    public void start() {
        ensureOpen();
        props.validate();
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            ensureLoaded();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("cronkit starting with tickInterval={}, jobTimeout={}, hookTimeout={}, maxConcurrency={}, defaultTimezone={}",
                props.getTickInterval(),
                props.getJobTimeout(),
                props.getHookTimeout(),
                props.getMaxConcurrency(),
                props.defaultZone());

        if (tickerThread == null) {
            tickerThread = new Thread(this::tickLoop);
            tickerThread.setName("cronkit.ticker");
            tickerThread.setDaemon(true);
            tickerThread.start();
        }
        log.info("cronkit started jobs={} nextWakeAtMs={}", jobs.size(), status().nextWakeAtMs());
    }

    /**
     * Stop the ticker after the tick in progress completes. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("cronkit stopping...");

        // waits for a running tick, which is bounded by the job timeout
        tickLock.lock();
        try {
            if (tickerThread != null) {
                tickerThread.interrupt();
                tickerThread = null;
            }
            runner.shutdown();
        } finally {
            tickLock.unlock();
        }
        log.info("cronkit stopped.");
    }

    @Override
    public void close() {
        stop();
        if (closed.compareAndSet(false, true)) {
            tickLock.lock();
            try {
                runner.shutdown();
            } finally {
                tickLock.unlock();
            }
            hooks.close();
        }
    }

    @Override
    public JobBuilder create(String name) {
        return new SimpleJobBuilder(name, clock, this::addJob);
    }

    @Override
    public CronJob addJob(String name, Schedule schedule, Payload payload, String timezone) {
        return addJob(new JobSpec(name, schedule, timezone, false, payload));
    }

    @Override
    public CronJob addJob(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec.name() == null || spec.name().isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        validatePayload(spec.payload());
        ScheduleEvaluator.validate(spec.schedule());
        ZoneId zone = ScheduleEvaluator.resolveZone(spec.timezone(), props.defaultZone());
        if (spec.deleteAfterRun() && spec.schedule().kind().isRecurring()) {
            throw new IllegalArgumentException("deleteAfterRun only applies to 'at' schedules");
        }
        if (!handlerRegistry.supports(spec.payload().kind())) {
            log.warn("cronkit job added without a registered handler name={} kind={}",
                    spec.name(), spec.payload().kind().key());
        }

        long nowMs = clock.millis();
        Long nextRunAtMs = ScheduleEvaluator.computeNextRunAtMs(spec.schedule(), nowMs, zone);

        return mutate(map -> {
            CronJob job = new CronJob();
            job.setId(newId(map));
            job.setName(spec.name().trim());
            job.setSchedule(spec.schedule());
            job.setPayload(spec.payload());
            job.setEnabled(true);
            job.setTimezone(blankToNull(spec.timezone()));
            job.setDeleteAfterRun(spec.deleteAfterRun());
            job.setCreatedAtMs(nowMs);
            job.setUpdatedAtMs(nowMs);
            job.getState().setNextRunAtMs(nextRunAtMs);
            map.put(job.getId(), job);

            if (nextRunAtMs == null) {
                log.warn("cronkit job added with an elapsed 'at' schedule; it will not fire id={} name={}",
                        job.getId(), job.getName());
            }
            log.info("cronkit job added id={} name={} kind={} nextRunAtMs={}",
                    job.getId(), job.getName(), job.getSchedule().kind(), nextRunAtMs);
            return job.copy();
        });
    }

    @Override
    public CronJob updateJob(String id, JobUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");
        if (update.payload() != null) {
            validatePayload(update.payload());
        }
        if (update.schedule() != null) {
            ScheduleEvaluator.validate(update.schedule());
        }

        long nowMs = clock.millis();
        return mutate(map -> {
            CronJob job = requireJob(map, id).copy();
            if (update.name() != null) {
                job.setName(update.name().trim());
            }
            if (update.schedule() != null) {
                job.setSchedule(update.schedule());
            }
            if (update.payload() != null) {
                job.setPayload(update.payload());
            }
            if (update.clearTimezone()) {
                job.setTimezone(null);
            } else if (update.timezone() != null) {
                job.setTimezone(update.timezone());
            }

            ZoneId zone = ScheduleEvaluator.resolveZone(job.getTimezone(), props.defaultZone());
            if (job.getSchedule() != null && job.isDeleteAfterRun() && job.getSchedule().kind().isRecurring()) {
                job.setDeleteAfterRun(false);
            }
            if (update.affectsSchedule() && job.isEnabled()) {
                job.getState().setNextRunAtMs(ScheduleEvaluator.computeNextRunAtMs(job.getSchedule(), nowMs, zone));
            }
            job.setUpdatedAtMs(nowMs);
            map.put(id, job);

            log.info("cronkit job updated id={} name={} nextRunAtMs={}",
                    id, job.getName(), job.getState().getNextRunAtMs());
            return job.copy();
        });
    }

    @Override
    public CronJob removeJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return mutate(map -> {
            CronJob removed = map.remove(id);
            if (removed == null) {
                throw new JobNotFoundException(id);
            }
            log.info("cronkit job removed id={} name={}", id, removed.getName());
            return removed.copy();
        });
    }

    @Override
    public CronJob enableJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        long nowMs = clock.millis();
        return mutate(map -> {
            CronJob job = requireJob(map, id).copy();
            if (job.isEnabled()) {
                return job;
            }
            ZoneId zone = ScheduleEvaluator.resolveZone(job.getTimezone(), props.defaultZone());
            job.getState().setNextRunAtMs(ScheduleEvaluator.computeNextRunAtMs(job.getSchedule(), nowMs, zone));
            job.setEnabled(true);
            job.setUpdatedAtMs(nowMs);
            map.put(id, job);
            log.info("cronkit job enabled id={} nextRunAtMs={}", id, job.getState().getNextRunAtMs());
            return job.copy();
        });
    }

    @Override
    public CronJob disableJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        long nowMs = clock.millis();
        return mutate(map -> {
            CronJob job = requireJob(map, id).copy();
            if (!job.isEnabled()) {
                return job;
            }
            job.setEnabled(false);
            job.getState().setNextRunAtMs(null);
            job.setUpdatedAtMs(nowMs);
            map.put(id, job);
            log.info("cronkit job disabled id={}", id);
            return job.copy();
        });
    }

    @Override
    public Optional<CronJob> getJob(String id) {
        ensureLoaded();
        CronJob job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(job.copy());
    }

    @Override
    public List<CronJob> listJobs() {
        return listJobs(true);
    }

    @Override
    public List<CronJob> listJobs(boolean includeDisabled) {
        ensureLoaded();
        return jobs.values().stream()
                .filter(j -> includeDisabled || j.isEnabled())
                .sorted(BY_NEXT_RUN)
                .map(CronJob::copy)
                .toList();
    }

    @Override
    public List<String> runDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        ensureLoaded();

        tickLock.lock();
        try {
            ensureOpen();
            long nowMs = now.toEpochMilli();
            List<CronJob> due = jobs.values().stream()
                    .filter(CronJob::isEnabled)
                    .filter(j -> j.getState().getNextRunAtMs() != null && j.getState().getNextRunAtMs() <= nowMs)
                    .sorted(BY_NEXT_RUN)
                    .map(CronJob::copy)
                    .toList();

            if (due.isEmpty()) {
                saveIfDirty();
                return List.of();
            }

            log.debug("cronkit tick due count={} nowMs={}", due.size(), nowMs);

            List<Run> dispatches = new ArrayList<>(due.size());
            for (CronJob job : due) {
                dispatches.add(dispatch(job, nowMs));
            }

            Map<String, RunResult> results = new LinkedHashMap<>();
            for (Run d : dispatches) {
                results.put(d.job().getId(), runner.await(d));
            }

            applyResults(dispatches, results, nowMs);
            return dispatches.stream().map(d -> d.job().getId()).toList();
        } finally {
            tickLock.unlock();
        }
    }

    @Override
    public boolean runJob(String id, boolean force) {
        Objects.requireNonNull(id, "id must not be null");
        ensureLoaded();

        tickLock.lock();
        try {
            ensureOpen();
            CronJob current = jobs.get(id);
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (!current.isEnabled() && !force) {
                log.info("cronkit manual run skipped; job disabled id={}", id);
                return false;
            }
            if (current.getSchedule() == null || current.getPayload() == null) {
                throw new IllegalStateException("job " + id + " has no schedule or payload and cannot run");
            }

            long nowMs = clock.millis();
            Run d = dispatch(current.copy(), nowMs);
            RunResult result = runner.await(d);
            applyResults(List.of(d), Map.of(id, result), nowMs);
            return true;
        } finally {
            tickLock.unlock();
        }
    }

    @Override
    public CronStatus status() {
        Map<String, CronJob> snapshot = jobs;
        int enabled = 0;
        Long nextWake = null;
        for (CronJob job : snapshot.values()) {
            if (!job.isEnabled()) {
                continue;
            }
            enabled++;
            Long next = job.getState().getNextRunAtMs();
            if (next != null && (nextWake == null || next < nextWake)) {
                nextWake = next;
            }
        }
        return new CronStatus(started.get(), snapshot.size(), enabled, nextWake);
    }

    @Override
    public HookRegistry hooks() {
        return hooks;
    }

    private Run dispatch(CronJob job, long nowMs) {
        hooks.trigger(HookEvents.BEFORE_RUN, hookEvent(HookEvents.BEFORE_RUN, job, nowMs, null));
        return runner.submit(job);
    }

    /**
     * Folds run outcomes into the current job set, saves once, then notifies hooks.
     */
    private void applyResults(List<Run> dispatches, Map<String, RunResult> results, long nowMs) {
        List<HookEvent> outcomes = new ArrayList<>(dispatches.size());

        stateLock.lock();
        try {
            Map<String, CronJob> next = new LinkedHashMap<>(jobs);
            for (Run d : dispatches) {
                String id = d.job().getId();
                RunResult result = results.get(id);
                String event = result.status() == RunStatus.SUCCESS ? HookEvents.AFTER_RUN : HookEvents.RUN_FAILED;
                outcomes.add(hookEvent(event, d.job(), nowMs, result));

                CronJob current = next.get(id);
                if (current == null) {
                    log.info("cronkit job removed while running; dropping outcome id={}", id);
                    continue;
                }

                CronJob job = current.copy();
                JobState state = job.getState();
                state.setLastRunAtMs(nowMs);
                state.setLastStatus(result.status());
                state.setLastError(result.error());
                state.setLastDurationMs(result.durationMs());
                state.setRunCount(state.getRunCount() + 1);

                if (!job.getSchedule().kind().isRecurring()) {
                    if (job.isDeleteAfterRun()) {
                        next.remove(id);
                        log.info("cronkit one-shot job deleted after run id={} status={}", id, result.status());
                        continue;
                    }
                    job.setEnabled(false);
                    state.setNextRunAtMs(null);
                } else if (job.isEnabled()) {
                    try {
                        ZoneId zone = ScheduleEvaluator.resolveZone(job.getTimezone(), props.defaultZone());
                        state.setNextRunAtMs(ScheduleEvaluator.computeNextRunAtMs(job.getSchedule(), nowMs, zone));
                    } catch (InvalidScheduleException e) {
                        log.error("cronkit job disabled; schedule has no next run id={} msg={}", id, e.getMessage());
                        job.setEnabled(false);
                        state.setNextRunAtMs(null);
                        state.setLastError(e.getMessage());
                    }
                } else {
                    state.setNextRunAtMs(null);
                }
                next.put(id, job);
            }

            jobs = next;
            dirty = true;
            saveIfDirty();
        } finally {
            stateLock.unlock();
        }

        for (HookEvent outcome : outcomes) {
            hooks.trigger(outcome.event(), outcome);
        }
    }

    private void saveIfDirty() {
        stateLock.lock();
        try {
            if (dirty) {
                jobStore.save(jobs);
                dirty = false;
            }
        } catch (IOException e) {
            log.error("cronkit store save failed; retrying next tick msg={}", e.getMessage(), e);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Copy-on-write mutation: the change runs against a copy, which is saved and only then published.
     */
    private <T> T mutate(Function<Map<String, CronJob>, T> change) {
        ensureLoaded();
        stateLock.lock();
        try {
            Map<String, CronJob> next = new LinkedHashMap<>(jobs);
            T result = change.apply(next);
            try {
                jobStore.save(next);
            } catch (IOException e) {
                throw new UncheckedIOException("cronkit store save failed", e);
            }
            jobs = next;
            dirty = false;
            return result;
        } finally {
            stateLock.unlock();
        }
    }

    private void ensureLoaded() {
        if (loaded.get()) {
            return;
        }
        stateLock.lock();
        try {
            if (loaded.get()) {
                return;
            }
            long nowMs = clock.millis();
            Map<String, CronJob> loadedJobs = new LinkedHashMap<>();
            int migrated = 0;
            for (Map.Entry<String, CronJob> e : loadOrReset().entrySet()) {
                CronJob job = e.getValue();
                job.setId(e.getKey());
                if (migrate(job, nowMs)) {
                    migrated++;
                }
                loadedJobs.put(job.getId(), job);
            }
            jobs = loadedJobs;
            dirty = migrated > 0;
            loaded.set(true);
            log.info("cronkit loaded jobs={} migrated={}", loadedJobs.size(), migrated);
            saveIfDirty();
        } finally {
            stateLock.unlock();
        }
    }

    private Map<String, CronJob> loadOrReset() {
        try {
            return jobStore.load();
        } catch (StoreCorruptException e) {
            if (!props.isResetCorruptStore()) {
                throw new IllegalStateException("cronkit job store is corrupt: " + e.getPath(), e);
            }
            log.warn("cronkit job store is corrupt; moving it aside and starting empty path={} msg={}",
                    e.getPath(), e.getMessage());
            try {
                jobStore.quarantine();
                return new LinkedHashMap<>();
            } catch (IOException qe) {
                throw new UncheckedIOException("cronkit could not move corrupt store aside", qe);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cronkit could not read job store", e);
        }
    }

    /**
     * Brings a loaded job in line with the state invariants.
     *
     * @return true when the job was changed
     */
    private boolean migrate(CronJob job, long nowMs) {
        JobState state = job.getState();
        boolean changed = false;
        if (job.getName() == null || job.getName().isBlank()) {
            job.setName(job.getId());
            changed = true;
        }
        if (job.isEnabled()) {
            String problem = job.getSchedule() == null ? "missing schedule"
                    : job.getPayload() == null ? "missing payload" : null;
            try {
                if (problem == null) {
                    ScheduleEvaluator.validate(job.getSchedule());
                    if (state.getNextRunAtMs() == null && job.getSchedule().kind().isRecurring()) {
                        ZoneId zone = ScheduleEvaluator.resolveZone(job.getTimezone(), props.defaultZone());
                        state.setNextRunAtMs(ScheduleEvaluator.computeNextRunAtMs(job.getSchedule(), nowMs, zone));
                        return true;
                    }
                    return changed;
                }
            } catch (InvalidScheduleException e) {
                problem = e.getMessage();
            }
            log.warn("cronkit job disabled on load id={} reason={}", job.getId(), problem);
            job.setEnabled(false);
            state.setLastError(problem);
            changed = true;
        }
        if (state.getNextRunAtMs() != null) {
            state.setNextRunAtMs(null);
            changed = true;
        }
        return changed;
    }

    private void tickLoop() {
        while (started.get()) {
            try {
                tickOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("cronkit tick failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getTickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void tickOnce() {
        tickLock.lock();
        try {
            if (!started.get()) {
                return;
            }
            List<String> fired = runDue(clock.instant());
            if (!fired.isEmpty()) {
                log.debug("cronkit tick dispatched count={} ids={}", fired.size(), fired);
            }
        } finally {
            tickLock.unlock();
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("cron service is closed");
        }
    }

    private static void validatePayload(Payload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        switch (payload.kind()) {
            case MESSAGE -> {
                if (((Payload.Message) payload).message().isBlank()) {
                    throw new IllegalArgumentException("message payload must not be blank");
                }
            }
            case TASK_RUN -> {
                if (((Payload.TaskRun) payload).taskName().isBlank()) {
                    throw new IllegalArgumentException("task_run payload requires a task name");
                }
            }
        }
    }

    private static CronJob requireJob(Map<String, CronJob> map, String id) {
        CronJob job = map.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        return job;
    }

    private static String newId(Map<String, CronJob> existing) {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (existing.containsKey(id));
        return id;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static HookEvent hookEvent(String event, CronJob job, long nowMs, RunResult result) {
        HookEvent.Outcome outcome = result == null
                ? null
                : new HookEvent.Outcome(result.status(), result.error(), result.durationMs());
        return new HookEvent(event, job.getId(), nowMs, job.getName(), job.getPayload().kind(), outcome);
    }
}
