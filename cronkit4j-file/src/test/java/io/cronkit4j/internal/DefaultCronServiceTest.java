package io.cronkit4j.internal;

import io.cronkit4j.PayloadHandler;
import io.cronkit4j.config.CronProperties;
import io.cronkit4j.core.CronJob;
import io.cronkit4j.core.CronStatus;
import io.cronkit4j.core.InvalidScheduleException;
import io.cronkit4j.core.JobNotFoundException;
import io.cronkit4j.core.JobUpdate;
import io.cronkit4j.core.Payload;
import io.cronkit4j.core.PayloadHandlerRegistry;
import io.cronkit4j.core.PayloadKind;
import io.cronkit4j.core.RunStatus;
import io.cronkit4j.core.Schedule;
import io.cronkit4j.hooks.HookCallback;
import io.cronkit4j.hooks.HookEvent;
import io.cronkit4j.hooks.HookEvents;
import io.cronkit4j.hooks.HookRegistry;
import io.cronkit4j.internal.file.FileJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DefaultCronServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final long T0_MS = T0.toEpochMilli();

    @TempDir
    Path dir;

    private Path storePath;
    private CronProperties props;
    private MutableClock clock;
    private ScriptedTaskHandler tasks;
    private FileJobStore store;
    private DefaultCronService service;

    @BeforeEach
    void setUp() {
        storePath = dir.resolve("cron/jobs.json");
        props = new CronProperties();
        props.setStorePath(storePath);
        props.setDefaultTimezone("UTC");
        props.setJobTimeout(Duration.ofSeconds(2));
        props.setHookTimeout(Duration.ofMillis(200));
        clock = new MutableClock(T0);
        tasks = new ScriptedTaskHandler();
        store = spy(new FileJobStore(storePath));
        service = newService(store);
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private DefaultCronService newService(FileJobStore jobStore) {
        return new DefaultCronService(props, jobStore, new PayloadHandlerRegistry(List.of(tasks)),
                new HookRegistry(props.getHookTimeout()), clock);
    }

    @Test
    void everyJobShouldFireOnceWhenDueAndReschedule() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        assertEquals(T0_MS + 60_000L, job.getState().getNextRunAtMs());

        assertTrue(service.runDue(T0.plusMillis(59_999L)).isEmpty());
        assertEquals(List.of(job.getId()), service.runDue(T0.plusMillis(60_000L)));
        assertTrue(service.runDue(T0.plusMillis(60_000L)).isEmpty());

        assertEquals(List.of(job.getId() + ":sync"), tasks.calls);
        CronJob after = service.getJob(job.getId()).orElseThrow();
        assertEquals(RunStatus.SUCCESS, after.getState().getLastStatus());
        assertEquals(T0_MS + 60_000L, after.getState().getLastRunAtMs());
        assertEquals(T0_MS + 120_000L, after.getState().getNextRunAtMs());
        assertEquals(1, after.getState().getRunCount());
        assertNull(after.getState().getLastError());
    }

    @Test
    void hooksShouldObserveRunAndFailingHookShouldNotAffectOutcome() {
        List<String> events = new CopyOnWriteArrayList<>();
        service.hooks().register(HookEvents.BEFORE_RUN, HookCallback.of(e -> events.add(e.event())));
        service.hooks().register(HookEvents.AFTER_RUN, e -> {
            throw new IllegalStateException("hook boom");
        });
        service.hooks().register(HookEvents.AFTER_RUN, HookCallback.of(e -> events.add(
                e.event() + ":" + e.outcome().status() + ":" + e.payloadKind().key())));

        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        service.runDue(T0.plusSeconds(60));

        assertEquals(List.of("before_run", "after_run:SUCCESS:task_run"), events);
        assertEquals(1, service.hooks().failureCount());
        assertEquals(RunStatus.SUCCESS, service.getJob(job.getId()).orElseThrow().getState().getLastStatus());
    }

    @Test
    void failingHandlerShouldRecordFailureAndStillReschedule() {
        List<HookEvent> failures = new CopyOnWriteArrayList<>();
        service.hooks().register(HookEvents.RUN_FAILED, HookCallback.of(failures::add));
        tasks.behavior = (payload, jobId) -> {
            throw new IllegalStateException("boom");
        };

        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        service.runDue(T0.plusSeconds(60));

        CronJob after = service.getJob(job.getId()).orElseThrow();
        assertEquals(RunStatus.FAILURE, after.getState().getLastStatus());
        assertEquals("boom", after.getState().getLastError());
        assertEquals(T0_MS + 120_000L, after.getState().getNextRunAtMs());
        assertTrue(after.isEnabled());
        assertEquals(1, failures.size());
        assertEquals("boom", failures.get(0).outcome().error());
    }

    @Test
    void missingHandlerShouldBeRecordedAsFailure() {
        CronJob job = service.addJob("note", Schedule.every(1_000L), Payload.message("hello"), null);
        service.runDue(T0.plusSeconds(1));

        CronJob after = service.getJob(job.getId()).orElseThrow();
        assertEquals(RunStatus.FAILURE, after.getState().getLastStatus());
        assertTrue(after.getState().getLastError().contains("No PayloadHandler"));
    }

    @Test
    void overrunningHandlerShouldTimeOut() {
        props.setJobTimeout(Duration.ofMillis(200));
        tasks.behavior = (payload, jobId) -> Thread.sleep(10_000L);

        CronJob job = service.addJob("slow", Schedule.every(60_000L), Payload.taskRun("slow"), null);
        long t0 = System.nanoTime();
        service.runDue(T0.plusSeconds(60));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertTrue(elapsedMs < 5_000L, "runDue took " + elapsedMs + " ms");
        CronJob after = service.getJob(job.getId()).orElseThrow();
        assertEquals(RunStatus.FAILURE, after.getState().getLastStatus());
        assertTrue(after.getState().getLastError().contains("timed out"));
        assertEquals(T0_MS + 120_000L, after.getState().getNextRunAtMs());
    }

    @Test
    void queuedJobShouldGetFullTimeoutOnceStarted() {
        props.setMaxConcurrency(1);
        props.setJobTimeout(Duration.ofMillis(1_000));
        tasks.behavior = (payload, jobId) -> Thread.sleep(700L);

        CronJob a = service.addJob("a", Schedule.every(60_000L), Payload.taskRun("a"), null);
        CronJob b = service.addJob("b", Schedule.every(60_000L), Payload.taskRun("b"), null);

        assertEquals(2, service.runDue(T0.plusSeconds(60)).size());

        for (CronJob job : List.of(a, b)) {
            CronJob after = service.getJob(job.getId()).orElseThrow();
            assertEquals(RunStatus.SUCCESS, after.getState().getLastStatus(), after.getState().getLastError());
            assertNull(after.getState().getLastError());
        }
    }

    @Test
    void closedServiceShouldRejectRuns() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        service.close();

        assertThrows(IllegalStateException.class, () -> service.runDue(T0.plusSeconds(60)));
        assertThrows(IllegalStateException.class, () -> service.runJob(job.getId(), true));
        assertThrows(IllegalStateException.class, () -> service.start());
        assertTrue(tasks.calls.isEmpty());
    }

    @Test
    void missedRunsShouldCatchUpOnce() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);

        Instant late = T0.plus(Duration.ofMinutes(10));
        assertEquals(List.of(job.getId()), service.runDue(late));
        assertTrue(service.runDue(late).isEmpty());

        assertEquals(1, tasks.calls.size());
        assertEquals(late.toEpochMilli() + 60_000L,
                service.getJob(job.getId()).orElseThrow().getState().getNextRunAtMs());
    }

    @Test
    void disabledJobShouldNotFire() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        CronJob disabled = service.disableJob(job.getId());

        assertFalse(disabled.isEnabled());
        assertNull(disabled.getState().getNextRunAtMs());
        assertTrue(service.runDue(T0.plus(Duration.ofDays(1))).isEmpty());
        assertTrue(tasks.calls.isEmpty());
        assertTrue(service.listJobs(false).isEmpty());
        assertEquals(1, service.listJobs().size());
    }

    @Test
    void enablingShouldRecomputeFromNow() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        service.disableJob(job.getId());

        clock.advance(Duration.ofMinutes(5));
        CronJob enabled = service.enableJob(job.getId());

        assertTrue(enabled.isEnabled());
        assertEquals(T0_MS + 360_000L, enabled.getState().getNextRunAtMs());
    }

    @Test
    void atJobShouldRetireAfterRun() {
        CronJob job = service.addJob("once", Schedule.at(T0_MS + 1_000L), Payload.taskRun("once"), null);

        assertEquals(List.of(job.getId()), service.runDue(T0.plusSeconds(1)));
        assertTrue(service.runDue(T0.plusSeconds(3600)).isEmpty());

        CronJob after = service.getJob(job.getId()).orElseThrow();
        assertFalse(after.isEnabled());
        assertNull(after.getState().getNextRunAtMs());
        assertEquals(RunStatus.SUCCESS, after.getState().getLastStatus());
    }

    @Test
    void deleteAfterRunShouldRemoveOneShot() {
        CronJob job = service.create("once")
                .in(Duration.ofSeconds(30))
                .taskRun("once")
                .deleteAfterRun()
                .save();

        assertEquals(T0_MS + 30_000L, job.getState().getNextRunAtMs());
        service.runDue(T0.plusSeconds(30));

        assertTrue(service.getJob(job.getId()).isEmpty());
        assertEquals(1, tasks.calls.size());
    }

    @Test
    void elapsedAtShouldBeAcceptedButNeverFire() {
        CronJob job = service.addJob("past", Schedule.at(T0_MS - 1_000L), Payload.taskRun("past"), null);

        assertTrue(job.isEnabled());
        assertNull(job.getState().getNextRunAtMs());
        assertTrue(service.runDue(T0.plus(Duration.ofDays(365))).isEmpty());
    }

    @Test
    void updatingScheduleShouldRecomputeNextRun() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);

        clock.advance(Duration.ofMinutes(30));
        CronJob updated = service.updateJob(job.getId(), JobUpdate.builder()
                .schedule(Schedule.cron("0 9 * * *"))
                .timezone("Asia/Shanghai")
                .build());

        assertEquals(Instant.parse("2026-01-01T01:00:00Z").toEpochMilli(), updated.getState().getNextRunAtMs());
        assertEquals("Asia/Shanghai", updated.getTimezone());
        assertEquals(T0_MS + 1_800_000L, updated.getUpdatedAtMs());
        assertEquals(T0_MS, updated.getCreatedAtMs());
    }

    @Test
    void renamingShouldKeepNextRun() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        clock.advance(Duration.ofSeconds(30));

        CronJob updated = service.updateJob(job.getId(), JobUpdate.builder().name("renamed").build());

        assertEquals("renamed", updated.getName());
        assertEquals(job.getState().getNextRunAtMs(), updated.getState().getNextRunAtMs());
    }

    @Test
    void unknownIdShouldBeReported() {
        JobUpdate update = JobUpdate.builder().name("x").build();
        assertThrows(JobNotFoundException.class, () -> service.updateJob("nope", update));
        assertThrows(JobNotFoundException.class, () -> service.removeJob("nope"));
        assertThrows(JobNotFoundException.class, () -> service.enableJob("nope"));
        assertThrows(JobNotFoundException.class, () -> service.disableJob("nope"));
        assertThrows(JobNotFoundException.class, () -> service.runJob("nope", true));
        assertTrue(service.getJob("nope").isEmpty());
    }

    @Test
    void invalidInputShouldBeRejectedWithoutPersisting() {
        assertThrows(InvalidScheduleException.class,
                () -> service.addJob("bad", Schedule.cron("61 * * * *"), Payload.taskRun("t"), null));
        assertThrows(InvalidScheduleException.class,
                () -> service.addJob("bad", Schedule.every(0L), Payload.taskRun("t"), null));
        assertThrows(InvalidScheduleException.class,
                () -> service.addJob("bad", Schedule.every(1_000L), Payload.taskRun("t"), "Nowhere/City"));
        assertThrows(IllegalArgumentException.class,
                () -> service.addJob("bad", Schedule.every(1_000L), Payload.taskRun(" "), null));
        assertThrows(IllegalArgumentException.class,
                () -> service.addJob(" ", Schedule.every(1_000L), Payload.taskRun("t"), null));

        assertTrue(service.listJobs(true).isEmpty());
        assertFalse(Files.exists(storePath));
    }

    @Test
    void dueJobsShouldRunEarliestFirst() {
        CronJob slow = service.addJob("c", Schedule.every(30_000L), Payload.taskRun("c"), null);
        CronJob fast = service.addJob("a", Schedule.every(10_000L), Payload.taskRun("a"), null);
        CronJob mid = service.addJob("b", Schedule.every(20_000L), Payload.taskRun("b"), null);

        List<String> fired = service.runDue(T0.plusSeconds(60));

        assertEquals(List.of(fast.getId(), mid.getId(), slow.getId()), fired);
    }

    @Test
    void listShouldOrderByNextRunWithDisabledLast() {
        CronJob later = service.addJob("later", Schedule.every(120_000L), Payload.taskRun("l"), null);
        CronJob sooner = service.addJob("sooner", Schedule.every(60_000L), Payload.taskRun("s"), null);
        CronJob off = service.addJob("off", Schedule.every(1_000L), Payload.taskRun("o"), null);
        service.disableJob(off.getId());

        List<String> ids = service.listJobs(true).stream().map(CronJob::getId).toList();

        assertEquals(List.of(sooner.getId(), later.getId(), off.getId()), ids);
    }

    @Test
    void tickShouldSaveOnce() throws IOException {
        service.addJob("a", Schedule.every(1_000L), Payload.taskRun("a"), null);
        service.addJob("b", Schedule.every(1_000L), Payload.taskRun("b"), null);
        service.addJob("c", Schedule.every(1_000L), Payload.taskRun("c"), null);
        clearInvocations(store);

        assertEquals(3, service.runDue(T0.plusSeconds(1)).size());

        verify(store, times(1)).save(anyMap());
    }

    @Test
    void saveFailureDuringTickShouldKeepStateAndRetry() throws IOException {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        doThrow(new IOException("disk full")).when(store).save(anyMap());

        assertEquals(1, service.runDue(T0.plusSeconds(60)).size());
        assertTrue(service.runDue(T0.plusSeconds(60)).isEmpty());
        assertEquals(1, tasks.calls.size());
        assertEquals(1, service.getJob(job.getId()).orElseThrow().getState().getRunCount());

        doCallRealMethod().when(store).save(anyMap());
        service.runDue(T0.plusSeconds(61));

        CronJob persisted = new FileJobStore(storePath).load().get(job.getId());
        assertEquals(1, persisted.getState().getRunCount());
        assertEquals(T0_MS + 120_000L, persisted.getState().getNextRunAtMs());
    }

    @Test
    void saveFailureDuringCrudShouldNotPublish() throws IOException {
        doThrow(new IOException("read-only")).when(store).save(anyMap());

        assertThrows(UncheckedIOException.class,
                () -> service.addJob("a", Schedule.every(1_000L), Payload.taskRun("a"), null));
        assertTrue(service.listJobs(true).isEmpty());
    }

    @Test
    void jobsShouldSurviveRestart() {
        CronJob job = service.addJob("daily", Schedule.cron("0 9 * * *"), Payload.message("good morning"), "Asia/Shanghai");
        service.close();

        service = newService(new FileJobStore(storePath));
        CronJob reloaded = service.getJob(job.getId()).orElseThrow();

        assertEquals(job, reloaded);
    }

    @Test
    void handlerRemovingItsJobShouldDropOutcome() {
        tasks.behavior = (payload, jobId) -> service.removeJob(jobId);
        CronJob job = service.addJob("self", Schedule.every(1_000L), Payload.taskRun("self"), null);

        assertEquals(List.of(job.getId()), service.runDue(T0.plusSeconds(1)));
        assertTrue(service.getJob(job.getId()).isEmpty());
    }

    @Test
    void runJobShouldHonourForceForDisabledJobs() {
        CronJob job = service.addJob("sync", Schedule.every(60_000L), Payload.taskRun("sync"), null);
        service.disableJob(job.getId());

        assertFalse(service.runJob(job.getId(), false));
        assertTrue(tasks.calls.isEmpty());

        assertTrue(service.runJob(job.getId(), true));
        CronJob after = service.getJob(job.getId()).orElseThrow();
        assertEquals(1, tasks.calls.size());
        assertFalse(after.isEnabled());
        assertNull(after.getState().getNextRunAtMs());
        assertEquals(1, after.getState().getRunCount());
    }

    @Test
    void loadShouldMigrateInconsistentJobs() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, """
                {"version": 1, "jobs": {
                  "fresh": {"name": "fresh", "enabled": true,
                            "schedule": {"kind": "every", "every_ms": 5000},
                            "payload": {"kind": "task_run", "task_name": "t"}},
                  "off":   {"name": "off", "enabled": false,
                            "schedule": {"kind": "every", "every_ms": 5000},
                            "payload": {"kind": "task_run", "task_name": "t"},
                            "state": {"next_run_at_ms": 42}},
                  "broken": {"name": "broken", "enabled": true,
                            "schedule": {"kind": "cron", "expr": "not a cron"},
                            "payload": {"kind": "task_run", "task_name": "t"}}
                }}
                """, StandardCharsets.UTF_8);

        List<CronJob> jobs = service.listJobs(true);
        assertEquals(3, jobs.size());

        CronJob fresh = service.getJob("fresh").orElseThrow();
        assertEquals(T0_MS + 5_000L, fresh.getState().getNextRunAtMs());

        assertNull(service.getJob("off").orElseThrow().getState().getNextRunAtMs());

        CronJob broken = service.getJob("broken").orElseThrow();
        assertFalse(broken.isEnabled());
        assertNotNull(broken.getState().getLastError());
    }

    @Test
    void corruptStoreShouldBlockStartByDefault() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{{{", StandardCharsets.UTF_8);

        assertThrows(IllegalStateException.class, () -> service.start());
        assertFalse(service.status().running());
        assertTrue(Files.exists(storePath));
    }

    @Test
    void corruptStoreShouldBeMovedAsideWhenResetIsEnabled() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{{{", StandardCharsets.UTF_8);
        props.setResetCorruptStore(true);

        service.start();

        assertTrue(service.status().running());
        assertTrue(service.listJobs(true).isEmpty());
        try (Stream<Path> files = Files.list(storePath.getParent())) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("jobs.json.corrupt-")));
        }
    }

    @Test
    void invalidPropertiesShouldFailStart() {
        props.setTickInterval(Duration.ZERO);
        assertThrows(IllegalArgumentException.class, () -> service.start());

        props.setTickInterval(Duration.ofSeconds(1));
        props.setMaxConcurrency(0);
        assertThrows(IllegalArgumentException.class, () -> service.start());

        props.setMaxConcurrency(4);
        props.setDefaultTimezone("Not/AZone");
        assertThrows(IllegalArgumentException.class, () -> service.start());
    }

    @Test
    void tickerShouldDispatchDueJobsAfterStart() throws InterruptedException {
        props.setTickInterval(Duration.ofMillis(20));
        CountDownLatch ran = new CountDownLatch(1);
        tasks.behavior = (payload, jobId) -> ran.countDown();

        service.addJob("soon", Schedule.every(1_000L), Payload.taskRun("soon"), null);
        clock.advance(Duration.ofSeconds(1));
        service.start();

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertTrue(service.status().running());

        service.stop();
        assertFalse(service.status().running());
    }

    @Test
    void statusShouldSummariseJobs() {
        CronJob a = service.addJob("a", Schedule.every(60_000L), Payload.taskRun("a"), null);
        service.addJob("b", Schedule.every(120_000L), Payload.taskRun("b"), null);
        CronJob c = service.addJob("c", Schedule.every(1_000L), Payload.taskRun("c"), null);
        service.disableJob(c.getId());

        CronStatus status = service.status();

        assertFalse(status.running());
        assertEquals(3, status.jobs());
        assertEquals(2, status.enabledJobs());
        assertEquals(a.getState().getNextRunAtMs(), status.nextWakeAtMs());
    }

    interface Behavior {
        void run(Payload.TaskRun payload, String jobId) throws Exception;
    }

    static class ScriptedTaskHandler implements PayloadHandler<Payload.TaskRun> {
        final List<String> calls = new CopyOnWriteArrayList<>();
        volatile Behavior behavior = (payload, jobId) -> { };

        @Override
        public PayloadKind kind() {
            return PayloadKind.TASK_RUN;
        }

        @Override
        public Class<Payload.TaskRun> payloadClass() {
            return Payload.TaskRun.class;
        }

        @Override
        public void execute(Payload.TaskRun payload, String jobId) throws Exception {
            calls.add(jobId + ":" + payload.taskName());
            behavior.run(payload, jobId);
        }
    }
}
