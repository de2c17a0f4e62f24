package io.cronkit4j.internal;

import io.cronkit4j.config.CronProperties;
import io.cronkit4j.core.CronJob;
import io.cronkit4j.core.PayloadHandlerRegistry;
import io.cronkit4j.core.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs job payloads on a bounded worker pool and enforces the per-job timeout.
 * <p>
 * Not thread-safe; the cron service calls it while holding its tick lock.
 */
class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final CronProperties props;
    private final PayloadHandlerRegistry handlerRegistry;

    private ExecutorService workerPool;

    JobRunner(CronProperties props, PayloadHandlerRegistry handlerRegistry) {
        this.props = props;
        this.handlerRegistry = handlerRegistry;
    }

    record Run(CronJob job, Future<?> future, CountDownLatch started, AtomicLong startNanos, AtomicLong elapsedMs) {
    }

    record RunResult(RunStatus status, String error, long durationMs) {
        static RunResult success(long durationMs) {
            return new RunResult(RunStatus.SUCCESS, null, durationMs);
        }

        static RunResult failure(String error, long durationMs) {
            return new RunResult(RunStatus.FAILURE, error, durationMs);
        }
    }

    Run submit(CronJob job) {
        CountDownLatch started = new CountDownLatch(1);
        AtomicLong startNanos = new AtomicLong();
        AtomicLong elapsedMs = new AtomicLong(-1);

        Future<?> future = workerPool().submit(() -> {
            long t0 = System.nanoTime();
            startNanos.set(t0);
            started.countDown();
            log.debug("cronkit job started id={} name={} kind={}", job.getId(), job.getName(), job.getPayload().kind());
            try {
                handlerRegistry.execute(job.getPayload(), job.getId());
            } finally {
                elapsedMs.set(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
            }
            return null;
        });
        return new Run(job, future, started, startNanos, elapsedMs);
    }

    /**
     * Waits for the run to finish. The timeout counts from the moment a worker picks the job up,
     * so time spent queued behind other due jobs is not charged to it.
     */
    RunResult await(Run run) {
        CronJob job = run.job();
        long timeoutNanos = props.getJobTimeout().toNanos();
        long timeoutMs = props.getJobTimeout().toMillis();
        try {
            // every run queued ahead finishes or is cancelled within its own timeout
            if (!run.started().await(timeoutNanos, TimeUnit.NANOSECONDS)) {
                run.future().cancel(true);
                log.error("cronkit job never got a worker id={} name={} timeoutMs={}", job.getId(), job.getName(), timeoutMs);
                return RunResult.failure("no free worker within " + timeoutMs + " ms", 0L);
            }
            long remaining = timeoutNanos - (System.nanoTime() - run.startNanos().get());
            run.future().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            log.debug("cronkit job succeeded id={} name={} durationMs={}", job.getId(), job.getName(), elapsed(run));
            return RunResult.success(elapsed(run));
        } catch (TimeoutException e) {
            run.future().cancel(true);
            log.error("cronkit job timed out id={} name={} timeoutMs={}", job.getId(), job.getName(), timeoutMs);
            return RunResult.failure("timed out after " + timeoutMs + " ms", timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("cronkit job failed id={} name={} msg={}", job.getId(), job.getName(), cause.getMessage(), cause);
            return RunResult.failure(describe(cause), elapsed(run));
        } catch (CancellationException e) {
            log.error("cronkit job cancelled id={} name={}", job.getId(), job.getName());
            return RunResult.failure("cancelled", elapsed(run));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.future().cancel(true);
            log.error("cronkit job interrupted while awaiting id={} name={}", job.getId(), job.getName());
            return RunResult.failure("interrupted", elapsed(run));
        }
    }

    void shutdown() {
        if (workerPool == null) {
            return;
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(props.getJobTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        } finally {
            workerPool = null;
        }
    }

    private ExecutorService workerPool() {
        if (workerPool == null) {
            props.validate();
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("cronkit.worker");
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    private static long elapsed(Run run) {
        long ms = run.elapsedMs().get();
        if (ms >= 0) {
            return ms;
        }
        return run.started().getCount() == 0
                ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - run.startNanos().get())
                : 0L;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }
}
