package io.cronkit4j.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event name to observer callbacks, owned by one cron service.
 *
 * <p>{@link #trigger(String, HookEvent)} never throws. Callbacks run one after another in
 * registration order, each on the registry's own threads and bounded by {@code timeout}; a callback
 * that fails or overruns is logged, counted and skipped.
 */
public class HookRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    private final Map<String, List<HookCallback>> hooks = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final ExecutorService hookPool;
    private final AtomicLong failures = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HookRegistry(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("hook timeout must be a positive duration");
        }
        this.hookPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("cronkit.hook");
            t.setDaemon(true);
            return t;
        });
    }

    public void register(String event, HookCallback callback) {
        register(new HookRegistration(event, callback));
    }

    public void register(HookRegistration registration) {
        Objects.requireNonNull(registration, "registration must not be null");
        hooks.computeIfAbsent(registration.event(), e -> new CopyOnWriteArrayList<>())
                .add(registration.callback());
    }

    public int count(String event) {
        List<HookCallback> callbacks = hooks.get(event);
        return callbacks == null ? 0 : callbacks.size();
    }

    /**
     * Number of callback invocations that failed or timed out since creation.
     */
    public long failureCount() {
        return failures.get();
    }

    public Duration timeout() {
        return timeout;
    }

    public void trigger(String event, HookEvent payload) {
        List<HookCallback> callbacks = hooks.get(event);
        if (callbacks == null || callbacks.isEmpty()) {
            return;
        }
        if (closed.get()) {
            log.debug("cronkit hook registry closed; dropping event={}", event);
            return;
        }

        for (HookCallback callback : callbacks) {
            if (!invokeBounded(event, callback, payload)) {
                break;
            }
        }
    }

    // Returns false when the calling thread was interrupted and dispatch should stop.
    private boolean invokeBounded(String event, HookCallback callback, HookEvent payload) {
        CompletableFuture<Object> done = new CompletableFuture<>();
        AtomicReference<CompletionStage<?>> pending = new AtomicReference<>();

        Future<?> task;
        try {
            task = hookPool.submit(() -> {
                try {
                    CompletionStage<?> stage = callback.onEvent(payload);
                    if (stage == null) {
                        done.complete(null);
                        return;
                    }
                    pending.set(stage);
                    stage.whenComplete((result, error) -> {
                        if (error != null) {
                            done.completeExceptionally(error);
                        } else {
                            done.complete(result);
                        }
                    });
                } catch (Throwable t) {
                    done.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            failures.incrementAndGet();
            log.warn("cronkit hook rejected event={} msg={}", event, e.getMessage());
            return true;
        }

        try {
            done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            failures.incrementAndGet();
            task.cancel(true);
            cancelQuietly(pending.get());
            log.warn("cronkit hook timed out event={} jobId={} timeoutMs={}", event, payload.jobId(), timeout.toMillis());
        } catch (ExecutionException e) {
            failures.incrementAndGet();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("cronkit hook failed event={} jobId={} msg={}", event, payload.jobId(), cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            log.warn("cronkit hook dispatch interrupted event={} jobId={}", event, payload.jobId());
            return false;
        }
        return true;
    }

    private static void cancelQuietly(CompletionStage<?> stage) {
        if (stage == null) {
            return;
        }
        try {
            stage.toCompletableFuture().cancel(true);
        } catch (UnsupportedOperationException e) {
            log.debug("cronkit hook stage does not support cancellation type={}", stage.getClass().getName());
        }
    }

    /**
     * Stops accepting events and interrupts callbacks still running.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        hookPool.shutdownNow();
    }
}
