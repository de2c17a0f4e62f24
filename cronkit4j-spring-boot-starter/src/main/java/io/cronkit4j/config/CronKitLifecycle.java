package io.cronkit4j.config;

import io.cronkit4j.CronService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the cron ticker once the context is refreshed and stops it first on shutdown.
 *
 * <p>{@link CronService#stop()} waits for the tick in progress, so shutdown can take up to
 * {@code cronkit.job-timeout}.
 */
public class CronKitLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CronKitLifecycle.class);

    private final CronService cronService;
    private volatile boolean running = false;

    public CronKitLifecycle(CronService cronService) {
        this.cronService = cronService;
    }

    @Override
    public void start() {
        cronService.start();
        running = true;
    }

    @Override
    public void stop() {
        try {
            cronService.stop();
        } finally {
            running = false;
        }
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } catch (RuntimeException e) {
            log.error("cronkit lifecycle stop failed msg={}", e.getMessage(), e);
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running && cronService.status().running();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
