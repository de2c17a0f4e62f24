package io.cronkit4j.config;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the cron service.
 */
@ConfigurationProperties(prefix = "cronkit")
public class CronProperties {
    private String defaultTimezone; // IANA id; null means system default
    private Path storePath = Path.of("cron", "jobs.json");
    private Duration tickInterval = Duration.ofSeconds(1);
    private Duration jobTimeout = Duration.ofMinutes(10);
    private Duration hookTimeout = Duration.ofMillis(200);
    private int maxConcurrency = 4;
    private boolean resetCorruptStore = false;

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    /**
     * Resolved default zone.
     *
     * @throws IllegalArgumentException when {@code defaultTimezone} is not a valid zone id
     */
    public ZoneId defaultZone() {
        if (defaultTimezone == null || defaultTimezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(defaultTimezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("cronkit.defaultTimezone is not a valid zone id: " + defaultTimezone, e);
        }
    }

    /**
     * Fails fast on settings the service cannot run with.
     */
    public void validate() {
        requirePositive(tickInterval, "cronkit.tickInterval");
        requirePositive(jobTimeout, "cronkit.jobTimeout");
        requirePositive(hookTimeout, "cronkit.hookTimeout");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("cronkit.maxConcurrency must be a positive number");
        }
        defaultZone();
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public Path getStorePath() {
        return storePath;
    }

    public void setStorePath(Path storePath) {
        this.storePath = storePath;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getHookTimeout() {
        return hookTimeout;
    }

    public void setHookTimeout(Duration hookTimeout) {
        this.hookTimeout = hookTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public boolean isResetCorruptStore() {
        return resetCorruptStore;
    }

    public void setResetCorruptStore(boolean resetCorruptStore) {
        this.resetCorruptStore = resetCorruptStore;
    }
}
