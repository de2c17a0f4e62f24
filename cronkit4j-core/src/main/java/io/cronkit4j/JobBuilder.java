package io.cronkit4j;

import io.cronkit4j.core.CronJob;
import io.cronkit4j.core.JobSpec;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Fluent builder for configuring a job before adding it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + add to the cron service</li>
 * </ul>
 * Exactly one schedule method and one payload method must be called.
 */
public interface JobBuilder {

    /**
     * Run once at an absolute time.
     */
    JobBuilder at(Instant time);

    /**
     * Run once after a delay from now.
     */
    JobBuilder in(Duration delay);

    JobBuilder every(Duration interval);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "30s") or plain seconds ("90").
     */
    JobBuilder every(String interval);

    /**
     * Five- or six-field cron expression, evaluated in the job timezone.
     */
    JobBuilder cron(String expression);

    /**
     * IANA time zone id (e.g. "Asia/Shanghai"); without it the service default applies.
     */
    JobBuilder timezone(String timezone);

    JobBuilder message(String message);

    JobBuilder message(String message, String channel, String to);

    JobBuilder taskRun(String taskName);

    JobBuilder taskRun(String taskName, Map<String, Object> args);

    /**
     * Remove a one-shot job from the store after it has run instead of retiring it.
     */
    JobBuilder deleteAfterRun();

    JobSpec build();

    CronJob save();
}
