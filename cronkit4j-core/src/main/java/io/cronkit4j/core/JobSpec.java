package io.cronkit4j.core;

/**
 * Immutable job definition produced by {@link io.cronkit4j.JobBuilder#build()}.
 * This is a pure data object with no persistence logic; the cron service assigns the id and
 * computes the initial run time when it is added.
 */
public record JobSpec(

        String name,

        // scheduling
        Schedule schedule,
        String timezone,
        boolean deleteAfterRun,

        // payload
        Payload payload
) {
}
