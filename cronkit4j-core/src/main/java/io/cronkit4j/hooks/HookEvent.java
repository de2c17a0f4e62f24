package io.cronkit4j.hooks;

import io.cronkit4j.core.PayloadKind;
import io.cronkit4j.core.RunStatus;

/**
 * Read-only description of a lifecycle event. Observers never see the job record itself.
 *
 * @param event       event name, see {@link HookEvents}
 * @param jobId       job identifier
 * @param timestampMs tick time the event belongs to
 * @param name        job name
 * @param payloadKind kind of the job's payload
 * @param outcome     run result; null for {@link HookEvents#BEFORE_RUN}
 */
public record HookEvent(
        String event,
        String jobId,
        long timestampMs,
        String name,
        PayloadKind payloadKind,
        Outcome outcome
) {

    public record Outcome(RunStatus status, String error, long durationMs) {
    }
}
