package io.cronkit4j;

import io.cronkit4j.core.Payload;
import io.cronkit4j.core.PayloadKind;

/**
 * Host-supplied executor for one payload kind. Throwing marks the run as failed; the scheduler
 * does not retry beyond the job's normal schedule.
 *
 * <p>Handlers run on a worker thread and are interrupted when they exceed the job timeout.
 */
public interface PayloadHandler<P extends Payload> {
    PayloadKind kind();

    Class<P> payloadClass();

    void execute(P payload, String jobId) throws Exception;
}
