package io.cronkit4j.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of payload kinds. Each kind is handled by exactly one
 * {@link io.cronkit4j.PayloadHandler}.
 */
public enum PayloadKind {
    MESSAGE("message", Payload.Message.class),
    TASK_RUN("task_run", Payload.TaskRun.class);

    private final String key;
    private final Class<? extends Payload> payloadClass;

    PayloadKind(String key, Class<? extends Payload> payloadClass) {
        this.key = key;
        this.payloadClass = payloadClass;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Class<? extends Payload> payloadClass() {
        return payloadClass;
    }
}
