package io.cronkit4j.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a job does when it fires. The scheduler never interprets the content; it only routes
 * the payload to the handler registered for its {@link PayloadKind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Payload.Message.class, name = "message"),
        @JsonSubTypes.Type(value = Payload.TaskRun.class, name = "task_run")
})
public sealed interface Payload permits Payload.Message, Payload.TaskRun {

    @JsonIgnore
    PayloadKind kind();

    static Message message(String message) {
        return new Message(message, false, null, null);
    }

    static TaskRun taskRun(String taskName) {
        return new TaskRun(taskName, Map.of());
    }

    /**
     * Free-text content. {@code deliver}, {@code channel} and {@code to} tell the handler
     * where to route the response; they may be empty.
     */
    record Message(String message, boolean deliver, String channel, String to) implements Payload {
        public Message {
            message = message == null ? "" : message;
        }

        @Override
        public PayloadKind kind() {
            return PayloadKind.MESSAGE;
        }
    }

    /**
     * A named task with optional arguments.
     */
    record TaskRun(String taskName, Map<String, Object> args) implements Payload {
        public TaskRun {
            taskName = taskName == null ? "" : taskName;
            args = (args == null || args.isEmpty())
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        }

        @Override
        public PayloadKind kind() {
            return PayloadKind.TASK_RUN;
        }
    }
}
