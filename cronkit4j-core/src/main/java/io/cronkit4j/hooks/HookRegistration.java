package io.cronkit4j.hooks;

import java.util.Objects;

/**
 * Event name plus callback, for containers that collect hooks as beans.
 */
public record HookRegistration(String event, HookCallback callback) {
    public HookRegistration {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        if (event.isBlank()) {
            throw new IllegalArgumentException("event must not be blank");
        }
    }
}
