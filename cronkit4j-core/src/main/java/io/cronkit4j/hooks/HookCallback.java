package io.cronkit4j.hooks;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Observer of scheduler lifecycle events.
 *
 * <p>Synchronous observers return a completed stage (see {@link #of(Consumer)}); observers that
 * do I/O may return a stage that completes later. Both are bounded by the registry's per-call
 * timeout.
 */
@FunctionalInterface
public interface HookCallback {

    CompletionStage<?> onEvent(HookEvent event) throws Exception;

    static HookCallback of(Consumer<HookEvent> consumer) {
        return event -> {
            consumer.accept(event);
            return CompletableFuture.completedFuture(null);
        };
    }
}
