package io.cronkit4j.core;

import io.cronkit4j.PayloadHandler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class PayloadHandlerRegistry {

    private final Map<PayloadKind, PayloadHandler<?>> handlersByKind;

    public PayloadHandlerRegistry(List<PayloadHandler<?>> handlers) {
        Map<PayloadKind, PayloadHandler<?>> byKind = new EnumMap<>(PayloadKind.class);
        for (PayloadHandler<?> handler : handlers) {
            PayloadKind kind = handler.kind();
            if (!kind.payloadClass().equals(handler.payloadClass())) {
                throw new IllegalStateException("PayloadHandler for " + kind.key()
                        + " must accept " + kind.payloadClass().getSimpleName()
                        + " but declares " + handler.payloadClass().getSimpleName());
            }
            if (byKind.putIfAbsent(kind, handler) != null) {
                throw new IllegalStateException("Duplicate PayloadHandler for kind: " + kind.key());
            }
        }
        this.handlersByKind = Collections.unmodifiableMap(byKind);
    }

    public boolean supports(PayloadKind kind) {
        return handlersByKind.containsKey(kind);
    }

    public PayloadHandler<?> getRequired(PayloadKind kind) {
        PayloadHandler<?> handler = handlersByKind.get(kind);
        if (handler == null) {
            throw new IllegalStateException("No PayloadHandler registered for kind: " + kind.key());
        }
        return handler;
    }

    /**
     * Routes a payload to the handler registered for its kind.
     */
    public void execute(Payload payload, String jobId) throws Exception {
        PayloadHandler<?> handler = getRequired(payload.kind());
        invoke(handler, payload, jobId);
    }

    private static <P extends Payload> void invoke(PayloadHandler<P> handler, Payload payload, String jobId) throws Exception {
        handler.execute(handler.payloadClass().cast(payload), jobId);
    }
}
