package io.cronkit4j.hooks;

/**
 * Event names raised by the cron service.
 */
public final class HookEvents {
    private HookEvents() {
    }

    public static final String BEFORE_RUN = "before_run";
    public static final String AFTER_RUN = "after_run";
    public static final String RUN_FAILED = "run_failed";
}
