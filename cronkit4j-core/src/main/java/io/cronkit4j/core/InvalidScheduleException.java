package io.cronkit4j.core;

/**
 * Rejected schedule input: unparseable cron expression, non-positive interval or timestamp,
 * unknown time zone.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
