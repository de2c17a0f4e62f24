package io.cronkit4j.core;

import java.io.IOException;
import java.util.Map;

/**
 * Durable mapping from job id to job record. No scheduling logic lives here.
 */
public interface JobStore {

    /**
     * Reads the full job set. A store that was never written yields an empty map.
     *
     * @throws StoreCorruptException when the backing data exists but cannot be parsed
     */
    Map<String, CronJob> load() throws IOException;

    /**
     * Replaces the stored job set. Either the complete new set becomes visible or the old one
     * stays in place.
     */
    void save(Map<String, CronJob> jobs) throws IOException;

    /**
     * Moves unreadable data out of the way so the next {@link #save(Map)} starts a fresh set.
     * The data is kept, never deleted.
     */
    default void quarantine() throws IOException {
        throw new IOException(getClass().getSimpleName() + " does not support quarantining corrupt data");
    }
}
