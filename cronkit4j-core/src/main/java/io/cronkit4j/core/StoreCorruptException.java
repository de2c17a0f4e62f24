package io.cronkit4j.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The persisted job set exists but cannot be read back. Callers decide whether to abort or to
 * start from an empty set; the store never discards the data on its own.
 */
public class StoreCorruptException extends IOException {

    private final Path path;

    public StoreCorruptException(Path path, Throwable cause) {
        super("Job store is corrupt: " + path + " (" + (cause == null ? "unknown" : cause.getMessage()) + ")", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
