package io.cronkit4j.internal.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.cronkit4j.core.CronJob;
import io.cronkit4j.core.JobStore;
import io.cronkit4j.core.StoreCorruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * JSON file persistence for jobs.
 *
 * <p>File layout: {@code {"version": 1, "jobs": {"<id>": {...job...}}}} with snake_case field
 * names. Unknown fields are ignored on read and absent fields keep the model defaults. The map key
 * is authoritative for the job id.
 *
 * <p>{@link #save(Map)} writes a temp file in the same directory, forces it to disk and renames
 * it over the backing file, so a crash leaves either the old or the new set under the final name.
 */
public class FileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    static final int FORMAT_VERSION = 1;

    private final Path path;
    private final ObjectMapper objectMapper;

    public FileJobStore(Path path) {
        this(path, defaultObjectMapper());
    }

    public FileJobStore(Path path, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    public Path path() {
        return path;
    }

    @Override
    public Map<String, CronJob> load() throws IOException {
        if (!Files.exists(path)) {
            log.debug("cronkit store missing; starting empty path={}", path);
            return new LinkedHashMap<>();
        }

        StoreFile file;
        try {
            file = objectMapper.readValue(path.toFile(), StoreFile.class);
        } catch (JsonProcessingException e) {
            throw new StoreCorruptException(path, e);
        }
        if (file == null) {
            throw new StoreCorruptException(path, new IOException("document is null"));
        }
        if (file.version() > FORMAT_VERSION) {
            log.warn("cronkit store written by a newer format version={} supported={} path={}",
                    file.version(), FORMAT_VERSION, path);
        }

        Map<String, CronJob> jobs = new LinkedHashMap<>();
        if (file.jobs() != null) {
            for (var e : file.jobs().entrySet()) {
                CronJob job = e.getValue();
                if (job == null) {
                    throw new StoreCorruptException(path, new IOException("null record for id " + e.getKey()));
                }
                job.setId(e.getKey());
                jobs.put(e.getKey(), job);
            }
        }
        log.debug("cronkit store loaded path={} jobs={}", path, jobs.size());
        return jobs;
    }

    @Override
    public void save(Map<String, CronJob> jobs) throws IOException {
        Objects.requireNonNull(jobs, "jobs must not be null");

        byte[] bytes = objectMapper.writeValueAsBytes(new StoreFile(FORMAT_VERSION, new TreeMap<>(jobs)));

        Path dir = path.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, path.getFileName().toString() + ".", ".tmp");
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("cronkit store atomic rename unsupported; falling back to plain replace path={}", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("cronkit store saved path={} jobs={} bytes={}", path, jobs.size(), bytes.length);
    }

    /**
     * Renames the backing file to {@code <name>.corrupt-<epochMs>}.
     */
    @Override
    public void quarantine() throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Path target = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
        Files.move(path, target);
        log.warn("cronkit store moved aside path={} target={}", path, target);
    }

    record StoreFile(int version, Map<String, CronJob> jobs) {
    }
}
