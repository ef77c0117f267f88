package org.atmoswing.forecast.infrastructure.cache.warm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * A held lock file. Closing it deletes the file.
 */
public record LockHandle(Path path, long ownerPid, Instant acquiredAt) implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LockHandle.class);

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("[Warm Cache] Failed to release lock {}: {}", path, e.getMessage());
        }
    }
}
