package org.atmoswing.forecast.infrastructure.cache.warm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;

/**
 * Cross-process lock based on exclusive file creation. The lock file holds the pid of its owner.
 * <p>
 * Waiting is done by polling every {@code retryInterval}, so the effective wait may exceed the
 * timeout by up to one interval. A lock file left behind by a crashed process is not reclaimed.
 */
public class AdvisoryFileLock {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryFileLock.class);

    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofMillis(100);

    private final Duration timeout;
    private final Duration retryInterval;

    public AdvisoryFileLock(Duration timeout) {
        this(timeout, DEFAULT_RETRY_INTERVAL);
    }

    public AdvisoryFileLock(Duration timeout, Duration retryInterval) {
        this.timeout = timeout;
        this.retryInterval = retryInterval;
    }

    /**
     * @throws LockBusyException when the lock could not be taken within the timeout
     */
    public LockHandle acquire(Path lockPath) {
        long pid = ProcessHandle.current().pid();
        byte[] content = Long.toString(pid).getBytes(StandardCharsets.UTF_8);
        Instant deadline = Instant.now().plus(timeout);

        while (true) {
            try {
                Files.write(lockPath, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.debug("[Warm Cache] Lock acquired: {}", lockPath);
                return new LockHandle(lockPath, pid, Instant.now());
            } catch (FileAlreadyExistsException e) {
                if (!Instant.now().isBefore(deadline)) {
                    throw new LockBusyException(lockPath, "Lock busy: " + lockPath);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create lock " + lockPath, e);
            }
            try {
                Thread.sleep(retryInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockBusyException(lockPath, "Interrupted while waiting for " + lockPath);
            }
        }
    }
}
