package org.atmoswing.forecast.infrastructure.cache.warm;

import java.nio.file.Path;

/**
 * Another writer held the lock of a warm cache entry for longer than the timeout.
 */
public class LockBusyException extends RuntimeException {

    private final Path lockPath;

    public LockBusyException(Path lockPath, String message) {
        super(message);
        this.lockPath = lockPath;
    }

    public Path getLockPath() {
        return lockPath;
    }
}
