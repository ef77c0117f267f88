package org.atmoswing.forecast.infrastructure.cache;

/**
 * The external cache service failed or could not be reached.
 * Never surfaced to callers of {@link RequestCache}.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
