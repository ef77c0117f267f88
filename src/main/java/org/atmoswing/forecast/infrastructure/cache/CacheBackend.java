package org.atmoswing.forecast.infrastructure.cache;

/**
 * External key-value store behind {@link RequestCache}.
 * Every operation throws {@link CacheUnavailableException} when the service misbehaves.
 */
public interface CacheBackend {

    /**
     * @return the stored payload, or null on a miss
     */
    String get(String key);

    void setex(String key, long ttlSeconds, String payload);

    void ping();
}
