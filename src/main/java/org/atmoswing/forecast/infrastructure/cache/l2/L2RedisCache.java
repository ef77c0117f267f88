package org.atmoswing.forecast.infrastructure.cache.l2;

import org.atmoswing.forecast.infrastructure.cache.CacheBackend;
import org.atmoswing.forecast.infrastructure.cache.CacheUnavailableException;
import io.quarkus.redis.datasource.RedisDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redis shared cache. Payloads are JSON strings stored with SETEX.
 */
@ApplicationScoped
public class L2RedisCache implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(L2RedisCache.class);

    @Inject
    RedisDataSource redis;

    @Override
    public String get(String key) {
        try {
            String value = redis.value(String.class).get(key);
            log.debug("[L2 Cache] {}: {}", value != null ? "Hit" : "Miss", key);
            return value;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("GET failed for key " + key, e);
        }
    }

    @Override
    public void setex(String key, long ttlSeconds, String payload) {
        try {
            redis.value(String.class).setex(key, ttlSeconds, payload);
            log.debug("[L2 Cache] Put: {} (ttl {}s)", key, ttlSeconds);
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("SETEX failed for key " + key, e);
        }
    }

    @Override
    public void ping() {
        try {
            redis.execute("PING");
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("PING failed", e);
        }
    }
}
