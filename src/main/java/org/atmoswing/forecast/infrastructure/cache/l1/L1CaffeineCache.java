package org.atmoswing.forecast.infrastructure.cache.l1;

import org.atmoswing.forecast.infrastructure.cache.CacheConfig;
import org.atmoswing.forecast.infrastructure.cache.CacheKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * In-process cache in front of Redis, short TTL and bounded size. Hit/miss/eviction
 * statistics are exported as {@code cache.*} meters tagged {@code cache=forecast.l1}.
 */
@ApplicationScoped
public class L1CaffeineCache {

    private static final Logger log = LoggerFactory.getLogger(L1CaffeineCache.class);

    static final String CACHE_NAME = "forecast.l1";

    @Inject
    CacheConfig config;

    @Inject
    MeterRegistry registry;

    private Cache<String, Object> cache;

    @PostConstruct
    void init() {
        cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getL1TtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(config.getL1MaxSize())
                .recordStats()
                .build();
        CaffeineCacheMetrics.monitor(registry, cache, CACHE_NAME);

        log.info("[L1 Cache] Initialized with TTL={}s, MaxSize={}",
                config.getL1TtlSeconds(), config.getL1MaxSize());
    }

    /**
     * @return the cached value, or null on a miss or when the cached value has another type
     */
    public <T> T get(CacheKey key, Class<T> type) {
        Object value = cache.getIfPresent(key.toL1Key());
        if (type.isInstance(value)) {
            log.debug("[L1 Cache] Hit: {}", key);
            return type.cast(value);
        }
        log.debug("[L1 Cache] Miss: {}", key);
        return null;
    }

    public void put(CacheKey key, Object value) {
        cache.put(key.toL1Key(), value);
        log.debug("[L1 Cache] Put: {}", key);
    }
}
