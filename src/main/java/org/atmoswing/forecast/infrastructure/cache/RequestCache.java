package org.atmoswing.forecast.infrastructure.cache;

import org.atmoswing.forecast.infrastructure.cache.l1.L1CaffeineCache;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Get-or-compute-and-store against L1 (Caffeine) and L2 (Redis).
 * <p>
 * Redis errors never reach the caller: they open the {@link CircuitBreaker} and the value is
 * computed directly. Failures of the computation propagate unchanged and are never cached.
 * An unreadable payload is treated as a miss and a result that cannot be serialized is simply
 * not stored in Redis.
 */
@ApplicationScoped
public class RequestCache {

    private static final Logger log = LoggerFactory.getLogger(RequestCache.class);

    @Inject
    CacheConfig config;

    @Inject
    L1CaffeineCache l1Cache;

    @Inject
    CacheBackend l2Cache;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    MeterRegistry registry;

    Clock clock = Clock.systemUTC();

    private CircuitBreaker breaker;

    @PostConstruct
    void init() {
        breaker = new CircuitBreaker(config.getBreakerFailureThreshold(),
                Duration.ofSeconds(config.getBreakerCooldownSeconds()), clock);
    }

    /**
     * Same as {@link #cachedCall(Cacheable, Duration, Class, Supplier)} with the configured TTL.
     */
    public <T> T cachedCall(Cacheable cacheable, Class<T> type, Supplier<T> compute) {
        return cachedCall(cacheable, Duration.ofSeconds(config.getTtlSeconds()), type, compute);
    }

    public <T> T cachedCall(Cacheable cacheable, Duration ttl, Class<T> type, Supplier<T> compute) {
        if (!config.isL1Enabled() && !config.isL2Enabled()) {
            return compute.get();
        }
        CacheKey key = CacheKey.of(cacheable);

        if (config.isL1Enabled()) {
            T cached = l1Cache.get(key, type);
            if (cached != null) {
                count("l1_hit");
                return cached;
            }
        }

        if (!config.isL2Enabled()) {
            return computeAndKeepLocal(key, compute, "miss");
        }
        if (!admitted(key)) {
            return computeAndKeepLocal(key, compute, "bypass");
        }

        String payload;
        try {
            payload = l2Cache.get(key.toL2Key());
            breaker.recordSuccess();
        } catch (CacheUnavailableException e) {
            log.warn("[Cache] Redis read failed for {}: {}", key, e.getMessage());
            breaker.recordFailure();
            return computeAndKeepLocal(key, compute, "bypass");
        }

        if (payload != null) {
            T cached = decode(key, payload, type);
            if (cached != null) {
                count("l2_hit");
                if (config.isL1Enabled()) {
                    l1Cache.put(key, cached);
                }
                return cached;
            }
        }

        count("miss");
        T result = compute.get();
        if (result != null) {
            if (config.isL1Enabled()) {
                l1Cache.put(key, result);
            }
            store(key, ttl, result);
        }
        return result;
    }

    CircuitBreaker breaker() {
        return breaker;
    }

    private boolean admitted(CacheKey key) {
        switch (breaker.acquire()) {
            case USE_CACHE:
                return true;
            case PROBE:
                try {
                    l2Cache.ping();
                    breaker.probeSucceeded();
                    return true;
                } catch (CacheUnavailableException e) {
                    log.warn("[Cache] Probe failed: {}", e.getMessage());
                    breaker.probeFailed();
                    return false;
                }
            default:
                log.debug("[Cache] Bypass: {}", key);
                return false;
        }
    }

    private <T> T computeAndKeepLocal(CacheKey key, Supplier<T> compute, String outcome) {
        count(outcome);
        T result = compute.get();
        if (result != null && config.isL1Enabled()) {
            l1Cache.put(key, result);
        }
        return result;
    }

    private <T> T decode(CacheKey key, String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            log.debug("[Cache] Unreadable payload for {}, treated as a miss: {}", key, e.getMessage());
            return null;
        }
    }

    private void store(CacheKey key, Duration ttl, Object result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.debug("[Cache] Result of {} not serializable, not cached: {}", key, e.getMessage());
            return;
        }
        try {
            l2Cache.setex(key.toL2Key(), ttl.toSeconds(), json);
        } catch (CacheUnavailableException e) {
            log.warn("[Cache] Redis write failed for {}: {}", key, e.getMessage());
            breaker.recordFailure();
        }
    }

    private void count(String result) {
        registry.counter("forecast.cache.requests", "result", result).increment();
    }
}
