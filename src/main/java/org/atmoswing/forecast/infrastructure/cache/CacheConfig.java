package org.atmoswing.forecast.infrastructure.cache;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request cache settings (L1 Caffeine, L2 Redis, circuit breaker).
 */
@ApplicationScoped
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @ConfigProperty(name = "forecast.cache.ttl-seconds", defaultValue = "3600")
    long ttlSeconds;

    // L1 Caffeine
    @ConfigProperty(name = "forecast.cache.l1.enabled", defaultValue = "true")
    boolean l1Enabled;

    @ConfigProperty(name = "forecast.cache.l1.ttl-seconds", defaultValue = "5")
    int l1TtlSeconds;

    @ConfigProperty(name = "forecast.cache.l1.max-size", defaultValue = "1000")
    int l1MaxSize;

    // L2 Redis
    @ConfigProperty(name = "forecast.cache.l2.enabled", defaultValue = "true")
    boolean l2Enabled;

    @ConfigProperty(name = "forecast.cache.breaker.failure-threshold", defaultValue = "1")
    int breakerFailureThreshold;

    @ConfigProperty(name = "forecast.cache.breaker.cooldown-seconds", defaultValue = "30")
    int breakerCooldownSeconds;

    @PostConstruct
    void init() {
        log.info("=== Cache Configuration ===");
        log.info("TTL:           {}s", ttlSeconds);
        log.info("L1 (Caffeine): {} (TTL: {}s, MaxSize: {})",
                l1Enabled ? "ENABLED" : "DISABLED", l1TtlSeconds, l1MaxSize);
        log.info("L2 (Redis):    {} (breaker: {} failure(s), cooldown {}s)",
                l2Enabled ? "ENABLED" : "DISABLED", breakerFailureThreshold, breakerCooldownSeconds);
        log.info("===========================");
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public boolean isL1Enabled() {
        return l1Enabled;
    }

    public int getL1TtlSeconds() {
        return l1TtlSeconds;
    }

    public int getL1MaxSize() {
        return l1MaxSize;
    }

    public boolean isL2Enabled() {
        return l2Enabled;
    }

    public int getBreakerFailureThreshold() {
        return breakerFailureThreshold;
    }

    public int getBreakerCooldownSeconds() {
        return breakerCooldownSeconds;
    }
}
