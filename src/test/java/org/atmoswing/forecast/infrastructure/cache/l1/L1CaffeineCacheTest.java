package org.atmoswing.forecast.infrastructure.cache.l1;

import org.atmoswing.forecast.infrastructure.cache.CacheConfig;
import org.atmoswing.forecast.infrastructure.cache.CacheKey;
import org.atmoswing.forecast.infrastructure.cache.Cacheable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

public class L1CaffeineCacheTest {

    private final CacheKey key = CacheKey.of(Cacheable.of("list_methods", "region", "alpes"));

    private L1CaffeineCache cache;
    private SimpleMeterRegistry registry;

    @BeforeEach
    public void setUp() {
        CacheConfig config = Mockito.mock(CacheConfig.class);
        when(config.getL1TtlSeconds()).thenReturn(60);
        when(config.getL1MaxSize()).thenReturn(100);
        registry = new SimpleMeterRegistry();
        cache = new L1CaffeineCache();
        cache.config = config;
        cache.registry = registry;
        cache.init();
    }

    @Test
    public void testPutAndGet() {
        cache.put(key, List.of("4Zo"));

        assertEquals(List.of("4Zo"), cache.get(key, List.class));
        assertNull(cache.get(CacheKey.of(Cacheable.of("list_methods", "region", "jura")), List.class));
    }

    @Test
    public void testStatisticsExported() {
        cache.put(key, List.of("4Zo"));
        cache.get(key, List.class);
        cache.get(CacheKey.of(Cacheable.of("list_methods", "region", "jura")), List.class);

        assertEquals(1.0, hits("hit"));
        assertEquals(1.0, hits("miss"));
        assertEquals(1.0, registry.get("cache.size").tag("cache", L1CaffeineCache.CACHE_NAME).gauge().value());
    }

    private double hits(String result) {
        return registry.get("cache.gets")
                .tag("cache", L1CaffeineCache.CACHE_NAME)
                .tag("result", result)
                .functionCounter()
                .count();
    }

    @Test
    public void testWrongTypeIsAMiss() {
        cache.put(key, "text");

        assertNull(cache.get(key, Integer.class));
    }
}
