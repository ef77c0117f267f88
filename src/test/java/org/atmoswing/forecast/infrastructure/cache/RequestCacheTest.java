package org.atmoswing.forecast.infrastructure.cache;

import org.atmoswing.forecast.infrastructure.cache.l1.L1CaffeineCache;
import org.atmoswing.forecast.testing.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RequestCacheTest {

    public record Result(String name, int value) {
    }

    private static final Cacheable CACHEABLE = Cacheable.of("list_methods", "region", "alpes");
    private static final String L2_KEY = CacheKey.of(CACHEABLE).toL2Key();

    private final MutableClock clock = new MutableClock(Instant.parse("2024-10-05T00:00:00Z"));
    private final AtomicInteger computed = new AtomicInteger();

    private CacheBackend backend;
    private L1CaffeineCache l1;
    private SimpleMeterRegistry registry;
    private RequestCache cache;

    @BeforeEach
    public void setUp() {
        CacheConfig config = new CacheConfig();
        config.ttlSeconds = 3600;
        config.l1Enabled = false;
        config.l2Enabled = true;
        config.breakerFailureThreshold = 1;
        config.breakerCooldownSeconds = 30;

        backend = Mockito.mock(CacheBackend.class);
        l1 = Mockito.mock(L1CaffeineCache.class);
        registry = new SimpleMeterRegistry();

        cache = new RequestCache();
        cache.config = config;
        cache.l1Cache = l1;
        cache.l2Cache = backend;
        cache.objectMapper = new ObjectMapper();
        cache.registry = registry;
        cache.clock = clock;
        cache.init();
    }

    private Result call() {
        return cache.cachedCall(CACHEABLE, Result.class, () -> {
            computed.incrementAndGet();
            return new Result("4Zo", 42);
        });
    }

    private double count(String result) {
        return registry.counter("forecast.cache.requests", "result", result).count();
    }

    @Test
    public void testMissComputesAndStores() {
        Result result = call();

        assertEquals(new Result("4Zo", 42), result);
        assertEquals(1, computed.get());
        verify(backend).setex(L2_KEY, 3600L, "{\"name\":\"4Zo\",\"value\":42}");
        assertEquals(1.0, count("miss"));
    }

    @Test
    public void testCustomTtl() {
        cache.cachedCall(CACHEABLE, Duration.ofSeconds(60), Result.class, () -> new Result("x", 1));

        verify(backend).setex(eq(L2_KEY), eq(60L), anyString());
    }

    @Test
    public void testHitSkipsComputation() {
        when(backend.get(L2_KEY)).thenReturn("{\"name\":\"cached\",\"value\":7}");

        Result result = call();

        assertEquals(new Result("cached", 7), result);
        assertEquals(0, computed.get());
        verify(backend, never()).setex(anyString(), anyLong(), anyString());
        assertEquals(1.0, count("l2_hit"));
    }

    @Test
    public void testHitIsKeptLocallyWhenL1Enabled() {
        cache.config.l1Enabled = true;
        when(backend.get(L2_KEY)).thenReturn("{\"name\":\"cached\",\"value\":7}");

        call();

        verify(l1).put(CacheKey.of(CACHEABLE), new Result("cached", 7));
    }

    @Test
    public void testLocalHitSkipsRedis() {
        cache.config.l1Enabled = true;
        when(l1.get(CacheKey.of(CACHEABLE), Result.class)).thenReturn(new Result("local", 1));

        Result result = call();

        assertEquals(new Result("local", 1), result);
        verifyNoInteractions(backend);
        assertEquals(1.0, count("l1_hit"));
    }

    @Test
    public void testUnreadablePayloadIsAMiss() {
        when(backend.get(L2_KEY)).thenReturn("not json");

        Result result = call();

        assertEquals(new Result("4Zo", 42), result);
        assertEquals(1, computed.get());
        verify(backend).setex(eq(L2_KEY), eq(3600L), anyString());
    }

    @Test
    public void testRedisFailureOpensBreakerAndBypasses() {
        when(backend.get(anyString())).thenThrow(new CacheUnavailableException("down", null));

        assertEquals(new Result("4Zo", 42), call());
        assertEquals(CircuitBreaker.State.OPEN, cache.breaker().state());

        assertEquals(new Result("4Zo", 42), call());

        assertEquals(2, computed.get());
        verify(backend, times(1)).get(anyString());
        assertEquals(2.0, count("bypass"));
    }

    @Test
    public void testWriteFailureOpensBreaker() {
        doThrow(new CacheUnavailableException("down", null)).when(backend).setex(anyString(), anyLong(), anyString());

        assertEquals(new Result("4Zo", 42), call());

        assertEquals(CircuitBreaker.State.OPEN, cache.breaker().state());
    }

    @Test
    public void testSuccessfulProbeClosesBreaker() {
        when(backend.get(anyString())).thenThrow(new CacheUnavailableException("down", null)).thenReturn(null);
        call();

        clock.advance(Duration.ofSeconds(30));
        call();

        verify(backend).ping();
        verify(backend, times(2)).get(L2_KEY);
        assertEquals(CircuitBreaker.State.CLOSED, cache.breaker().state());
    }

    @Test
    public void testFailedProbeKeepsBypassing() {
        when(backend.get(anyString())).thenThrow(new CacheUnavailableException("down", null));
        doThrow(new CacheUnavailableException("still down", null)).when(backend).ping();
        call();

        clock.advance(Duration.ofSeconds(30));
        call();

        verify(backend, times(1)).get(anyString());
        assertEquals(CircuitBreaker.State.OPEN, cache.breaker().state());
        assertEquals(2, computed.get());
    }

    @Test
    public void testComputationFailurePropagatesAndIsNotCached() {
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> cache.cachedCall(CACHEABLE, Result.class, () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        verify(backend, never()).setex(anyString(), anyLong(), anyString());
    }

    @Test
    public void testNullResultNotStored() {
        assertNull(cache.cachedCall(CACHEABLE, Result.class, () -> null));

        verify(backend, never()).setex(anyString(), anyLong(), anyString());
    }

    @Test
    public void testDisabledLayersComputeDirectly() {
        cache.config.l2Enabled = false;

        call();
        call();

        assertEquals(2, computed.get());
        verifyNoInteractions(backend);
        verifyNoInteractions(l1);
    }
}
