package org.atmoswing.forecast.infrastructure.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CacheKeyTest {

    @Test
    public void testArgumentOrderDoesNotMatter() {
        CacheKey a = CacheKey.of(Cacheable.of("series_synthesis_total", "region", "alpes", "percentile", 90));
        CacheKey b = CacheKey.of(Cacheable.of("series_synthesis_total", "percentile", 90, "region", "alpes"));

        assertEquals(a, b);
        assertEquals(a.hash(), b.hash());
    }

    @Test
    public void testOperationAndValuesMatter() {
        CacheKey base = CacheKey.of(Cacheable.of("list_methods", "region", "alpes"));

        assertNotEquals(base.hash(), CacheKey.of(Cacheable.of("list_methods_and_configs", "region", "alpes")).hash());
        assertNotEquals(base.hash(), CacheKey.of(Cacheable.of("list_methods", "region", "jura")).hash());
        assertNotEquals(base.hash(), CacheKey.of(Cacheable.of("list_methods", "region", "alpes", "x", null)).hash());
    }

    @Test
    public void testKeyFormats() {
        CacheKey key = CacheKey.of(Cacheable.of("list_methods", "region", "alpes"));

        assertTrue(key.hash().matches("[0-9a-f]{64}"));
        assertEquals(key.hash(), key.toL2Key());
        assertEquals("list_methods:" + key.hash(), key.toL1Key());
        assertEquals("list_methods:" + key.hash().substring(0, 12), key.toString());
    }

    @Test
    public void testCanonicalArgumentsSorted() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("b", 1);
        args.put("a", List.of(2, 3));
        args.put("c", null);

        assertEquals("{\"a\":[2,3],\"b\":1,\"c\":null}", CacheKey.canonicalArguments(args));
    }

    @Test
    public void testUnserializableArgumentsFallBackToText() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("z", new Opaque());
        args.put("a", 1);

        assertEquals("{a=1, z=opaque}", CacheKey.canonicalArguments(args));
        assertEquals(CacheKey.of(new Cacheable("op", args)), CacheKey.of(new Cacheable("op", args)));
    }

    @Test
    public void testBlankOperationRejected() {
        assertThrows(IllegalArgumentException.class, () -> Cacheable.of(" ", "a", 1));
        assertThrows(IllegalArgumentException.class, () -> Cacheable.of("op", "a"));
    }

    static class Opaque {
        @Override
        public String toString() {
            return "opaque";
        }
    }
}
