package org.atmoswing.forecast.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cache key shared by every cache layer and by the warm store.
 * <p>
 * Format: SHA-256 hex of {@code <operation>:<canonical json of the arguments>}. Map entries
 * and bean properties are serialized in key order. Arguments Jackson cannot serialize fall
 * back to the text of a {@link TreeMap}.
 */
public final class CacheKey {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private final String operation;
    private final String hash;

    private CacheKey(String operation, String hash) {
        this.operation = operation;
        this.hash = hash;
    }

    public static CacheKey of(Cacheable cacheable) {
        String payload = cacheable.operation() + ":" + canonicalArguments(cacheable.arguments());
        return new CacheKey(cacheable.operation(), sha256(payload));
    }

    static String canonicalArguments(Map<String, Object> arguments) {
        try {
            return CANONICAL.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return new TreeMap<>(arguments).toString();
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String operation() {
        return operation;
    }

    /** 64 hex characters. */
    public String hash() {
        return hash;
    }

    /**
     * L1 (Caffeine) key.
     */
    public String toL1Key() {
        return operation + ":" + hash;
    }

    /**
     * L2 (Redis) key, the bare hash so other processes sharing the instance compute the same key.
     */
    public String toL2Key() {
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        CacheKey other = (CacheKey) o;
        return Objects.equals(operation, other.operation) && Objects.equals(hash, other.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, hash);
    }

    @Override
    public String toString() {
        return operation + ":" + hash.substring(0, 12);
    }
}
