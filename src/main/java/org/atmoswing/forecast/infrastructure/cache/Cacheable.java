package org.atmoswing.forecast.infrastructure.cache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named operation together with every argument that affects its result.
 * Two cacheables with the same operation and equal arguments map to the same {@link CacheKey},
 * whatever the order the arguments were given in.
 */
public record Cacheable(String operation, Map<String, Object> arguments) {

    public Cacheable {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Cacheable operation must not be blank");
        }
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * Builds a cacheable from alternating argument names and values. Null values are kept.
     */
    public static Cacheable of(String operation, Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Arguments must be given as name/value pairs");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            args.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
        }
        return new Cacheable(operation, args);
    }
}
