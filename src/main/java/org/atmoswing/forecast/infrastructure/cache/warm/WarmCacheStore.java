package org.atmoswing.forecast.infrastructure.cache.warm;

import org.atmoswing.forecast.config.ForecastApiConfig;
import org.atmoswing.forecast.core.model.ForecastDate;
import org.atmoswing.forecast.infrastructure.cache.CacheKey;
import org.atmoswing.forecast.infrastructure.cache.Cacheable;
import org.atmoswing.forecast.infrastructure.dataset.ForecastFileLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Optional;

/**
 * File-based store of prebuilt results:
 * {@code <prebuilt-dir>/<region>/<operation>/<YYYY-MM-DDThh>.<hash>.json}.
 * <p>
 * An entry is fresh when it is at least as recent as every source file of its forecast.
 * Writers hold {@code <entry>.lock} and replace the entry through an atomic move, so readers
 * see either the previous or the new content.
 */
@ApplicationScoped
public class WarmCacheStore {

    private static final Logger log = LoggerFactory.getLogger(WarmCacheStore.class);

    @Inject
    ForecastApiConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    MeterRegistry registry;

    public Path entryPath(String region, ForecastDate forecastDate, Cacheable cacheable) {
        ForecastFileLayout.validatePathSafe(region);
        CacheKey key = CacheKey.of(cacheable);
        return config.getPrebuiltDir()
                .resolve(region)
                .resolve(cacheable.operation())
                .resolve(forecastDate.format() + "." + key.hash() + ".json");
    }

    /**
     * Latest modification time of the source files of a forecast, empty when there are none.
     */
    public Optional<FileTime> sourceWatermark(String region, ForecastDate forecastDate) {
        ForecastFileLayout.validatePathSafe(region);
        return ForecastFileLayout.latestModified(config.getDataDir().resolve(region), forecastDate);
    }

    public boolean isFresh(Path entry, FileTime watermark) {
        if (!Files.isRegularFile(entry)) {
            return false;
        }
        try {
            return Files.getLastModifiedTime(entry).compareTo(watermark) >= 0;
        } catch (IOException e) {
            log.warn("[Warm Cache] Cannot stat {}: {}", entry, e.getMessage());
            return false;
        }
    }

    /**
     * The stored result when the entry exists and is fresh. Corrupt entries are ignored.
     */
    public <T> Optional<T> readFresh(String region, ForecastDate forecastDate, Cacheable cacheable, Class<T> type) {
        if (!config.isWarmEnabled()) {
            return Optional.empty();
        }
        Optional<FileTime> watermark = sourceWatermark(region, forecastDate);
        if (watermark.isEmpty()) {
            return Optional.empty();
        }
        Path entry = entryPath(region, forecastDate, cacheable);
        if (!isFresh(entry, watermark.get())) {
            return Optional.empty();
        }
        try {
            WarmCacheEntry stored = objectMapper.readValue(entry.toFile(), WarmCacheEntry.class);
            if (stored.result() == null || stored.result().isNull()) {
                return Optional.empty();
            }
            T result = objectMapper.treeToValue(stored.result(), type);
            registry.counter("forecast.warm.reads", "result", "hit").increment();
            log.debug("[Warm Cache] Hit: {}", entry);
            return Optional.ofNullable(result);
        } catch (IOException e) {
            registry.counter("forecast.warm.reads", "result", "corrupt").increment();
            log.warn("[Warm Cache] Ignoring unreadable entry {}: {}", entry, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes an entry under its lock.
     *
     * @throws LockBusyException when another writer holds the lock past the timeout
     */
    public Path write(String region, ForecastDate forecastDate, Cacheable cacheable, Object result,
                      FileTime watermark) {
        Path entry = entryPath(region, forecastDate, cacheable);
        Path dir = entry.getParent();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + dir, e);
        }

        AdvisoryFileLock lock = new AdvisoryFileLock(config.getLockTimeout());
        try (LockHandle ignored = lock.acquire(entry.resolveSibling(entry.getFileName() + ".lock"))) {
            WarmCacheEntry stored = new WarmCacheEntry(
                    Instant.now().toString(),
                    watermark.toInstant().toString(),
                    objectMapper.valueToTree(result));
            writeAtomically(entry, stored);
        }
        registry.counter("forecast.warm.writes").increment();
        log.info("[Warm Cache] Wrote {}", entry);
        return entry;
    }

    private void writeAtomically(Path entry, WarmCacheEntry stored) {
        Path tempPath = null;
        try {
            tempPath = Files.createTempFile(entry.getParent(), entry.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tempPath.toFile(), stored);
            Files.move(tempPath, entry, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteTemp(tempPath);
            throw new UncheckedIOException("Failed to write " + entry, e);
        }
    }

    private static void deleteTemp(Path tempPath) {
        if (tempPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException e) {
            log.warn("[Warm Cache] Failed to delete temp file {}: {}", tempPath, e.getMessage());
        }
    }
}
