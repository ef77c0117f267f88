package org.atmoswing.forecast.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Location of the forecast files and of the prebuilt (warm) cache.
 */
@ApplicationScoped
public class ForecastApiConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastApiConfig.class);

    @ConfigProperty(name = "forecast.data-dir", defaultValue = "./data")
    String dataDir;

    @ConfigProperty(name = "forecast.prebuilt-dir-name", defaultValue = ".prebuilt_cache")
    String prebuiltDirName;

    @ConfigProperty(name = "forecast.warm.enabled", defaultValue = "true")
    boolean warmEnabled;

    @ConfigProperty(name = "forecast.warm.lock-timeout-millis", defaultValue = "5000")
    long lockTimeoutMillis;

    @PostConstruct
    void init() {
        log.info("Data directory: {}", getDataDir());
        log.info("Warm cache:     {} ({}, lock timeout {}ms)",
                warmEnabled ? "ENABLED" : "DISABLED", getPrebuiltDir(), lockTimeoutMillis);
    }

    public Path getDataDir() {
        return Paths.get(dataDir).toAbsolutePath().normalize();
    }

    public Path getPrebuiltDir() {
        return getDataDir().resolve(prebuiltDirName);
    }

    public boolean isWarmEnabled() {
        return warmEnabled;
    }

    public Duration getLockTimeout() {
        return Duration.ofMillis(lockTimeoutMillis);
    }

    /**
     * Points the configuration at another data directory, used by the warmup command line.
     */
    public void overrideDataDir(String dataDir) {
        this.dataDir = dataDir;
        log.info("Data directory overridden: {}", getDataDir());
    }
}
