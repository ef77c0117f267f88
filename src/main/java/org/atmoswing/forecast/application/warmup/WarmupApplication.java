package org.atmoswing.forecast.application.warmup;

import org.atmoswing.forecast.config.ForecastApiConfig;
import io.quarkus.runtime.QuarkusApplication;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one warmup sweep and exits. The exit code is always 0, problems are only logged.
 */
public class WarmupApplication implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(WarmupApplication.class);

    @Inject
    ForecastApiConfig config;

    @Inject
    WarmupDriver driver;

    @Override
    public int run(String... args) {
        WarmupOptions options;
        try {
            options = WarmupOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("[Warmup] {}", e.getMessage());
            log.error("[Warmup] {}", WarmupOptions.USAGE);
            return 0;
        }
        if (options.getDataDir() != null) {
            config.overrideDataDir(options.getDataDir());
        }
        try {
            WarmupReport report = driver.run(options);
            log.info("[Warmup] Finished ({})", report);
        } catch (RuntimeException e) {
            log.error("[Warmup] Sweep aborted: {}", e.getMessage(), e);
        }
        return 0;
    }
}
