package org.atmoswing.forecast.application.warmup;

import org.atmoswing.forecast.api.dto.MethodInfo;
import org.atmoswing.forecast.application.Operations;
import org.atmoswing.forecast.application.aggregation.AggregationService;
import org.atmoswing.forecast.application.meta.MetaService;
import org.atmoswing.forecast.config.ForecastApiConfig;
import org.atmoswing.forecast.core.model.ForecastDate;
import org.atmoswing.forecast.infrastructure.cache.Cacheable;
import org.atmoswing.forecast.infrastructure.cache.warm.LockBusyException;
import org.atmoswing.forecast.infrastructure.cache.warm.WarmCacheStore;
import org.atmoswing.forecast.infrastructure.dataset.ForecastFileLayout;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Prebuilds the warm cache for the recent forecasts of every region.
 * <p>
 * An entry is rebuilt only when it is older than the source files of its forecast. A failing
 * entry, including one whose lock stays busy, is logged and the sweep moves on.
 */
@ApplicationScoped
public class WarmupDriver {

    private static final Logger log = LoggerFactory.getLogger(WarmupDriver.class);

    @Inject
    ForecastApiConfig config;

    @Inject
    AggregationService aggregationService;

    @Inject
    MetaService metaService;

    @Inject
    WarmCacheStore warmStore;

    Clock clock = Clock.systemUTC();

    public WarmupReport run(WarmupOptions options) {
        WarmupReport report = new WarmupReport();
        Path dataDir = config.getDataDir();
        if (!Files.isDirectory(dataDir)) {
            log.warn("[Warmup] Data directory not found: {}", dataDir);
            return report;
        }

        List<String> regions = ForecastFileLayout.listRegions(dataDir);
        if (options.getRegions() != null) {
            regions = regions.stream().filter(options.getRegions()::contains).collect(Collectors.toList());
        }
        Instant since = clock.instant().minus(Duration.ofDays(options.getDays()));

        for (String region : regions) {
            try {
                warmRegion(report, options, dataDir.resolve(region), region, since);
            } catch (RuntimeException e) {
                log.error("[Warmup] Region {} failed: {}", region, e.getMessage(), e);
                report.recordFailed();
            }
        }
        log.info("[Warmup] Done: {}", report);
        return report;
    }

    private void warmRegion(WarmupReport report, WarmupOptions options, Path regionPath, String region,
                            Instant since) {
        SortedSet<ForecastDate> dates = ForecastFileLayout.recentForecastDates(regionPath, since);
        if (dates.isEmpty()) {
            log.info("[Warmup] No recent forecasts for region {}", region);
            return;
        }
        for (ForecastDate date : dates) {
            for (String function : options.getFunctions()) {
                try {
                    warm(report, options, regionPath, region, date, function);
                } catch (RuntimeException e) {
                    log.error("[Warmup] Failed {} {} {}: {}", function, region, date, e.getMessage(), e);
                    report.recordFailed();
                }
            }
        }
    }

    private void warm(WarmupReport report, WarmupOptions options, Path regionPath, String region,
                      ForecastDate date, String function) {
        Optional<WarmupOperation> operation = WarmupOperation.fromName(function);
        if (operation.isEmpty()) {
            log.warn("[Warmup] Unknown function: {}", function);
            report.recordSkipped();
            return;
        }
        Optional<FileTime> watermark = warmStore.sourceWatermark(region, date);
        if (watermark.isEmpty()) {
            log.info("[Warmup] No sources {} {}", region, date);
            report.recordSkipped();
            return;
        }

        int percentile = options.getPercentile();
        Integer normalize = options.getNormalize();
        switch (operation.get()) {
            case SERIES_SYNTHESIS_PER_METHOD:
                refresh(report, options, region, date, watermark.get(),
                        Operations.seriesSynthesisPerMethod(region, date, percentile, normalize),
                        () -> aggregationService.computeSeriesSynthesisPerMethod(regionPath, region, date,
                                percentile, normalize));
                break;
            case SERIES_SYNTHESIS_TOTAL:
                refresh(report, options, region, date, watermark.get(),
                        Operations.seriesSynthesisTotal(region, date, percentile, normalize),
                        () -> aggregationService.computeSeriesSynthesisTotal(regionPath, region, date,
                                percentile, normalize));
                break;
            case LIST_METHODS:
                refresh(report, options, region, date, watermark.get(),
                        Operations.listMethods(region, date),
                        () -> metaService.computeMethods(regionPath, region, date));
                break;
            case LIST_METHODS_AND_CONFIGS:
                refresh(report, options, region, date, watermark.get(),
                        Operations.listMethodsAndConfigs(region, date),
                        () -> metaService.computeMethodsAndConfigs(regionPath, region, date));
                break;
            case ENTITIES_ANALOG_VALUES_PERCENTILE:
                warmEntities(report, options, regionPath, region, date, watermark.get());
                break;
            default:
                throw new IllegalStateException("Unhandled operation " + operation.get());
        }
    }

    private void warmEntities(WarmupReport report, WarmupOptions options, Path regionPath, String region,
                              ForecastDate date, FileTime watermark) {
        List<String> methods = options.getMethods();
        if (methods == null) {
            try {
                methods = metaService.computeMethods(regionPath, region, date).methods().stream()
                        .map(MethodInfo::id)
                        .collect(Collectors.toList());
            } catch (RuntimeException e) {
                log.error("[Warmup] Cannot list methods of {} {}: {}", region, date, e.getMessage(), e);
                report.recordFailed();
                return;
            }
        }
        for (String method : methods) {
            for (Integer leadTime : options.getLeadTimes()) {
                String lt = String.valueOf(leadTime);
                refresh(report, options, region, date, watermark,
                        Operations.entitiesAnalogValuesPercentile(region, date, method, lt,
                                options.getPercentile(), options.getNormalize()),
                        () -> aggregationService.computeEntitiesAnalogValuesPercentile(regionPath, region, date,
                                method, lt, options.getPercentile(), options.getNormalize()));
            }
        }
    }

    private void refresh(WarmupReport report, WarmupOptions options, String region, ForecastDate date,
                         FileTime watermark, Cacheable cacheable, Supplier<Object> compute) {
        Path entry = warmStore.entryPath(region, date, cacheable);
        String label = cacheable.operation() + " " + region + " " + date + " " + cacheable.arguments();
        if (warmStore.isFresh(entry, watermark)) {
            log.info("[Warmup] Up-to-date: {}", label);
            report.recordUpToDate();
            return;
        }
        if (options.isDryRun()) {
            log.info("[Warmup] [DRY] Would write {}", entry.getFileName());
            report.recordPlanned();
            return;
        }
        log.info("[Warmup] Build {}", label);
        try {
            Object result = compute.get();
            warmStore.write(region, date, cacheable, result, watermark);
            report.recordBuilt();
        } catch (LockBusyException e) {
            log.warn("[Warmup] Lock busy: {}", entry.getFileName());
            report.recordFailed();
        } catch (RuntimeException e) {
            log.error("[Warmup] Failed {}: {}", label, e.getMessage(), e);
            report.recordFailed();
        }
    }
}
