package org.atmoswing.forecast.application.meta;

import org.atmoswing.forecast.api.dto.LastForecastDateResponse;
import org.atmoswing.forecast.api.dto.MethodConfigs;
import org.atmoswing.forecast.api.dto.MethodConfigsListResponse;
import org.atmoswing.forecast.api.dto.MethodInfo;
import org.atmoswing.forecast.api.dto.MethodsListResponse;
import org.atmoswing.forecast.api.dto.Parameters;
import org.atmoswing.forecast.application.Operations;
import org.atmoswing.forecast.config.ForecastApiConfig;
import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.core.model.ForecastDate;
import org.atmoswing.forecast.infrastructure.cache.Cacheable;
import org.atmoswing.forecast.infrastructure.cache.RequestCache;
import org.atmoswing.forecast.infrastructure.cache.warm.WarmCacheStore;
import org.atmoswing.forecast.infrastructure.dataset.ForecastDataset;
import org.atmoswing.forecast.infrastructure.dataset.ForecastDatasetReader;
import org.atmoswing.forecast.infrastructure.dataset.ForecastFileLayout;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Region level information: last forecast and the methods/configurations it contains.
 */
@ApplicationScoped
public class MetaService {

    private static final Logger log = LoggerFactory.getLogger(MetaService.class);

    @Inject
    ForecastApiConfig config;

    @Inject
    ForecastDatasetReader reader;

    @Inject
    RequestCache requestCache;

    @Inject
    WarmCacheStore warmStore;

    public LastForecastDateResponse lastForecastDate(String region) {
        Path regionPath = ForecastFileLayout.regionPath(config.getDataDir(), region);
        ForecastDate last = ForecastFileLayout.lastForecastDate(regionPath);
        return new LastForecastDateResponse(Parameters.of(region, null), last.format());
    }

    public MethodsListResponse listMethods(String region, String forecastDate) {
        Path regionPath = ForecastFileLayout.regionPath(config.getDataDir(), region);
        ForecastDate date = ForecastFileLayout.resolveForecastDate(regionPath, forecastDate);
        Cacheable cacheable = Operations.listMethods(region, date);
        return requestCache.cachedCall(cacheable, MethodsListResponse.class,
                () -> warmStore.readFresh(region, date, cacheable, MethodsListResponse.class)
                        .orElseGet(() -> computeMethods(regionPath, region, date)));
    }

    public MethodConfigsListResponse listMethodsAndConfigs(String region, String forecastDate) {
        Path regionPath = ForecastFileLayout.regionPath(config.getDataDir(), region);
        ForecastDate date = ForecastFileLayout.resolveForecastDate(regionPath, forecastDate);
        Cacheable cacheable = Operations.listMethodsAndConfigs(region, date);
        return requestCache.cachedCall(cacheable, MethodConfigsListResponse.class,
                () -> warmStore.readFresh(region, date, cacheable, MethodConfigsListResponse.class)
                        .orElseGet(() -> computeMethodsAndConfigs(regionPath, region, date)));
    }

    /**
     * Unique methods of a forecast, sorted by id.
     */
    public MethodsListResponse computeMethods(Path regionPath, String region, ForecastDate date) {
        Map<String, MethodInfo> methods = new LinkedHashMap<>();
        for (Path file : forecastFiles(regionPath, date)) {
            try (ForecastDataset ds = reader.open(file)) {
                methods.putIfAbsent(ds.methodId(), new MethodInfo(ds.methodId(), ds.methodName()));
            }
        }
        List<MethodInfo> sorted = new ArrayList<>(methods.values());
        sorted.sort(Comparator.comparing(MethodInfo::id));
        log.debug("Forecast {}/{} has {} methods", region, date, sorted.size());
        return new MethodsListResponse(Parameters.of(region, date.value()), sorted);
    }

    /**
     * Methods of a forecast with their configurations, methods sorted by id and configurations
     * in file order.
     */
    public MethodConfigsListResponse computeMethodsAndConfigs(Path regionPath, String region, ForecastDate date) {
        Map<String, MethodInfo> names = new LinkedHashMap<>();
        Map<String, List<MethodInfo>> configurations = new LinkedHashMap<>();
        for (Path file : forecastFiles(regionPath, date)) {
            try (ForecastDataset ds = reader.open(file)) {
                names.putIfAbsent(ds.methodId(), new MethodInfo(ds.methodId(), ds.methodName()));
                configurations.computeIfAbsent(ds.methodId(), id -> new ArrayList<>())
                        .add(new MethodInfo(ds.configurationId(), ds.configurationName()));
            }
        }
        List<MethodConfigs> methods = new ArrayList<>();
        names.forEach((id, info) -> methods.add(new MethodConfigs(id, info.name(), configurations.get(id))));
        methods.sort(Comparator.comparing(MethodConfigs::id));
        return new MethodConfigsListResponse(Parameters.of(region, date.value()), methods);
    }

    private static List<Path> forecastFiles(Path regionPath, ForecastDate date) {
        List<Path> files = ForecastFileLayout.listFiles(regionPath, date);
        if (files.isEmpty()) {
            throw new ForecastNotFoundException("No files found for date: " + date);
        }
        return files;
    }
}
