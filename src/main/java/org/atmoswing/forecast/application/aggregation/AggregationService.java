package org.atmoswing.forecast.application.aggregation;

import org.atmoswing.forecast.api.dto.EntitiesValuesPercentileResponse;
import org.atmoswing.forecast.api.dto.MethodSynthesis;
import org.atmoswing.forecast.api.dto.Parameters;
import org.atmoswing.forecast.api.dto.SeriesSynthesisPerMethodResponse;
import org.atmoswing.forecast.api.dto.SeriesSynthesisTotalResponse;
import org.atmoswing.forecast.api.dto.TimeStepSynthesis;
import org.atmoswing.forecast.application.Operations;
import org.atmoswing.forecast.config.ForecastApiConfig;
import org.atmoswing.forecast.core.engine.EntitiesPercentileAccumulator;
import org.atmoswing.forecast.core.engine.MethodSeriesAccumulator;
import org.atmoswing.forecast.core.engine.Rounding;
import org.atmoswing.forecast.core.engine.SeriesSynthesizer;
import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import org.atmoswing.forecast.core.model.EntityValues;
import org.atmoswing.forecast.core.model.ForecastDate;
import org.atmoswing.forecast.core.model.MethodSeries;
import org.atmoswing.forecast.core.model.TargetDates;
import org.atmoswing.forecast.core.model.TimeStepSeries;
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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Aggregations over all files of a forecast.
 * <p>
 * The public entry points go through the request cache, then the warm store, and only compute
 * on a double miss. The {@code compute*} methods always read the files and are what the warmup
 * stores.
 */
@ApplicationScoped
public class AggregationService {

    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    @Inject
    ForecastApiConfig config;

    @Inject
    ForecastDatasetReader reader;

    @Inject
    RequestCache requestCache;

    @Inject
    WarmCacheStore warmStore;

    public EntitiesValuesPercentileResponse entitiesAnalogValuesPercentile(String region, String forecastDate,
                                                                           String method, String leadTime,
                                                                           int percentile, Integer normalize) {
        Path regionPath = ForecastFileLayout.regionPath(config.getDataDir(), region);
        ForecastDate date = ForecastFileLayout.resolveForecastDate(regionPath, forecastDate);
        Cacheable cacheable = Operations.entitiesAnalogValuesPercentile(region, date, method, leadTime,
                percentile, normalize);
        return requestCache.cachedCall(cacheable, EntitiesValuesPercentileResponse.class,
                () -> warmStore.readFresh(region, date, cacheable, EntitiesValuesPercentileResponse.class)
                        .orElseGet(() -> computeEntitiesAnalogValuesPercentile(regionPath, region, date, method,
                                leadTime, percentile, normalize)));
    }

    public SeriesSynthesisPerMethodResponse seriesSynthesisPerMethod(String region, String forecastDate,
                                                                     int percentile, Integer normalize) {
        Path regionPath = ForecastFileLayout.regionPath(config.getDataDir(), region);
        ForecastDate date = ForecastFileLayout.resolveForecastDate(regionPath, forecastDate);
        Cacheable cacheable = Operations.seriesSynthesisPerMethod(region, date, percentile, normalize);
        return requestCache.cachedCall(cacheable, SeriesSynthesisPerMethodResponse.class,
                () -> warmStore.readFresh(region, date, cacheable, SeriesSynthesisPerMethodResponse.class)
                        .orElseGet(() -> computeSeriesSynthesisPerMethod(regionPath, region, date, percentile,
                                normalize)));
    }

    public SeriesSynthesisTotalResponse seriesSynthesisTotal(String region, String forecastDate,
                                                             int percentile, Integer normalize) {
        Path regionPath = ForecastFileLayout.regionPath(config.getDataDir(), region);
        ForecastDate date = ForecastFileLayout.resolveForecastDate(regionPath, forecastDate);
        Cacheable cacheable = Operations.seriesSynthesisTotal(region, date, percentile, normalize);
        return requestCache.cachedCall(cacheable, SeriesSynthesisTotalResponse.class,
                () -> warmStore.readFresh(region, date, cacheable, SeriesSynthesisTotalResponse.class)
                        .orElseGet(() -> computeSeriesSynthesisTotal(regionPath, region, date, percentile,
                                normalize)));
    }

    public EntitiesValuesPercentileResponse computeEntitiesAnalogValuesPercentile(Path regionPath, String region,
                                                                                  ForecastDate date, String method,
                                                                                  String leadTime, int percentile,
                                                                                  Integer normalize) {
        LocalDateTime targetDate = TargetDates.resolve(date, leadTime);
        List<Path> files = ForecastFileLayout.listFiles(regionPath, date, method);
        if (files.isEmpty()) {
            throw new ForecastNotFoundException("No files found for " + region + " " + date + " " + method);
        }

        EntitiesPercentileAccumulator accumulator =
                new EntitiesPercentileAccumulator(targetDate, percentile, normalize);
        readAll(files, accumulator::accept);
        EntityValues result = accumulator.result();

        Parameters parameters = Parameters.of(region, date.value())
                .withTargetDate(targetDate)
                .withMethod(method)
                .withLeadTime(leadTime.trim())
                .withPercentile(percentile)
                .withNormalize(normalize);
        return new EntitiesValuesPercentileResponse(parameters,
                Arrays.stream(result.entityIds()).boxed().toList(),
                Rounding.round(result.values(), Rounding.VALUES));
    }

    public SeriesSynthesisPerMethodResponse computeSeriesSynthesisPerMethod(Path regionPath, String region,
                                                                            ForecastDate date, int percentile,
                                                                            Integer normalize) {
        List<MethodSeries> series = largestPerMethod(regionPath, date, percentile, normalize);
        List<MethodSynthesis> out = new ArrayList<>(series.size());
        for (MethodSeries s : series) {
            out.add(new MethodSynthesis(s.methodId(), s.targetDates(), Rounding.round(s.values(), Rounding.VALUES)));
        }
        return new SeriesSynthesisPerMethodResponse(synthesisParameters(region, date, percentile, normalize), out);
    }

    public SeriesSynthesisTotalResponse computeSeriesSynthesisTotal(Path regionPath, String region,
                                                                    ForecastDate date, int percentile,
                                                                    Integer normalize) {
        List<TimeStepSeries> merged =
                SeriesSynthesizer.mergeByTimeStep(largestPerMethod(regionPath, date, percentile, normalize));
        List<TimeStepSynthesis> out = new ArrayList<>(merged.size());
        for (TimeStepSeries s : merged) {
            out.add(new TimeStepSynthesis(s.timeStep(), s.targetDates(), Rounding.round(s.values(), Rounding.VALUES)));
        }
        return new SeriesSynthesisTotalResponse(synthesisParameters(region, date, percentile, normalize), out);
    }

    private List<MethodSeries> largestPerMethod(Path regionPath, ForecastDate date, int percentile,
                                                Integer normalize) {
        List<Path> files = ForecastFileLayout.listFiles(regionPath, date);
        if (files.isEmpty()) {
            throw new ForecastNotFoundException("No files found for date: " + date);
        }
        MethodSeriesAccumulator accumulator = new MethodSeriesAccumulator(percentile, normalize);
        readAll(files, accumulator::accept);
        return accumulator.result();
    }

    private void readAll(List<Path> files, Consumer<ForecastDataset> consumer) {
        long t0 = System.currentTimeMillis();
        for (Path file : files) {
            try (ForecastDataset ds = reader.open(file)) {
                consumer.accept(ds);
            }
        }
        log.debug("Aggregated {} files in {}ms", files.size(), System.currentTimeMillis() - t0);
    }

    private static Parameters synthesisParameters(String region, ForecastDate date, int percentile,
                                                  Integer normalize) {
        return Parameters.of(region, date.value())
                .withPercentile(percentile)
                .withNormalize(normalize);
    }
}
