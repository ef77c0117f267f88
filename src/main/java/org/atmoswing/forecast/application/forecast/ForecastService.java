package org.atmoswing.forecast.application.forecast;

import org.atmoswing.forecast.api.dto.Analog;
import org.atmoswing.forecast.api.dto.AnalogCriteriaResponse;
import org.atmoswing.forecast.api.dto.AnalogDatesResponse;
import org.atmoswing.forecast.api.dto.AnalogValuesPercentilesResponse;
import org.atmoswing.forecast.api.dto.AnalogValuesResponse;
import org.atmoswing.forecast.api.dto.AnalogsResponse;
import org.atmoswing.forecast.api.dto.Parameters;
import org.atmoswing.forecast.api.dto.ReferenceValuesResponse;
import org.atmoswing.forecast.api.dto.SeriesBestAnalogsResponse;
import org.atmoswing.forecast.api.dto.SeriesPercentile;
import org.atmoswing.forecast.api.dto.SeriesPercentilesResponse;
import org.atmoswing.forecast.config.ForecastApiConfig;
import org.atmoswing.forecast.core.engine.Percentiles;
import org.atmoswing.forecast.core.engine.Rounding;
import org.atmoswing.forecast.core.model.AnalogLayout;
import org.atmoswing.forecast.core.model.ForecastDate;
import org.atmoswing.forecast.core.model.TargetDates;
import org.atmoswing.forecast.infrastructure.cache.Cacheable;
import org.atmoswing.forecast.infrastructure.cache.RequestCache;
import org.atmoswing.forecast.infrastructure.dataset.ForecastDataset;
import org.atmoswing.forecast.infrastructure.dataset.ForecastDatasetReader;
import org.atmoswing.forecast.infrastructure.dataset.ForecastFileLayout;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Queries on a single forecast file, i.e. one method and one configuration.
 */
@ApplicationScoped
public class ForecastService {

    public static final List<Integer> DEFAULT_PERCENTILES = List.of(20, 60, 90);

    @Inject
    ForecastApiConfig config;

    @Inject
    ForecastDatasetReader reader;

    @Inject
    RequestCache requestCache;

    public AnalogDatesResponse analogDates(String region, String forecastDate, String method,
                                           String configuration, String targetDate) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        return requestCache.cachedCall(ref.cacheable("analog_dates", "target_date", targetDate),
                AnalogDatesResponse.class, () -> ref.read(ds -> {
                    LocalDateTime target = TargetDates.resolve(ref.date, targetDate);
                    AnalogLayout layout = ds.layout();
                    int lt = ds.targetDateIndex(target);
                    return new AnalogDatesResponse(ref.parameters().withTargetDate(target),
                            ds.analogDates(layout.start(lt), layout.end(lt)));
                }));
    }

    public AnalogCriteriaResponse analogCriteria(String region, String forecastDate, String method,
                                                 String configuration, String targetDate) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        return requestCache.cachedCall(ref.cacheable("analog_criteria", "target_date", targetDate),
                AnalogCriteriaResponse.class, () -> ref.read(ds -> {
                    LocalDateTime target = TargetDates.resolve(ref.date, targetDate);
                    AnalogLayout layout = ds.layout();
                    int lt = ds.targetDateIndex(target);
                    double[] criteria = ds.analogCriteria(layout.start(lt), layout.end(lt));
                    return new AnalogCriteriaResponse(ref.parameters().withTargetDate(target),
                            Rounding.round(criteria, Rounding.CRITERIA));
                }));
    }

    public AnalogValuesResponse analogValues(String region, String forecastDate, String method,
                                             String configuration, int entity, String targetDate) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        return requestCache.cachedCall(ref.cacheable("analog_values", "entity", entity, "target_date", targetDate),
                AnalogValuesResponse.class, () -> ref.read(ds -> {
                    LocalDateTime target = TargetDates.resolve(ref.date, targetDate);
                    double[] values = targetSlice(ds, entity, target, Integer.MAX_VALUE);
                    return new AnalogValuesResponse(ref.parameters().withEntity(entity).withTargetDate(target),
                            Rounding.round(values, Rounding.VALUES));
                }));
    }

    /**
     * The {@code number} first analogs of a target date, i.e. the best ones.
     */
    public AnalogValuesResponse analogValuesBest(String region, String forecastDate, String method,
                                                 String configuration, int entity, String targetDate, int number) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        requirePositive(number);
        return requestCache.cachedCall(ref.cacheable("analog_values_best", "entity", entity,
                        "target_date", targetDate, "number", number),
                AnalogValuesResponse.class, () -> ref.read(ds -> {
                    LocalDateTime target = TargetDates.resolve(ref.date, targetDate);
                    double[] values = targetSlice(ds, entity, target, number);
                    return new AnalogValuesResponse(ref.parameters().withEntity(entity).withTargetDate(target)
                            .withNumber(number), Rounding.round(values, Rounding.VALUES));
                }));
    }

    public AnalogValuesPercentilesResponse analogValuesPercentiles(String region, String forecastDate,
                                                                   String method, String configuration,
                                                                   int entity, String targetDate,
                                                                   List<Integer> percentiles) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        List<Integer> pcs = percentilesOrDefault(percentiles);
        return requestCache.cachedCall(ref.cacheable("analog_values_percentiles", "entity", entity,
                        "target_date", targetDate, "percentiles", pcs),
                AnalogValuesPercentilesResponse.class, () -> ref.read(ds -> {
                    LocalDateTime target = TargetDates.resolve(ref.date, targetDate);
                    double[] sorted = targetSlice(ds, entity, target, Integer.MAX_VALUE);
                    Arrays.sort(sorted);
                    double[] values = new double[pcs.size()];
                    for (int i = 0; i < values.length; i++) {
                        values[i] = Percentiles.ofSorted(sorted, pcs.get(i));
                    }
                    return new AnalogValuesPercentilesResponse(ref.parameters().withEntity(entity)
                            .withTargetDate(target).withPercentiles(pcs), pcs, Rounding.round(values, Rounding.VALUES));
                }));
    }

    /**
     * Analogs of a target date with their value for one entity, ranked from 1.
     */
    public AnalogsResponse analogs(String region, String forecastDate, String method, String configuration,
                                   int entity, String targetDate) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        return requestCache.cachedCall(ref.cacheable("analogs", "entity", entity, "target_date", targetDate),
                AnalogsResponse.class, () -> ref.read(ds -> {
                    LocalDateTime target = TargetDates.resolve(ref.date, targetDate);
                    int entityIdx = ds.entityIndex(entity);
                    AnalogLayout layout = ds.layout();
                    int lt = ds.targetDateIndex(target);
                    int start = layout.start(lt);
                    int end = layout.end(lt);
                    List<LocalDateTime> dates = ds.analogDates(start, end);
                    double[] criteria = ds.analogCriteria(start, end);
                    double[] values = ds.analogValues(entityIdx, start, end);
                    List<Analog> analogs = new ArrayList<>(dates.size());
                    for (int i = 0; i < dates.size(); i++) {
                        analogs.add(new Analog(dates.get(i), Rounding.round(values[i], Rounding.VALUES),
                                Rounding.round(criteria[i], Rounding.CRITERIA), i + 1));
                    }
                    return new AnalogsResponse(ref.parameters().withEntity(entity).withTargetDate(target), analogs);
                }));
    }

    /**
     * For every lead time, the {@code min(number, analogs)} best analog values of one entity.
     */
    public SeriesBestAnalogsResponse seriesBestAnalogs(String region, String forecastDate, String method,
                                                       String configuration, int entity, int number) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        requirePositive(number);
        return requestCache.cachedCall(ref.cacheable("series_values_best_analogs", "entity", entity,
                        "number", number),
                SeriesBestAnalogsResponse.class, () -> ref.read(ds -> {
                    int entityIdx = ds.entityIndex(entity);
                    AnalogLayout layout = ds.layout();
                    List<List<Double>> series = new ArrayList<>(layout.leadTimes());
                    for (int lt = 0; lt < layout.leadTimes(); lt++) {
                        int start = layout.start(lt);
                        int end = start + Math.min(number, layout.analogs(lt));
                        series.add(Rounding.round(ds.analogValues(entityIdx, start, end), Rounding.VALUES));
                    }
                    return new SeriesBestAnalogsResponse(ref.parameters().withEntity(entity).withNumber(number),
                            ds.targetDates(), series);
                }));
    }

    public SeriesPercentilesResponse seriesPercentiles(String region, String forecastDate, String method,
                                                       String configuration, int entity,
                                                       List<Integer> percentiles) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        List<Integer> pcs = percentilesOrDefault(percentiles);
        return requestCache.cachedCall(ref.cacheable("series_values_percentiles", "entity", entity,
                        "percentiles", pcs),
                SeriesPercentilesResponse.class, () -> ref.read(ds -> {
                    int entityIdx = ds.entityIndex(entity);
                    AnalogLayout layout = ds.layout();
                    double[][] values = new double[pcs.size()][layout.leadTimes()];
                    for (int lt = 0; lt < layout.leadTimes(); lt++) {
                        double[] sorted = ds.analogValues(entityIdx, layout.start(lt), layout.end(lt));
                        Arrays.sort(sorted);
                        for (int p = 0; p < pcs.size(); p++) {
                            values[p][lt] = Percentiles.ofSorted(sorted, pcs.get(p));
                        }
                    }
                    List<SeriesPercentile> series = new ArrayList<>(pcs.size());
                    for (int p = 0; p < pcs.size(); p++) {
                        series.add(new SeriesPercentile(pcs.get(p), Rounding.round(values[p], Rounding.VALUES)));
                    }
                    return new SeriesPercentilesResponse(ref.parameters().withEntity(entity).withPercentiles(pcs),
                            ds.targetDates(), series);
                }));
    }

    public ReferenceValuesResponse referenceValues(String region, String forecastDate, String method,
                                                   String configuration, int entity) {
        FileRef ref = locate(region, forecastDate, method, configuration);
        return requestCache.cachedCall(ref.cacheable("reference_values", "entity", entity),
                ReferenceValuesResponse.class, () -> ref.read(ds -> {
                    int entityIdx = ds.entityIndex(entity);
                    return new ReferenceValuesResponse(ref.parameters().withEntity(entity),
                            Rounding.round(ds.referenceAxis(), Rounding.AXIS),
                            Rounding.round(ds.referenceValues(entityIdx), Rounding.VALUES));
                }));
    }

    private FileRef locate(String region, String forecastDate, String method, String configuration) {
        Path regionPath = ForecastFileLayout.regionPath(config.getDataDir(), region);
        ForecastDate date = ForecastFileLayout.resolveForecastDate(regionPath, forecastDate);
        Path file = ForecastFileLayout.filePath(regionPath, date, method, configuration);
        return new FileRef(region, date, method, configuration, file);
    }

    private static double[] targetSlice(ForecastDataset ds, int entity, LocalDateTime target, int limit) {
        int entityIdx = ds.entityIndex(entity);
        AnalogLayout layout = ds.layout();
        int lt = ds.targetDateIndex(target);
        int start = layout.start(lt);
        int end = start + Math.min(limit, layout.analogs(lt));
        return ds.analogValues(entityIdx, start, end);
    }

    private static List<Integer> percentilesOrDefault(List<Integer> percentiles) {
        List<Integer> pcs = percentiles == null || percentiles.isEmpty() ? DEFAULT_PERCENTILES : List.copyOf(percentiles);
        pcs.forEach(p -> Percentiles.fraction(p));
        return pcs;
    }

    private static void requirePositive(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Number of analogs must be positive: " + number);
        }
    }

    private final class FileRef {
        private final String region;
        private final ForecastDate date;
        private final String method;
        private final String configuration;
        private final Path file;

        private FileRef(String region, ForecastDate date, String method, String configuration, Path file) {
            this.region = region;
            this.date = date;
            this.method = method;
            this.configuration = configuration;
            this.file = file;
        }

        Parameters parameters() {
            return Parameters.of(region, date.value()).withMethod(method).withConfiguration(configuration);
        }

        Cacheable cacheable(String operation, Object... extra) {
            Object[] args = new Object[8 + extra.length];
            Object[] base = {"region", region, "forecast_date", date.format(), "method", method,
                    "configuration", configuration};
            System.arraycopy(base, 0, args, 0, base.length);
            System.arraycopy(extra, 0, args, base.length, extra.length);
            return Cacheable.of(operation, args);
        }

        <T> T read(Function<ForecastDataset, T> query) {
            try (ForecastDataset ds = reader.open(file)) {
                return query.apply(ds);
            }
        }
    }
}
