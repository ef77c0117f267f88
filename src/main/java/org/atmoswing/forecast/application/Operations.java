package org.atmoswing.forecast.application;

import org.atmoswing.forecast.core.model.ForecastDate;
import org.atmoswing.forecast.infrastructure.cache.Cacheable;

/**
 * Names and cache identities of the operations shared by the request path and the warmup.
 * Both sides build their {@link Cacheable} here so they derive the same cache key.
 */
public final class Operations {

    public static final String ENTITIES_ANALOG_VALUES_PERCENTILE = "entities_analog_values_percentile";
    public static final String SERIES_SYNTHESIS_PER_METHOD = "series_synthesis_per_method";
    public static final String SERIES_SYNTHESIS_TOTAL = "series_synthesis_total";
    public static final String LIST_METHODS = "list_methods";
    public static final String LIST_METHODS_AND_CONFIGS = "list_methods_and_configs";

    private Operations() {
    }

    public static Cacheable entitiesAnalogValuesPercentile(String region, ForecastDate forecastDate, String method,
                                                           String leadTime, int percentile, Integer normalize) {
        return Cacheable.of(ENTITIES_ANALOG_VALUES_PERCENTILE,
                "region", region,
                "forecast_date", forecastDate.format(),
                "method", method,
                "lead_time", leadTime.trim(),
                "percentile", percentile,
                "normalize", normalize);
    }

    public static Cacheable seriesSynthesisPerMethod(String region, ForecastDate forecastDate, int percentile,
                                                     Integer normalize) {
        return Cacheable.of(SERIES_SYNTHESIS_PER_METHOD,
                "region", region,
                "forecast_date", forecastDate.format(),
                "percentile", percentile,
                "normalize", normalize);
    }

    public static Cacheable seriesSynthesisTotal(String region, ForecastDate forecastDate, int percentile,
                                                 Integer normalize) {
        return Cacheable.of(SERIES_SYNTHESIS_TOTAL,
                "region", region,
                "forecast_date", forecastDate.format(),
                "percentile", percentile,
                "normalize", normalize);
    }

    public static Cacheable listMethods(String region, ForecastDate forecastDate) {
        return Cacheable.of(LIST_METHODS, "region", region, "forecast_date", forecastDate.format());
    }

    public static Cacheable listMethodsAndConfigs(String region, ForecastDate forecastDate) {
        return Cacheable.of(LIST_METHODS_AND_CONFIGS, "region", region, "forecast_date", forecastDate.format());
    }
}
