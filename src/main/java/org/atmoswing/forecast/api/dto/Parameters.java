package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Echo of the request parameters, included in every response. Unset fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Parameters(
        @JsonProperty("region") String region,
        @JsonProperty("forecast_date") LocalDateTime forecastDate,
        @JsonProperty("target_date") LocalDateTime targetDate,
        @JsonProperty("method") String method,
        @JsonProperty("configuration") String configuration,
        @JsonProperty("entity_id") Integer entityId,
        @JsonProperty("lead_time") String leadTime,
        @JsonProperty("percentile") Integer percentile,
        @JsonProperty("percentiles") List<Integer> percentiles,
        @JsonProperty("normalize") Integer normalize,
        @JsonProperty("number") Integer number) {

    public static Parameters of(String region, LocalDateTime forecastDate) {
        return new Parameters(region, forecastDate, null, null, null, null, null, null, null, null, null);
    }

    public Parameters withTargetDate(LocalDateTime value) {
        return new Parameters(region, forecastDate, value, method, configuration, entityId, leadTime,
                percentile, percentiles, normalize, number);
    }

    public Parameters withMethod(String value) {
        return new Parameters(region, forecastDate, targetDate, value, configuration, entityId, leadTime,
                percentile, percentiles, normalize, number);
    }

    public Parameters withConfiguration(String value) {
        return new Parameters(region, forecastDate, targetDate, method, value, entityId, leadTime,
                percentile, percentiles, normalize, number);
    }

    public Parameters withEntity(Integer value) {
        return new Parameters(region, forecastDate, targetDate, method, configuration, value, leadTime,
                percentile, percentiles, normalize, number);
    }

    public Parameters withLeadTime(String value) {
        return new Parameters(region, forecastDate, targetDate, method, configuration, entityId, value,
                percentile, percentiles, normalize, number);
    }

    public Parameters withPercentile(Integer value) {
        return new Parameters(region, forecastDate, targetDate, method, configuration, entityId, leadTime,
                value, percentiles, normalize, number);
    }

    public Parameters withPercentiles(List<Integer> value) {
        return new Parameters(region, forecastDate, targetDate, method, configuration, entityId, leadTime,
                percentile, value, normalize, number);
    }

    public Parameters withNormalize(Integer value) {
        return new Parameters(region, forecastDate, targetDate, method, configuration, entityId, leadTime,
                percentile, percentiles, value, number);
    }

    public Parameters withNumber(Integer value) {
        return new Parameters(region, forecastDate, targetDate, method, configuration, entityId, leadTime,
                percentile, percentiles, normalize, value);
    }
}
