package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SeriesPercentile(
        @JsonProperty("percentile") int percentile,
        @JsonProperty("series_values") List<Double> seriesValues) {
}
