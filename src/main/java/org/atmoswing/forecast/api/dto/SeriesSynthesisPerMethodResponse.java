package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SeriesSynthesisPerMethodResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("series_percentiles") List<MethodSynthesis> seriesPercentiles) {
}
