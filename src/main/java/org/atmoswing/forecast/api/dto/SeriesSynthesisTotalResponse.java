package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SeriesSynthesisTotalResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("series_percentiles") List<TimeStepSynthesis> seriesPercentiles) {
}
