package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record SeriesPercentilesResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("target_dates") List<LocalDateTime> targetDates,
        @JsonProperty("series_percentiles") List<SeriesPercentile> seriesPercentiles) {
}
